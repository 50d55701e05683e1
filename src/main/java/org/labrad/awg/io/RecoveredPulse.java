package org.labrad.awg.io;

import org.labrad.awg.enums.OutputChannel;

import com.google.common.base.Objects;

/**
 * A pulse found in written waveform files, timed in samples from the start of
 * its scan point. Marker pulses have amplitude 1.
 */
public final class RecoveredPulse {
  private final OutputChannel channel;
  private final long start;
  private final long length;
  private final double amplitude;

  public RecoveredPulse(OutputChannel channel, long start, long length, double amplitude) {
    this.channel = channel;
    this.start = start;
    this.length = length;
    this.amplitude = amplitude;
  }

  public OutputChannel getChannel() {
    return channel;
  }

  public long getStart() {
    return start;
  }

  public long getLength() {
    return length;
  }

  public long getEnd() {
    return start + length;
  }

  /**
   * Peak level as a fraction of full scale, sign included.
   */
  public double getAmplitude() {
    return amplitude;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RecoveredPulse)) {
      return false;
    }
    RecoveredPulse other = (RecoveredPulse) obj;
    return channel == other.channel && start == other.start && length == other.length
        && Double.compare(amplitude, other.amplitude) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(channel, start, length, amplitude);
  }

  @Override
  public String toString() {
    return String.format("ch%s@%d+%d*%.5f", channel, start, length, amplitude);
  }
}
