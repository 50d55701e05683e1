package org.labrad.awg.builder;

import java.math.BigDecimal;

import org.labrad.awg.description.Quantity;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.enums.PulseShape;
import org.labrad.awg.util.Timing;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A pulse with every parameter resolved and an absolute start time, in seconds.
 */
public final class ConcretePulse {
  private final String label;
  private final OutputChannel channel;
  private final PulseShape shape;
  private final BigDecimal start;
  private final BigDecimal duration;
  private final Quantity amplitude;
  private final BigDecimal phaseDegrees;
  private final BigDecimal frequency;
  private final String file;
  private final boolean concurrent;

  public ConcretePulse(String label, OutputChannel channel, PulseShape shape, BigDecimal start,
      BigDecimal duration, Quantity amplitude, BigDecimal phaseDegrees, BigDecimal frequency,
      String file, boolean concurrent) {
    Preconditions.checkNotNull(channel);
    Preconditions.checkNotNull(shape);
    Preconditions.checkArgument(duration.signum() > 0, "Pulse %s has non-positive duration", label);
    this.label = label;
    this.channel = channel;
    this.shape = shape;
    this.start = start;
    this.duration = duration;
    this.amplitude = amplitude;
    this.phaseDegrees = phaseDegrees;
    this.frequency = frequency;
    this.file = file;
    this.concurrent = concurrent;
  }

  public String getLabel() {
    return label;
  }

  public OutputChannel getChannel() {
    return channel;
  }

  public PulseShape getShape() {
    return shape;
  }

  public BigDecimal getStart() {
    return start;
  }

  public BigDecimal getDuration() {
    return duration;
  }

  public BigDecimal getEnd() {
    return start.add(duration);
  }

  /**
   * Amplitude, dimensionless or in volts.
   */
  public Quantity getAmplitude() {
    return amplitude;
  }

  public BigDecimal getPhaseDegrees() {
    return phaseDegrees;
  }

  /**
   * Carrier frequency in Hz, null unless this is a sine pulse.
   */
  public BigDecimal getFrequency() {
    return frequency;
  }

  public String getFile() {
    return file;
  }

  public boolean isConcurrent() {
    return concurrent;
  }

  public long getStartSample(BigDecimal sampleRate) {
    return Timing.toSamples(start, sampleRate);
  }

  public long getEndSample(BigDecimal sampleRate) {
    return Timing.toSamples(getEnd(), sampleRate);
  }

  /**
   * Copy of this pulse moved to a new start time.
   */
  public ConcretePulse withStart(BigDecimal newStart) {
    return new ConcretePulse(label, channel, shape, newStart, duration, amplitude, phaseDegrees,
        frequency, file, concurrent);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ConcretePulse)) {
      return false;
    }
    ConcretePulse other = (ConcretePulse) obj;
    return Objects.equal(label, other.label)
        && channel == other.channel
        && shape == other.shape
        && start.compareTo(other.start) == 0
        && duration.compareTo(other.duration) == 0
        && Objects.equal(amplitude, other.amplitude)
        && phaseDegrees.compareTo(other.phaseDegrees) == 0
        && (frequency == null ? other.frequency == null
            : other.frequency != null && frequency.compareTo(other.frequency) == 0)
        && Objects.equal(file, other.file)
        && concurrent == other.concurrent;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(label, channel, shape, start.stripTrailingZeros(), duration.stripTrailingZeros());
  }

  @Override
  public String toString() {
    return String.format("%s[ch%s %s @%s +%s amp=%s]", label, channel, shape,
        Timing.format(start), Timing.format(duration), amplitude);
  }
}
