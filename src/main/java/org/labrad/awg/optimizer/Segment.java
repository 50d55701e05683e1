package org.labrad.awg.optimizer;

import org.labrad.awg.waveform.ChannelWaveform;
import org.labrad.awg.waveform.DeadTimeSpan;

/**
 * A planned stretch of one scan point: either waveforms to play, one per
 * analog channel, or a dead time span.
 */
final class Segment {
  final long offset;
  final ChannelWaveform[] waveforms;
  final DeadTimeSpan deadTime;

  private Segment(long offset, ChannelWaveform[] waveforms, DeadTimeSpan deadTime) {
    this.offset = offset;
    this.waveforms = waveforms;
    this.deadTime = deadTime;
  }

  static Segment active(long offset, ChannelWaveform[] waveforms) {
    return new Segment(offset, waveforms, null);
  }

  static Segment dead(DeadTimeSpan span) {
    return new Segment(span.getStart(), null, span);
  }

  boolean isDeadTime() {
    return deadTime != null;
  }

  @Override
  public String toString() {
    return isDeadTime() ? deadTime.toString() : "active@" + offset + "+" + waveforms[0].getLength();
  }
}
