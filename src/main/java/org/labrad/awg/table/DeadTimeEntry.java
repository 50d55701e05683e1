package org.labrad.awg.table;

import org.labrad.awg.waveform.ChannelWaveform;
import org.labrad.awg.waveform.DeadTimeSpan;

import com.google.common.base.Preconditions;

/**
 * Covers a dead time span with a short idle waveform, then waits for the
 * trigger that ends the span.
 */
public class DeadTimeEntry extends TableEntry {
  private final DeadTimeSpan span;

  public DeadTimeEntry(ChannelWaveform[] idle, DeadTimeSpan span) {
    super(idle);
    Preconditions.checkArgument(span.getLength() >= getWaveformLength(),
        "Dead time %s is shorter than the idle waveform", span);
    this.span = span;
  }

  public DeadTimeSpan getSpan() {
    return span;
  }

  @Override
  public long getHoldSamples() {
    return span.getLength() - getWaveformLength();
  }

  @Override
  public boolean isWaitTrigger() {
    return true;
  }
}
