package org.labrad.awg.table;

import org.labrad.awg.waveform.ChannelWaveform;

/**
 * Plays a stretch of pulse activity.
 */
public class WaveformEntry extends TableEntry {
  private final long offset;

  /**
   * @param offset first sample of the stretch within its scan point
   */
  public WaveformEntry(ChannelWaveform[] waveforms, long offset) {
    super(waveforms);
    this.offset = offset;
  }

  public long getOffset() {
    return offset;
  }

  @Override
  public boolean isWaitTrigger() {
    return false;
  }
}
