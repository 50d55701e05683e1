package org.labrad.awg.table;

import org.labrad.awg.waveform.ChannelWaveform;

/**
 * First line of a table whose scan points are chained from several entries:
 * holds the outputs at the safe level for the nominal sequence duration so the
 * first real cycle starts from a known state.
 */
public class ArmingEntry extends TableEntry {
  private final long holdSamples;

  public ArmingEntry(ChannelWaveform[] idle, long holdSamples) {
    super(idle);
    this.holdSamples = Math.max(0, holdSamples);
  }

  @Override
  public long getHoldSamples() {
    return holdSamples;
  }

  @Override
  public boolean isWaitTrigger() {
    return true;
  }
}
