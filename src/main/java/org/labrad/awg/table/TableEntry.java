package org.labrad.awg.table;

import java.util.Arrays;
import java.util.List;

import org.labrad.awg.enums.JumpMode;
import org.labrad.awg.waveform.ChannelWaveform;

import com.google.common.base.Preconditions;

/**
 * One line of the sequence table: a waveform per analog channel (null for an
 * unused channel), repeat count, wait-trigger flag and jump.
 *
 * Jump targets are line numbers and are only known once the whole table has
 * been laid out, so they are set after construction.
 */
public abstract class TableEntry {
  private final ChannelWaveform[] waveforms;
  private long repeat = 1;
  private JumpMode jumpMode = JumpMode.NEXT;
  private int jumpTarget = 0;

  protected TableEntry(ChannelWaveform[] waveforms) {
    long len = -1;
    for (ChannelWaveform w : waveforms) {
      if (w == null) continue;
      Preconditions.checkArgument(len < 0 || w.getLength() == len,
          "Waveforms of one table entry must have equal length");
      len = w.getLength();
    }
    Preconditions.checkArgument(len > 0, "Table entry needs at least one waveform");
    this.waveforms = waveforms.clone();
  }

  /**
   * Waveforms played by this entry, indexed by analog channel minus one.
   */
  public List<ChannelWaveform> getWaveforms() {
    return Arrays.asList(waveforms.clone());
  }

  public ChannelWaveform getWaveform(int analogChannel) {
    return waveforms[analogChannel - 1];
  }

  public long getWaveformLength() {
    for (ChannelWaveform w : waveforms) {
      if (w != null) return w.getLength();
    }
    throw new IllegalStateException("Table entry without waveforms");
  }

  /**
   * Samples after the waveform during which the output is held until the trigger arrives.
   */
  public long getHoldSamples() {
    return 0;
  }

  /**
   * Samples of sequence time covered by one pass of this entry.
   */
  public long getPlayedSamples() {
    return getWaveformLength() + getHoldSamples();
  }

  public abstract boolean isWaitTrigger();

  public long getRepeat() {
    return repeat;
  }

  public void setRepeat(long repeat) {
    Preconditions.checkArgument(repeat >= 1, "Repeat count must be at least 1");
    this.repeat = repeat;
  }

  public JumpMode getJumpMode() {
    return jumpMode;
  }

  /**
   * Target line for GOTO, 0 for NEXT.
   */
  public int getJumpTarget() {
    return jumpTarget;
  }

  public void setNext() {
    this.jumpMode = JumpMode.NEXT;
    this.jumpTarget = 0;
  }

  public void setGoto(int line) {
    Preconditions.checkArgument(line >= 1, "Invalid jump target %s", line);
    this.jumpMode = JumpMode.GOTO;
    this.jumpTarget = line;
  }
}
