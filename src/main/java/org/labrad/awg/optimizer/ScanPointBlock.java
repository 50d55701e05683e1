package org.labrad.awg.optimizer;

import java.util.List;
import java.util.Map;

import org.labrad.awg.description.Quantity;
import org.labrad.awg.waveform.DeadTimeSpan;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The table lines that play one scan point.
 */
public final class ScanPointBlock {
  private final int scanIndex;
  private final ImmutableMap<String, Quantity> scanValues;
  private final int firstLine;
  private final int entryCount;
  private final long repeatCount;
  private final long nominalSamples;
  private final long durationSamples;
  private final ImmutableList<DeadTimeSpan> deadTimes;

  public ScanPointBlock(int scanIndex, Map<String, Quantity> scanValues, int firstLine, int entryCount,
      long repeatCount, long nominalSamples, long durationSamples, List<DeadTimeSpan> deadTimes) {
    this.scanIndex = scanIndex;
    this.scanValues = ImmutableMap.copyOf(scanValues);
    this.firstLine = firstLine;
    this.entryCount = entryCount;
    this.repeatCount = repeatCount;
    this.nominalSamples = nominalSamples;
    this.durationSamples = durationSamples;
    this.deadTimes = ImmutableList.copyOf(deadTimes);
  }

  public int getScanIndex() {
    return scanIndex;
  }

  public Map<String, Quantity> getScanValues() {
    return scanValues;
  }

  public int getFirstLine() {
    return firstLine;
  }

  public int getLastLine() {
    return firstLine + entryCount - 1;
  }

  public int getEntryCount() {
    return entryCount;
  }

  /**
   * How many times the experiment should run this scan point. For a block of a
   * single line this is also the line's repeat count. A chained block plays once
   * per pass of the table and the trigger source counts its cycles from the
   * written trigger schedule.
   */
  public long getRepeatCount() {
    return repeatCount;
  }

  public long getNominalSamples() {
    return nominalSamples;
  }

  /**
   * Length of the scan point in samples, before padding.
   */
  public long getDurationSamples() {
    return durationSamples;
  }

  public List<DeadTimeSpan> getDeadTimes() {
    return deadTimes;
  }

  @Override
  public String toString() {
    return String.format("block#%d lines %d-%d x%d", scanIndex, firstLine, getLastLine(), repeatCount);
  }
}
