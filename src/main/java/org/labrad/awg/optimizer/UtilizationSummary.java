package org.labrad.awg.optimizer;

import java.util.Arrays;

/**
 * Memory and sequencer usage of an artifact, for checking sweep feasibility
 * before committing hardware time.
 */
public final class UtilizationSummary {
  private final long[] channelOccupancy;
  private final int tableEntries;
  private final int uniqueWaveforms;
  private final long sampleBudget;
  private final int lineBudget;

  public UtilizationSummary(long[] channelOccupancy, int tableEntries, int uniqueWaveforms,
      long sampleBudget, int lineBudget) {
    this.channelOccupancy = channelOccupancy.clone();
    this.tableEntries = tableEntries;
    this.uniqueWaveforms = uniqueWaveforms;
    this.sampleBudget = sampleBudget;
    this.lineBudget = lineBudget;
  }

  /**
   * Waveform samples stored over all analog channels.
   */
  public long getTotalSamples() {
    long total = 0;
    for (long n : channelOccupancy) {
      total += n;
    }
    return total;
  }

  public long getChannelOccupancy(int analogChannel) {
    return channelOccupancy[analogChannel - 1];
  }

  public long getPeakOccupancy() {
    long peak = 0;
    for (long n : channelOccupancy) {
      peak = Math.max(peak, n);
    }
    return peak;
  }

  public int getTableEntries() {
    return tableEntries;
  }

  public int getUniqueWaveforms() {
    return uniqueWaveforms;
  }

  /**
   * Waveform samples available per analog channel.
   */
  public long getSampleBudget() {
    return sampleBudget;
  }

  public int getLineBudget() {
    return lineBudget;
  }

  @Override
  public String toString() {
    return String.format("%d samples stored (per channel %s of %d), %d table lines of %d, %d unique waveforms",
        getTotalSamples(), Arrays.toString(channelOccupancy), sampleBudget, tableEntries, lineBudget,
        uniqueWaveforms);
  }
}
