package org.labrad.awg.optimizer;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.labrad.awg.HardwareProfile;
import org.labrad.awg.table.SequenceTable;
import org.labrad.awg.waveform.ChannelWaveform;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * Compiled output for one or more scan points: the pool of unique waveform
 * descriptors, the sequence table that plays them and the per scan point blocks.
 */
public final class OptimizedArtifact {
  private final String name;
  private final BigDecimal sampleRate;
  private final HardwareProfile profile;
  private final ImmutableList<ChannelWaveform> waveforms;
  private final ImmutableMap<ChannelWaveform, Integer> indices;
  private final SequenceTable table;
  private final ImmutableList<ScanPointBlock> blocks;
  private final UtilizationSummary summary;

  OptimizedArtifact(String name, BigDecimal sampleRate, HardwareProfile profile, List<ChannelWaveform> waveforms,
      SequenceTable table, List<ScanPointBlock> blocks, UtilizationSummary summary) {
    this.name = name;
    this.sampleRate = sampleRate;
    this.profile = profile;
    this.waveforms = ImmutableList.copyOf(waveforms);
    Map<ChannelWaveform, Integer> map = Maps.newHashMap();
    for (int i = 0; i < waveforms.size(); i++) {
      map.put(waveforms.get(i), i);
    }
    this.indices = ImmutableMap.copyOf(map);
    this.table = table;
    this.blocks = ImmutableList.copyOf(blocks);
    this.summary = summary;
  }

  public String getName() {
    return name;
  }

  public BigDecimal getSampleRate() {
    return sampleRate;
  }

  public HardwareProfile getProfile() {
    return profile;
  }

  /**
   * Unique waveforms, in the order of their file names.
   */
  public List<ChannelWaveform> getWaveforms() {
    return waveforms;
  }

  public SequenceTable getTable() {
    return table;
  }

  public List<ScanPointBlock> getBlocks() {
    return blocks;
  }

  public UtilizationSummary getSummary() {
    return summary;
  }

  /**
   * File name of a pooled waveform, or the empty string for an unused channel.
   */
  public String getWaveformName(ChannelWaveform waveform) {
    if (waveform == null) {
      return "";
    }
    Integer index = indices.get(waveform);
    Preconditions.checkArgument(index != null, "Waveform %s is not part of this artifact", waveform);
    return String.format("%s_%04d.wfm", getFileBase(), index);
  }

  /**
   * Name usable as a file name stem.
   */
  public String getFileBase() {
    return name.replaceAll("[^A-Za-z0-9_-]", "_");
  }

  public String getTableName() {
    return getFileBase() + ".seq";
  }

  /**
   * File holding the hold times and per-block repeats for the trigger source.
   */
  public String getScheduleName() {
    return getFileBase() + ".sched";
  }

  @Override
  public String toString() {
    return String.format("artifact %s: %d blocks, %s", name, blocks.size(), summary);
  }
}
