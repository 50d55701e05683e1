package org.labrad.awg.optimizer;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.labrad.awg.waveform.ChannelWaveform;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Pool of unique waveforms. A waveform with the same content as one already
 * stored is not stored again; each analog channel is charged once for every
 * distinct waveform it plays.
 */
public class WaveformMemory {
  private final List<ChannelWaveform> waveforms = Lists.newArrayList();
  private final Map<ChannelWaveform, Integer> indices = Maps.newHashMap();
  private final List<Set<Integer>> columns = Lists.newArrayList();

  public WaveformMemory(int analogChannels) {
    for (int i = 0; i < analogChannels; i++) {
      columns.add(Sets.<Integer>newLinkedHashSet());
    }
  }

  /**
   * Store a waveform for an analog channel and return its pool index.
   */
  public int add(int analogChannel, ChannelWaveform waveform) {
    Preconditions.checkNotNull(waveform);
    Integer index = indices.get(waveform);
    if (index == null) {
      index = waveforms.size();
      waveforms.add(waveform);
      indices.put(waveform, index);
    }
    columns.get(analogChannel - 1).add(index);
    return index;
  }

  public int getIndex(ChannelWaveform waveform) {
    Integer index = indices.get(waveform);
    Preconditions.checkArgument(index != null, "Waveform %s is not stored", waveform);
    return index;
  }

  public List<ChannelWaveform> getWaveforms() {
    return Lists.newArrayList(waveforms);
  }

  public int size() {
    return waveforms.size();
  }

  /**
   * Samples of waveform memory used by one analog channel.
   */
  public long getOccupancy(int analogChannel) {
    long total = 0;
    for (int index : columns.get(analogChannel - 1)) {
      total += waveforms.get(index).getLength();
    }
    return total;
  }

  public int getChannelCount() {
    return columns.size();
  }

  public WaveformMemory copy() {
    WaveformMemory copy = new WaveformMemory(columns.size());
    copy.waveforms.addAll(waveforms);
    copy.indices.putAll(indices);
    for (int i = 0; i < columns.size(); i++) {
      copy.columns.get(i).addAll(columns.get(i));
    }
    return copy;
  }
}
