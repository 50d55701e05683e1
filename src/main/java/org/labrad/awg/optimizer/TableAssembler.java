package org.labrad.awg.optimizer;

import java.math.BigDecimal;
import java.util.List;

import org.labrad.awg.Constants;
import org.labrad.awg.HardwareProfile;
import org.labrad.awg.builder.ConcreteSequence;
import org.labrad.awg.errors.MemoryBudgetException;
import org.labrad.awg.table.ArmingEntry;
import org.labrad.awg.table.DeadTimeEntry;
import org.labrad.awg.table.SequenceTable;
import org.labrad.awg.table.TableEntry;
import org.labrad.awg.table.WaveformEntry;
import org.labrad.awg.util.Timing;
import org.labrad.awg.waveform.ChannelWaveform;
import org.labrad.awg.waveform.DeadTimeSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Collects the planned blocks of several scan points and lays them out as one
 * sequence table. Line numbers, repeat counts and jumps are resolved only when
 * the table is finished.
 */
class TableAssembler {
  private static final Logger log = LoggerFactory.getLogger(TableAssembler.class);

  private final HardwareProfile profile;
  private final String name;
  private final BigDecimal sampleRate;
  private final boolean[] used;
  private final WaveformMemory memory;
  private final List<PendingBlock> blocks = Lists.newArrayList();

  TableAssembler(HardwareProfile profile, String name, BigDecimal sampleRate, boolean[] used) {
    this.profile = profile;
    this.name = name;
    this.sampleRate = sampleRate;
    this.used = used.clone();
    this.memory = new WaveformMemory(used.length);
  }

  boolean isEmpty() {
    return blocks.isEmpty();
  }

  void add(ConcreteSequence seq, List<Segment> plan) {
    Preconditions.checkArgument(seq.getSampleRate().compareTo(sampleRate) == 0,
        "All scan points must share one sample rate");
    PendingBlock block = new PendingBlock(seq);
    for (Segment segment : plan) {
      TableEntry entry;
      if (segment.isDeadTime()) {
        entry = new DeadTimeEntry(idle(), segment.deadTime);
        block.deadTimes.add(segment.deadTime);
      } else {
        entry = new WaveformEntry(mask(segment.waveforms), segment.offset);
      }
      register(memory, entry);
      block.entries.add(entry);
    }
    blocks.add(block);
  }

  /**
   * Whether a planned scan point can be added without exceeding the device limits.
   */
  boolean fits(List<Segment> plan) {
    WaveformMemory trial = memory.copy();
    boolean chained = plan.size() > 1;
    for (PendingBlock b : blocks) {
      chained |= b.entries.size() > 1;
    }
    for (Segment segment : plan) {
      if (segment.isDeadTime()) {
        register(trial, new DeadTimeEntry(idle(), segment.deadTime));
      } else {
        register(trial, new WaveformEntry(mask(segment.waveforms), segment.offset));
      }
    }
    if (chained) {
      register(trial, new ArmingEntry(idle(), 0));
    }
    int lines = plan.size() + (chained ? 1 : 0);
    for (PendingBlock b : blocks) {
      lines += b.entries.size();
    }
    return lines <= profile.getMaxSequenceLines() && !overBudget(trial);
  }

  OptimizedArtifact finish() {
    Preconditions.checkState(!blocks.isEmpty(), "No scan points to assemble");
    boolean chained = false;
    for (PendingBlock b : blocks) {
      chained |= b.entries.size() > 1;
    }

    SequenceTable table = new SequenceTable();
    if (chained) {
      long nominal = Timing.toSamples(blocks.get(0).sequence.getNominalDuration(), sampleRate);
      ArmingEntry arming = new ArmingEntry(idle(), nominal - profile.getMinWaveformLength());
      register(memory, arming);
      table.add(arming);
    }

    List<ScanPointBlock> result = Lists.newArrayList();
    int firstBlockLine = 0;
    for (PendingBlock b : blocks) {
      int first = 0;
      for (TableEntry entry : b.entries) {
        int line = table.add(entry);
        if (first == 0) first = line;
        entry.setNext();
      }
      if (firstBlockLine == 0) firstBlockLine = first;
      // a chained block runs once per pass; its statistics repeat goes to the trigger schedule
      long repeat = b.sequence.getRepeatCount();
      b.entries.get(0).setRepeat(b.entries.size() == 1 ? repeat : 1);
      result.add(new ScanPointBlock(b.sequence.getScanIndex(), b.sequence.getScanValues(), first,
          b.entries.size(), repeat, Timing.toSamples(b.sequence.getNominalDuration(), sampleRate),
          b.sequence.getDurationSamples(), b.deadTimes));
    }
    table.getLine(table.size()).setGoto(firstBlockLine);

    if (table.size() > profile.getMaxSequenceLines()) {
      throw new MemoryBudgetException(String.format("%s needs %d sequence lines, the device holds %d",
          name, table.size(), profile.getMaxSequenceLines()));
    }
    if (overBudget(memory)) {
      throw new MemoryBudgetException(String.format("%s needs %s samples of waveform memory, the device holds %d",
          name, occupancy(memory), profile.getMaxWaveformSamples()));
    }

    long[] perChannel = new long[used.length];
    for (int i = 0; i < used.length; i++) {
      perChannel[i] = memory.getOccupancy(i + 1);
    }
    UtilizationSummary summary = new UtilizationSummary(perChannel, table.size(), memory.size(),
        profile.getMaxWaveformSamples(), profile.getMaxSequenceLines());
    log.info("Assembled {}: {}", name, summary);
    return new OptimizedArtifact(name, sampleRate, profile, memory.getWaveforms(), table, result, summary);
  }

  private boolean overBudget(WaveformMemory m) {
    for (int ch = 1; ch <= m.getChannelCount(); ch++) {
      if (m.getOccupancy(ch) > profile.getMaxWaveformSamples()) {
        return true;
      }
    }
    return false;
  }

  private static List<Long> occupancy(WaveformMemory m) {
    List<Long> result = Lists.newArrayList();
    for (int ch = 1; ch <= m.getChannelCount(); ch++) {
      result.add(m.getOccupancy(ch));
    }
    return result;
  }

  private static void register(WaveformMemory m, TableEntry entry) {
    List<ChannelWaveform> waveforms = entry.getWaveforms();
    for (int i = 0; i < waveforms.size(); i++) {
      if (waveforms.get(i) != null) {
        m.add(i + 1, waveforms.get(i));
      }
    }
  }

  /**
   * Idle waveforms at the safe level on the channels in use.
   */
  private ChannelWaveform[] idle() {
    ChannelWaveform idle = ChannelWaveform.idle(profile.getMinWaveformLength(), Constants.SAFE_LEVEL);
    ChannelWaveform[] result = new ChannelWaveform[used.length];
    for (int i = 0; i < used.length; i++) {
      result[i] = used[i] ? idle : null;
    }
    return result;
  }

  private ChannelWaveform[] mask(ChannelWaveform[] waveforms) {
    ChannelWaveform[] result = new ChannelWaveform[used.length];
    for (int i = 0; i < used.length; i++) {
      result[i] = used[i] ? waveforms[i] : null;
    }
    return result;
  }

  private static final class PendingBlock {
    final ConcreteSequence sequence;
    final List<TableEntry> entries = Lists.newArrayList();
    final List<DeadTimeSpan> deadTimes = Lists.newArrayList();

    PendingBlock(ConcreteSequence sequence) {
      this.sequence = sequence;
    }
  }
}
