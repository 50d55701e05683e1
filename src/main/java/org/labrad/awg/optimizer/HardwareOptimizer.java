package org.labrad.awg.optimizer;

import java.util.List;

import org.labrad.awg.HardwareProfile;
import org.labrad.awg.builder.ConcreteSequence;
import org.labrad.awg.errors.CompilationAbortedException;
import org.labrad.awg.errors.MemoryBudgetException;
import org.labrad.awg.util.AbortFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Turns timing-resolved scan points into waveforms and a sequence table that
 * fit the instrument.
 *
 * Memory is saved by keeping dead time as span descriptors, by storing each
 * distinct waveform once, and by splitting long stretches into chained
 * entries. The per-entry repeat count only ever carries the experiment repeat.
 */
public class HardwareOptimizer {
  private static final Logger log = LoggerFactory.getLogger(HardwareOptimizer.class);

  private final HardwareProfile profile;
  private final SegmentPlanner planner;
  private final AbortFlag abortFlag;

  public HardwareOptimizer(HardwareProfile profile) {
    this(profile, AbortFlag.never());
  }

  public HardwareOptimizer(HardwareProfile profile, AbortFlag abortFlag) {
    this.profile = Preconditions.checkNotNull(profile);
    this.planner = new SegmentPlanner(profile);
    this.abortFlag = Preconditions.checkNotNull(abortFlag);
  }

  public HardwareProfile getProfile() {
    return profile;
  }

  public OptimizedArtifact optimize(ConcreteSequence sequence) {
    return optimize(ImmutableList.of(sequence));
  }

  /**
   * Compile all scan points into one artifact.
   *
   * @throws MemoryBudgetException if they do not fit the device together
   */
  public OptimizedArtifact optimize(List<ConcreteSequence> sequences) {
    Preconditions.checkArgument(!sequences.isEmpty(), "Nothing to optimize");
    boolean[] used = SegmentPlanner.usedChannels(sequences, profile.getAnalogChannels());
    ConcreteSequence first = sequences.get(0);
    TableAssembler assembler = new TableAssembler(profile, first.getName(), first.getSampleRate(), used);
    for (ConcreteSequence seq : sequences) {
      checkAbort(seq);
      assembler.add(seq, planner.plan(seq));
    }
    return assembler.finish();
  }

  /**
   * Re-optimize an artifact from its own descriptors.
   */
  public OptimizedArtifact optimize(OptimizedArtifact artifact) {
    return optimize(new ArtifactDecompiler().decompile(artifact));
  }

  /**
   * Compile scan points into as few artifacts as needed, packing them in scan
   * order until the next one would not fit.
   *
   * @throws MemoryBudgetException if a single scan point does not fit on its own
   */
  public List<OptimizedArtifact> optimizeInBatches(List<ConcreteSequence> sequences) {
    Preconditions.checkArgument(!sequences.isEmpty(), "Nothing to optimize");
    boolean[] used = SegmentPlanner.usedChannels(sequences, profile.getAnalogChannels());
    ConcreteSequence first = sequences.get(0);
    List<OptimizedArtifact> artifacts = Lists.newArrayList();
    TableAssembler assembler = null;
    for (ConcreteSequence seq : sequences) {
      checkAbort(seq);
      List<Segment> plan = planner.plan(seq);
      if (assembler != null && !assembler.fits(plan)) {
        artifacts.add(assembler.finish());
        assembler = null;
      }
      if (assembler == null) {
        String name = String.format("%s_part%02d", first.getName(), artifacts.size() + 1);
        assembler = new TableAssembler(profile, name, first.getSampleRate(), used);
        if (!assembler.fits(plan)) {
          throw new MemoryBudgetException(String.format("Scan point %s does not fit the device on its own", seq));
        }
      }
      assembler.add(seq, plan);
    }
    artifacts.add(assembler.finish());
    log.info("Packed {} scan points into {} artifacts", sequences.size(), artifacts.size());
    return artifacts;
  }

  private void checkAbort(ConcreteSequence seq) {
    if (abortFlag.isAborted()) {
      throw new CompilationAbortedException(seq.getScanIndex());
    }
  }
}
