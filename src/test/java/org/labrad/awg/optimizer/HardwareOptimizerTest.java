package org.labrad.awg.optimizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.labrad.awg.HardwareProfile;
import org.labrad.awg.builder.ConcreteSequence;
import org.labrad.awg.builder.SequenceBuilder;
import org.labrad.awg.enums.JumpMode;
import org.labrad.awg.errors.CompilationAbortedException;
import org.labrad.awg.errors.InvalidParameterException;
import org.labrad.awg.errors.MemoryBudgetException;
import org.labrad.awg.parser.SequenceParser;
import org.labrad.awg.table.ArmingEntry;
import org.labrad.awg.table.DeadTimeEntry;
import org.labrad.awg.table.SequenceTable;
import org.labrad.awg.table.TableEntry;
import org.labrad.awg.table.WaveformEntry;
import org.labrad.awg.util.AbortFlag;
import org.labrad.awg.waveform.ChannelWaveform;
import org.labrad.awg.waveform.DeadTimeSpan;

public class HardwareOptimizerTest {

  private final HardwareProfile awg520 = HardwareProfile.awg520();
  private final HardwareOptimizer optimizer = new HardwareOptimizer(awg520);

  private static List<ConcreteSequence> build(String... lines) {
    return new SequenceBuilder().build(new SequenceParser().parse(String.join("\n", lines)));
  }

  private static void assertSameTable(OptimizedArtifact expected, OptimizedArtifact actual) {
    assertEquals(expected.getWaveforms(), actual.getWaveforms());
    SequenceTable a = expected.getTable();
    SequenceTable b = actual.getTable();
    assertEquals(a.size(), b.size());
    for (int line = 1; line <= a.size(); line++) {
      TableEntry x = a.getLine(line);
      TableEntry y = b.getLine(line);
      assertEquals(x.getWaveforms(), y.getWaveforms(), "waveforms of line " + line);
      assertEquals(x.getRepeat(), y.getRepeat(), "repeat of line " + line);
      assertEquals(x.isWaitTrigger(), y.isWaitTrigger(), "wait of line " + line);
      assertEquals(x.getJumpMode(), y.getJumpMode(), "jump of line " + line);
      assertEquals(x.getJumpTarget(), y.getJumpTarget(), "target of line " + line);
      assertEquals(x.getHoldSamples(), y.getHoldSamples(), "hold of line " + line);
    }
  }

  @Nested
  @DisplayName("single scan point")
  class SinglePoint {

    @Test
    void shortSequenceIsOneWaveformAndOneLine() {
      OptimizedArtifact artifact = optimizer.optimize(build(
          "sequence: duration=1us, sample_rate=1GHz, repeat=1",
          "pi pulse on channel 1 at 0ns, gaussian, 100ns, 1.0"));
      assertEquals(1, artifact.getWaveforms().size());
      assertEquals(1000, artifact.getWaveforms().get(0).getLength());
      assertEquals(1, artifact.getTable().size());

      TableEntry entry = artifact.getTable().getLine(1);
      assertInstanceOf(WaveformEntry.class, entry);
      assertEquals(1, entry.getRepeat());
      assertFalse(entry.isWaitTrigger());
      assertEquals(JumpMode.GOTO, entry.getJumpMode());
      assertEquals(1, entry.getJumpTarget());
      assertNull(entry.getWaveform(2));
      assertEquals("", artifact.getWaveformName(entry.getWaveform(2)));

      UtilizationSummary summary = artifact.getSummary();
      assertEquals(1000, summary.getChannelOccupancy(1));
      assertEquals(0, summary.getChannelOccupancy(2));
      assertEquals(1, summary.getTableEntries());
      assertEquals(1, summary.getUniqueWaveforms());
      assertEquals(4000000, summary.getSampleBudget());
    }

    @Test
    void longDeadTimeBecomesASpanDescriptor() {
      OptimizedArtifact artifact = optimizer.optimize(build(
          "sequence: duration=20ms, sample_rate=1GHz",
          "pi pulse on channel 1 at 0ns, square, 100ns, 1.0"));
      assertTrue(artifact.getSummary().getPeakOccupancy() <= awg520.getMaxWaveformSamples());
      assertEquals(512, artifact.getSummary().getChannelOccupancy(1));
      assertEquals(2, artifact.getWaveforms().size());

      SequenceTable table = artifact.getTable();
      assertEquals(3, table.size());
      assertInstanceOf(ArmingEntry.class, table.getLine(1));
      assertInstanceOf(WaveformEntry.class, table.getLine(2));
      assertInstanceOf(DeadTimeEntry.class, table.getLine(3));

      assertTrue(table.getLine(1).isWaitTrigger());
      assertEquals(20000000 - 256, table.getLine(1).getHoldSamples());
      assertEquals(256, table.getLine(2).getWaveformLength());
      assertEquals(JumpMode.NEXT, table.getLine(2).getJumpMode());

      DeadTimeEntry dead = (DeadTimeEntry) table.getLine(3);
      assertEquals(new DeadTimeSpan(256, 20000000, 0.0), dead.getSpan());
      assertTrue(dead.isWaitTrigger());
      assertEquals(20000000 - 512, dead.getHoldSamples());
      assertEquals(JumpMode.GOTO, dead.getJumpMode());
      assertEquals(2, dead.getJumpTarget());

      ScanPointBlock block = artifact.getBlocks().get(0);
      assertEquals(2, block.getFirstLine());
      assertEquals(3, block.getLastLine());
      assertEquals(1, block.getDeadTimes().size());
      assertEquals(20000000, block.getDurationSamples());

      long played = 0;
      for (int line = 2; line <= 3; line++) {
        played += table.getLine(line).getPlayedSamples();
      }
      assertEquals(20000000, played);
    }

    @Test
    void markersShareTheAnalogWaveform() {
      OptimizedArtifact artifact = optimizer.optimize(build(
          "sequence: duration=1us",
          "pi pulse on channel 1 at 0ns, square, 100ns, 0.5",
          "laser on channel 3 at 200ns, square, 300ns, 1.0",
          "counter on channel 4 at 200ns, square, 100ns, 1.0"));
      ChannelWaveform w = artifact.getTable().getLine(1).getWaveform(1);
      assertEquals(1, w.getShapes().size());
      assertEquals(2, w.getMarkers().size());
      assertEquals(0, w.getMarkers().get(0).getBit());
      assertEquals(200, w.getMarkers().get(0).getOffset());
      assertEquals(1, w.getMarkers().get(1).getBit());
    }

    @Test
    void longActiveStretchIsChainedFromSeveralEntries() {
      HardwareProfile small = awg520.withProperty(HardwareProfile.MAX_WAVEFORM_SAMPLES, 1024);
      OptimizedArtifact artifact = new HardwareOptimizer(small).optimize(build(
          "sequence: duration=1800ns",
          "a on channel 1 at 0ns, square, 500ns, 1.0",
          "b on channel 1 at 600ns, square, 500ns, 1.0",
          "c on channel 1 at 1200ns, square, 500ns, 1.0"));
      SequenceTable table = artifact.getTable();
      assertEquals(4, table.size());
      assertInstanceOf(ArmingEntry.class, table.getLine(1));
      assertEquals(1800 - 256, table.getLine(1).getHoldSamples());
      for (int line = 2; line <= 4; line++) {
        assertEquals(600, table.getLine(line).getWaveformLength());
        assertEquals(1, table.getLine(line).getRepeat());
        assertFalse(table.getLine(line).isWaitTrigger());
      }
      assertEquals(JumpMode.NEXT, table.getLine(3).getJumpMode());
      assertEquals(JumpMode.GOTO, table.getLine(4).getJumpMode());
      assertEquals(2, table.getLine(4).getJumpTarget());
      // the three pieces are identical and stored once, next to the idle waveform
      assertEquals(2, artifact.getWaveforms().size());
      assertEquals(600 + 256, artifact.getSummary().getChannelOccupancy(1));
    }

    @Test
    void chainedScanPointsPlayOneAfterAnother() {
      OptimizedArtifact artifact = optimizer.optimize(build(
          "sequence: duration=20ms, repeat=1000",
          "variable tau, start=100ns, stop=200ns, steps=2",
          "pi pulse on channel 1 at tau, square, 100ns, 1.0"));
      SequenceTable table = artifact.getTable();
      assertEquals(5, table.size());
      assertEquals(2, artifact.getBlocks().get(0).getFirstLine());
      assertEquals(3, artifact.getBlocks().get(0).getLastLine());
      assertEquals(4, artifact.getBlocks().get(1).getFirstLine());
      assertEquals(5, artifact.getBlocks().get(1).getLastLine());
      for (int line = 1; line <= 4; line++) {
        assertEquals(JumpMode.NEXT, table.getLine(line).getJumpMode(), "jump of line " + line);
        assertEquals(1, table.getLine(line).getRepeat(), "repeat of line " + line);
      }
      // only the last line loops, back to the first scan point
      assertEquals(JumpMode.GOTO, table.getLine(5).getJumpMode());
      assertEquals(2, table.getLine(5).getJumpTarget());
      for (ScanPointBlock block : artifact.getBlocks()) {
        assertEquals(1000, block.getRepeatCount());
      }
    }
  }

  @Nested
  @DisplayName("memory")
  class Memory {

    @Test
    void identicalWaveformsAreStoredOnce() {
      OptimizedArtifact artifact = optimizer.optimize(build(
          "sequence: duration=1us",
          "variable d, start=0ns, stop=100ns, steps=2",
          "a on channel 1 at 0ns, square, 50ns, 1.0",
          "b on channel 2 at d, square, 50ns, 0.5"));
      assertEquals(2, artifact.getTable().size());
      assertEquals(3, artifact.getWaveforms().size());
      assertEquals(artifact.getTable().getLine(1).getWaveform(1), artifact.getTable().getLine(2).getWaveform(1));
      assertEquals(1000, artifact.getSummary().getChannelOccupancy(1));
      assertEquals(2000, artifact.getSummary().getChannelOccupancy(2));
      assertEquals(JumpMode.NEXT, artifact.getTable().getLine(1).getJumpMode());
      assertEquals(1, artifact.getTable().getLine(2).getJumpTarget());
    }

    @Test
    void deduplicationIgnoresTheChannel() {
      OptimizedArtifact artifact = optimizer.optimize(build(
          "sequence: duration=1us",
          "a on channel 1 at 0ns, square, 50ns, 0.5",
          "b on channel 2 at 0ns, square, 50ns, 0.5"));
      assertEquals(1, artifact.getWaveforms().size());
      TableEntry entry = artifact.getTable().getLine(1);
      assertEquals(artifact.getWaveformName(entry.getWaveform(1)), artifact.getWaveformName(entry.getWaveform(2)));
      assertEquals(1000, artifact.getSummary().getChannelOccupancy(2));
    }

    @Test
    void statisticsRepeatOnlyChangesTheRepeatField() {
      String body = "variable tau, start=20ns, stop=60ns, steps=3\n"
          + "rabi on channel 1 at 0ns, square, tau, 1.0\n"
          + "laser on channel 3 at 1us, square, 3us, 1.0";
      OptimizedArtifact few = optimizer.optimize(build("sequence: repeat=1000", body));
      OptimizedArtifact many = optimizer.optimize(build("sequence: repeat=50000", body));
      assertEquals(few.getWaveforms(), many.getWaveforms());
      assertEquals(few.getSummary().getTotalSamples(), many.getSummary().getTotalSamples());
      assertEquals(few.getTable().size(), many.getTable().size());
      for (int line = 1; line <= few.getTable().size(); line++) {
        assertEquals(1000, few.getTable().getLine(line).getRepeat());
        assertEquals(50000, many.getTable().getLine(line).getRepeat());
      }
      assertEquals(50000, many.getBlocks().get(2).getRepeatCount());
    }

    @Test
    void unsplittablePulseExceedsTheBudget() {
      HardwareProfile small = awg520.withProperty(HardwareProfile.MAX_WAVEFORM_SAMPLES, 512);
      HardwareOptimizer tight = new HardwareOptimizer(small);
      List<ConcreteSequence> seqs = build(
          "sequence: duration=1us",
          "long on channel 1 at 0ns, square, 800ns, 1.0");
      assertThrows(MemoryBudgetException.class, () -> tight.optimize(seqs));
    }

    @Test
    void tooManyDistinctWaveforms() {
      HardwareProfile small = awg520.withProperty(HardwareProfile.MAX_WAVEFORM_SAMPLES, 2000);
      HardwareOptimizer tight = new HardwareOptimizer(small);
      List<ConcreteSequence> seqs = build(
          "sequence: duration=1us",
          "variable tau, start=10ns, stop=30ns, steps=3",
          "a on channel 1 at 0ns, square, tau, 1.0");
      assertThrows(MemoryBudgetException.class, () -> tight.optimize(seqs));
    }

    @Test
    void tooManyTableLines() {
      HardwareProfile small = awg520.withProperty(HardwareProfile.MAX_SEQUENCE_LINES, 1);
      List<ConcreteSequence> seqs = build(
          "sequence: duration=1us",
          "variable tau, start=10ns, stop=20ns, steps=2",
          "a on channel 1 at 0ns, square, tau, 1.0");
      assertThrows(MemoryBudgetException.class, () -> new HardwareOptimizer(small).optimize(seqs));
    }

    @Test
    void batchesSplitAScanThatDoesNotFitAtOnce() {
      HardwareProfile small = awg520.withProperty(HardwareProfile.MAX_SEQUENCE_LINES, 2);
      List<ConcreteSequence> seqs = build(
          "sequence: name=sweep, duration=1us",
          "variable tau, start=10ns, stop=50ns, steps=5",
          "a on channel 1 at 0ns, square, tau, 1.0");
      List<OptimizedArtifact> artifacts = new HardwareOptimizer(small).optimizeInBatches(seqs);
      assertEquals(3, artifacts.size());
      assertEquals("sweep_part01", artifacts.get(0).getName());
      assertEquals("sweep_part03", artifacts.get(2).getName());
      assertEquals(2, artifacts.get(0).getTable().size());
      assertEquals(1, artifacts.get(2).getTable().size());
      assertEquals(4, artifacts.get(2).getBlocks().get(0).getScanIndex());
      assertEquals(1, artifacts.get(1).getTable().getLine(2).getJumpTarget());
    }
  }

  @Nested
  @DisplayName("amplitudes")
  class Amplitudes {

    @Test
    void voltsAreScaledToFullScale() {
      OptimizedArtifact artifact = optimizer.optimize(build(
          "sequence: duration=1us",
          "a on channel 1 at 0ns, square, 100ns, 250mV"));
      assertEquals(0.25, artifact.getWaveforms().get(0).getShapes().get(0).getAmplitude(), 1e-12);
    }

    @Test
    void amplitudeAboveFullScaleIsRejected() {
      assertThrows(InvalidParameterException.class, () -> optimizer.optimize(build(
          "sequence: duration=1us",
          "a on channel 1 at 0ns, square, 100ns, 1.5")));
      assertThrows(InvalidParameterException.class, () -> optimizer.optimize(build(
          "sequence: duration=1us",
          "a on channel 1 at 0ns, square, 100ns, 2V")));
    }

    @Test
    void overlappingPulsesMustStayWithinFullScale() {
      assertThrows(InvalidParameterException.class, () -> optimizer.optimize(build(
          "sequence: duration=1us",
          "a on channel 1 at 0ns, square, 100ns, 0.6",
          "b on channel 1 at 50ns, square, 100ns, 0.6 [concurrent]")));
    }
  }

  @Nested
  @DisplayName("re-optimization")
  class Reoptimization {

    @Test
    void optimizingAnArtifactAgainChangesNothing() {
      OptimizedArtifact first = optimizer.optimize(build(
          "sequence: duration=20ms, repeat=100",
          "variable tau, start=20ns, stop=40ns, steps=2",
          "pi/2 pulse on channel 1 at 0ns, gaussian, tau, 0.7, phase=90deg",
          "drive on channel 2 at 100ns, sine, 200ns, 0.3, frequency=25MHz",
          "laser on channel 3 at 1us, square, 3us, 1.0"));
      OptimizedArtifact second = optimizer.optimize(first);
      assertSameTable(first, second);
      assertSameTable(second, optimizer.optimize(second));
    }

    @Test
    void decompiledScanPointsKeepTheirTiming() {
      List<ConcreteSequence> seqs = build(
          "sequence: duration=2us",
          "variable tau, start=100ns, stop=200ns, steps=2",
          "a on channel 1 at 0ns, square, tau, 1.0",
          "b on channel 2 at 100ns, square, 100ns, 1.0");
      List<ConcreteSequence> back = new ArtifactDecompiler().decompile(optimizer.optimize(seqs));
      assertEquals(2, back.size());
      assertEquals(seqs.get(1).getDurationSamples(), back.get(1).getDurationSamples());
      assertEquals(0, seqs.get(1).getPulses().get(1).getStart().compareTo(back.get(1).getPulses().get(1).getStart()));
    }

    @Test
    void abortStopsTheOptimizer() {
      AbortFlag flag = new AbortFlag();
      flag.abort();
      List<ConcreteSequence> seqs = build("a on channel 1 at 0ns, square, 100ns, 1.0");
      assertThrows(CompilationAbortedException.class, () -> new HardwareOptimizer(awg520, flag).optimize(seqs));
    }
  }
}
