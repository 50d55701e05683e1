package org.labrad.awg.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.labrad.awg.description.Quantity;
import org.labrad.awg.description.SequenceDescription;
import org.labrad.awg.enums.Dimension;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.enums.PulseShape;
import org.labrad.awg.errors.CompilationAbortedException;
import org.labrad.awg.errors.InvalidParameterException;
import org.labrad.awg.errors.MemoryBudgetException;
import org.labrad.awg.errors.TimingOrderException;
import org.labrad.awg.errors.UnresolvedVariableException;
import org.labrad.awg.parser.SequenceParser;
import org.labrad.awg.util.AbortFlag;
import org.labrad.awg.util.Timing;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

public class SequenceBuilderTest {
  private static final BigDecimal GHZ = new BigDecimal("1E9");

  private final SequenceBuilder builder = new SequenceBuilder();

  private static SequenceDescription parse(String... lines) {
    return new SequenceParser().parse(String.join("\n", lines));
  }

  private static BigDecimal ns(long n) {
    return new BigDecimal(n).movePointLeft(9);
  }

  private static void assertTime(long expectedNs, BigDecimal actual) {
    assertEquals(0, ns(expectedNs).compareTo(actual), "expected " + expectedNs + "ns but was " + actual);
  }

  private static ConcretePulse square(OutputChannel ch, long startNs, long durationNs) {
    return new ConcretePulse("p", ch, PulseShape.SQUARE, ns(startNs), ns(durationNs),
        Quantity.dimensionless(BigDecimal.ONE), BigDecimal.ZERO, null, null, false);
  }

  @Nested
  @DisplayName("timing shift")
  class TimingShift {

    @Test
    void laterPulsesFollowALongerDuration() {
      SequenceDescription desc = parse(
          "variable pulse_duration, start=100ns, stop=200ns, steps=2",
          "pi/2 pulse on channel 1 at 0ns, gaussian, pulse_duration, 1.0",
          "pi pulse on channel 1 at 100ns, gaussian, 100ns, 1.0");
      List<ConcreteSequence> seqs = builder.build(desc);
      assertEquals(2, seqs.size());
      assertTime(100, seqs.get(0).getPulses().get(1).getStart());
      assertTime(200, seqs.get(1).getPulses().get(1).getStart());
      assertTime(200, seqs.get(1).getPulses().get(0).getDuration());
    }

    @Test
    void totalDurationGrowsByTheShift() {
      SequenceDescription desc = parse(
          "sequence: duration=1us",
          "variable tau, start=100ns, stop=300ns, steps=3",
          "a on channel 1 at 0ns, square, tau, 1.0",
          "b on channel 2 at 200ns, square, 100ns, 1.0");
      List<ConcreteSequence> seqs = builder.build(desc);
      for (int i = 0; i < 3; i++) {
        ConcreteSequence seq = seqs.get(i);
        assertTime(1000, seq.getNominalDuration());
        assertTime(1000 + 100 * i, seq.getDuration());
        assertTime(200 + 100 * i, seq.getPulses(OutputChannel.CH2).get(0).getStart());
      }
    }

    @Test
    void fixedPulsesDoNotMove() {
      SequenceDescription desc = parse(
          "variable tau, start=100ns, stop=200ns, steps=2",
          "a on channel 1 at 0ns, square, tau, 1.0",
          "trigger on channel 3 at 150ns, square, 10ns, 1.0 [fixed]",
          "b on channel 1 at 100ns, square, 10ns, 1.0");
      ConcreteSequence second = builder.build(desc).get(1);
      assertTime(150, second.getPulses(OutputChannel.CH1_MARKER1).get(0).getStart());
      assertTime(200, second.getPulses(OutputChannel.CH1).get(1).getStart());
    }

    @Test
    void withoutHeaderDurationTheSequenceEndsAtTheLastPulse() {
      SequenceDescription desc = parse(
          "a on channel 1 at 0ns, square, 40ns, 1.0",
          "b on channel 2 at 100ns, square, 60ns, 1.0");
      ConcreteSequence seq = builder.build(desc).get(0);
      assertTime(160, seq.getDuration());
      assertTime(160, seq.getNominalDuration());
    }
  }

  @Nested
  @DisplayName("loops and conditionals")
  class Blocks {

    @Test
    void loopUnrollsAfterPrecedingContent() {
      SequenceDescription desc = parse(
          "a on channel 2 at 0ns, square, 50ns, 1.0",
          "loop 3",
          "  p on channel 1 at 0ns, square, 10ns, 1.0",
          "end");
      List<ConcretePulse> ch1 = builder.build(desc).get(0).getPulses(OutputChannel.CH1);
      assertEquals(3, ch1.size());
      assertTime(50, ch1.get(0).getStart());
      assertTime(60, ch1.get(1).getStart());
      assertTime(70, ch1.get(2).getStart());
    }

    @Test
    void loopAtExplicitStart() {
      SequenceDescription desc = parse(
          "loop 2 at 1us",
          "  p on channel 1 at 0ns, square, 10ns, 1.0",
          "end");
      List<ConcretePulse> pulses = builder.build(desc).get(0).getPulses();
      assertTime(1000, pulses.get(0).getStart());
      assertTime(1010, pulses.get(1).getStart());
    }

    @Test
    void loopVariableBindsEachValue() {
      SequenceDescription desc = parse(
          "variable n, start=10ns, stop=30ns, steps=3",
          "loop n",
          "  p on channel 1 at 0ns, square, n, 1.0",
          "end",
          "after on channel 2 at 0ns, square, 10ns, 1.0");
      List<ConcreteSequence> seqs = builder.build(desc);
      assertEquals(1, seqs.size());
      List<ConcretePulse> ch1 = seqs.get(0).getPulses(OutputChannel.CH1);
      assertTime(0, ch1.get(0).getStart());
      assertTime(10, ch1.get(1).getStart());
      assertTime(30, ch1.get(2).getStart());
      assertTime(30, ch1.get(2).getDuration());
    }

    @Test
    void conditionalSelectsBranchPerScanPoint() {
      SequenceDescription desc = parse(
          "variable tau, start=10ns, stop=20ns, steps=2",
          "if tau > 15ns",
          "  a on channel 1 at 0ns, square, 10ns, 1.0",
          "else",
          "  b on channel 2 at 0ns, square, 10ns, 1.0",
          "end");
      List<ConcreteSequence> seqs = builder.build(desc);
      assertEquals("b", seqs.get(0).getPulses().get(0).getLabel());
      assertEquals("a", seqs.get(1).getPulses().get(0).getLabel());
    }
  }

  @Nested
  @DisplayName("errors")
  class Errors {

    @Test
    void overlappingPulsesOnOneChannel() {
      SequenceDescription desc = parse(
          "a on channel 1 at 0ns, square, 100ns, 1.0",
          "b on channel 1 at 50ns, square, 10ns, 0.5");
      assertThrows(TimingOrderException.class, () -> builder.build(desc));
    }

    @Test
    void concurrentPulsesMayOverlap() {
      SequenceDescription desc = parse(
          "a on channel 1 at 0ns, square, 100ns, 0.5",
          "b on channel 1 at 50ns, square, 10ns, 0.5 [concurrent]");
      assertEquals(2, builder.build(desc).get(0).getPulses().size());
    }

    @Test
    void negativeStart() {
      assertThrows(TimingOrderException.class,
          () -> builder.build(parse("a on channel 1 at -10ns, square, 100ns, 1.0")));
    }

    @Test
    void pulseBeyondTheEnd() {
      assertThrows(TimingOrderException.class, () -> builder.build(parse(
          "sequence: duration=100ns",
          "a on channel 1 at 50ns, square, 100ns, 1.0")));
    }

    @Test
    void undeclaredVariable() {
      UnresolvedVariableException e = assertThrows(UnresolvedVariableException.class,
          () -> builder.build(parse("a on channel 1 at delay, square, 100ns, 1.0")));
      assertEquals("delay", e.getVariable());
    }

    @Test
    void nonPositiveDurationAtAScanPoint() {
      SequenceDescription desc = parse(
          "variable d, start=10ns, stop=-10ns, steps=2",
          "a on channel 1 at 0ns, square, d, 1.0");
      assertThrows(InvalidParameterException.class, () -> builder.build(desc));
    }

    @Test
    void bestEffortSkipsFailingScanPoints() {
      SequenceDescription desc = parse(
          "variable d, start=10ns, stop=-10ns, steps=3",
          "a on channel 1 at 0ns, square, d, 1.0");
      BuildResult result = builder.build(desc, BuildOptions.defaults().bestEffort());
      assertFalse(result.isComplete());
      assertEquals(1, result.getSequences().size());
      assertEquals(2, result.getFailures().size());
      assertEquals(1, result.getFailures().get(0).getPoint().getIndex());
      assertInstanceOf(InvalidParameterException.class, result.getFailures().get(1).getError());
    }

    @Test
    void abortStopsBetweenScanPoints() {
      AbortFlag flag = new AbortFlag();
      flag.abort();
      SequenceDescription desc = parse(
          "variable d, start=10ns, stop=20ns, steps=3",
          "a on channel 1 at 0ns, square, d, 1.0");
      assertThrows(CompilationAbortedException.class,
          () -> builder.build(desc, BuildOptions.defaults().withAbortFlag(flag)));
    }
  }

  @Nested
  @DisplayName("scan points")
  class ScanPoints {

    @Test
    void firstDeclaredVariableIsOutermost() {
      SequenceDescription desc = parse(
          "variable a, start=10ns, stop=20ns, steps=2",
          "variable b, start=0, stop=1, steps=3",
          "p on channel 1 at 0ns, square, a, b");
      List<ScanPoint> points = ScanPoint.enumerate(desc);
      assertEquals(6, points.size());
      assertEquals(6, ScanPoint.count(desc));
      assertEquals(Quantity.of("10E-9", Dimension.TIME), points.get(1).getValues().get("a"));
      assertEquals(Quantity.of("0.5", Dimension.DIMENSIONLESS), points.get(1).getValues().get("b"));
      assertEquals(Quantity.of("20E-9", Dimension.TIME), points.get(3).getValues().get("a"));
      assertEquals(5, points.get(5).getIndex());
    }

    @Test
    void parallelBuildMatchesSerialBuild() throws Exception {
      SequenceDescription desc = parse(
          "variable a, start=10ns, stop=50ns, steps=5",
          "variable b, start=0ns, stop=20ns, steps=3",
          "x on channel 1 at 0ns, square, a, 1.0",
          "y on channel 2 at b, square, 10ns, 1.0",
          "z on channel 1 at 100ns, square, 10ns, 1.0");
      List<ConcreteSequence> serial = builder.build(desc);
      ExecutorService executor = Executors.newFixedThreadPool(4);
      try {
        BuildResult parallel = builder.buildParallel(desc, executor, BuildOptions.defaults());
        assertTrue(parallel.isComplete());
        assertEquals(serial.size(), parallel.getSequences().size());
        for (int i = 0; i < serial.size(); i++) {
          assertEquals(i, parallel.getSequences().get(i).getScanIndex());
          assertEquals(serial.get(i).getPulses(), parallel.getSequences().get(i).getPulses());
        }
      } finally {
        executor.shutdownNow();
      }
    }

    @Test
    void parallelBuildPropagatesErrors() {
      SequenceDescription desc = parse(
          "variable d, start=10ns, stop=-10ns, steps=2",
          "a on channel 1 at 0ns, square, d, 1.0");
      ExecutorService executor = Executors.newSingleThreadExecutor();
      try {
        assertThrows(InvalidParameterException.class,
            () -> builder.buildParallel(desc, executor, BuildOptions.defaults()));
      } finally {
        executor.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("sample estimates and splitting")
  class Splitting {

    private ConcreteSequence sequence(long durationNs, ConcretePulse... pulses) {
      return new ConcreteSequence("split", 0, ImmutableMap.<String, Quantity>of(), GHZ,
          ns(durationNs), ns(durationNs), 1, Lists.newArrayList(pulses));
    }

    @Test
    void estimateSampleCount() {
      ConcreteSequence seq = sequence(1000, square(OutputChannel.CH1, 0, 100));
      assertEquals(1000, SequenceBuilder.estimateSampleCount(seq, GHZ));
      assertEquals(250, SequenceBuilder.estimateSampleCount(seq, new BigDecimal("2.5E8")));
    }

    @Test
    void shortSequenceIsNotSplit() {
      ConcreteSequence seq = sequence(400, square(OutputChannel.CH1, 0, 100));
      assertEquals(1, SequenceBuilder.splitAtBoundaries(seq, 500).size());
    }

    @Test
    void cutsFallBetweenPulses() {
      ConcreteSequence seq = sequence(1000,
          square(OutputChannel.CH1, 0, 100),
          square(OutputChannel.CH1, 300, 400),
          square(OutputChannel.CH2, 900, 50));
      List<ConcreteSequence> pieces = SequenceBuilder.splitAtBoundaries(seq, 500, 4);
      assertEquals(3, pieces.size());
      assertEquals(300, pieces.get(0).getDurationSamples());
      assertEquals(500, pieces.get(1).getDurationSamples());
      assertEquals(200, pieces.get(2).getDurationSamples());
      assertTime(0, pieces.get(1).getPulses().get(0).getStart());
      assertTime(100, pieces.get(2).getPulses().get(0).getStart());
      long total = 0;
      for (ConcreteSequence piece : pieces) {
        assertTrue(piece.getDurationSamples() <= 500);
        total += piece.getDurationSamples();
      }
      assertEquals(1000, total);
    }

    @Test
    void pulseLongerThanTheLimitCannotBeSplit() {
      ConcreteSequence seq = sequence(1000, square(OutputChannel.CH1, 0, 800));
      assertThrows(MemoryBudgetException.class, () -> SequenceBuilder.splitAtBoundaries(seq, 500));
    }

    @Test
    void samplesRoundHalfUp() {
      assertEquals(3, Timing.toSamples(new BigDecimal("2.5E-9"), GHZ));
      assertEquals(2, Timing.toSamples(new BigDecimal("2.4E-9"), GHZ));
    }
  }
}
