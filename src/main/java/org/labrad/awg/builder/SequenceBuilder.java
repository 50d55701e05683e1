package org.labrad.awg.builder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.labrad.awg.description.SequenceDescription;
import org.labrad.awg.errors.CompilationAbortedException;
import org.labrad.awg.errors.MemoryBudgetException;
import org.labrad.awg.errors.SemanticException;
import org.labrad.awg.util.Timing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

/**
 * Expands a sequence description into one timing-resolved sequence per scan point.
 *
 * Scan points are independent of each other, so they can be built in any
 * order or in parallel; results are always returned in scan order.
 */
public class SequenceBuilder {
  private static final Logger log = LoggerFactory.getLogger(SequenceBuilder.class);

  public List<ConcreteSequence> build(SequenceDescription desc) {
    return build(desc, BuildOptions.defaults()).getSequences();
  }

  public BuildResult build(SequenceDescription desc, BuildOptions options) {
    TimelineFold fold = new TimelineFold(desc);
    List<ScanPoint> points = ScanPoint.enumerate(desc);
    log.info("Building {} scan points of {}", points.size(), desc.getName());
    List<ConcreteSequence> sequences = Lists.newArrayList();
    List<ScanPointFailure> failures = Lists.newArrayList();
    for (ScanPoint point : points) {
      if (options.getAbortFlag().isAborted()) {
        throw new CompilationAbortedException(point.getIndex());
      }
      try {
        ConcreteSequence seq = fold.resolve(point);
        log.debug("Built {}", seq);
        sequences.add(seq);
      } catch (SemanticException e) {
        if (!options.isBestEffort()) {
          throw e;
        }
        log.warn("Skipping scan point {}: {}", point, e.getMessage());
        failures.add(new ScanPointFailure(point, e));
      }
    }
    logSummary(desc, sequences, failures);
    return new BuildResult(sequences, failures);
  }

  /**
   * Build every scan point as a separate task on the given executor.
   */
  public BuildResult buildParallel(SequenceDescription desc, ExecutorService executor,
      final BuildOptions options) {
    final TimelineFold fold = new TimelineFold(desc);
    ListeningExecutorService service = MoreExecutors.listeningDecorator(executor);
    List<ListenableFuture<ScanOutcome>> futures = Lists.newArrayList();
    for (final ScanPoint point : ScanPoint.enumerate(desc)) {
      futures.add(service.submit(new Callable<ScanOutcome>() {
        @Override
        public ScanOutcome call() {
          if (options.getAbortFlag().isAborted()) {
            throw new CompilationAbortedException(point.getIndex());
          }
          try {
            return new ScanOutcome(fold.resolve(point), null);
          } catch (SemanticException e) {
            if (!options.isBestEffort()) {
              throw e;
            }
            log.warn("Skipping scan point {}: {}", point, e.getMessage());
            return new ScanOutcome(null, new ScanPointFailure(point, e));
          }
        }
      }));
    }
    // allAsList keeps submission order, which is scan order
    ListenableFuture<BuildResult> combined = Futures.transform(Futures.allAsList(futures),
        new Function<List<ScanOutcome>, BuildResult>() {
          @Override
          public BuildResult apply(List<ScanOutcome> outcomes) {
            List<ConcreteSequence> sequences = Lists.newArrayList();
            List<ScanPointFailure> failures = Lists.newArrayList();
            for (ScanOutcome outcome : outcomes) {
              if (outcome.sequence != null) {
                sequences.add(outcome.sequence);
              } else {
                failures.add(outcome.failure);
              }
            }
            return new BuildResult(sequences, failures);
          }
        }, MoreExecutors.directExecutor());
    try {
      BuildResult result = combined.get();
      logSummary(desc, result.getSequences(), result.getFailures());
      return result;
    } catch (ExecutionException e) {
      cancelAll(futures);
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new IllegalStateException("Scan point build failed", e.getCause());
    } catch (InterruptedException e) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new CompilationAbortedException(0);
    }
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> f : futures) {
      f.cancel(true);
    }
  }

  private static void logSummary(SequenceDescription desc, List<ConcreteSequence> sequences,
      List<ScanPointFailure> failures) {
    if (failures.isEmpty()) {
      log.info("Built {} scan points of {}", sequences.size(), desc.getName());
    } else {
      log.warn("Built {} scan points of {}, {} failed", sequences.size(), desc.getName(), failures.size());
    }
  }

  /**
   * Raw per-channel sample count of a sequence at the given rate.
   */
  public static long estimateSampleCount(ConcreteSequence seq, BigDecimal sampleRate) {
    return Timing.toSamples(seq.getDuration(), sampleRate);
  }

  public static List<ConcreteSequence> splitAtBoundaries(ConcreteSequence seq, long maxSamples) {
    return splitAtBoundaries(seq, maxSamples, 1);
  }

  /**
   * Split a sequence into consecutive pieces of at most maxSamples samples.
   *
   * Cuts fall on multiples of alignment and never inside a pulse. Each piece
   * keeps the pulses that start in it, moved to the piece's time origin.
   *
   * @throws MemoryBudgetException if a fragment that cannot be cut is longer than maxSamples
   */
  public static List<ConcreteSequence> splitAtBoundaries(ConcreteSequence seq, long maxSamples, int alignment) {
    Preconditions.checkArgument(alignment >= 1, "alignment must be positive");
    Preconditions.checkArgument(maxSamples >= alignment, "maxSamples must be at least the alignment");
    BigDecimal rate = seq.getSampleRate();
    long total = seq.getDurationSamples();
    if (total <= maxSamples) {
      return Lists.newArrayList(seq);
    }
    List<long[]> busy = busyIntervals(seq);

    List<Long> cuts = Lists.newArrayList();
    long pos = 0;
    while (total - pos > maxSamples) {
      long cut = findCut(busy, pos, pos + maxSamples, alignment);
      if (cut <= pos) {
        throw new MemoryBudgetException(String.format(
            "%s: fragment starting at sample %d cannot be cut into pieces of at most %d samples",
            seq, pos, maxSamples));
      }
      cuts.add(cut);
      pos = cut;
    }
    cuts.add(total);

    List<ConcreteSequence> pieces = Lists.newArrayList();
    long pieceStart = 0;
    for (long cut : cuts) {
      boolean last = cut == total;
      BigDecimal origin = Timing.toSeconds(pieceStart, rate);
      List<ConcretePulse> pulses = Lists.newArrayList();
      for (ConcretePulse p : seq.getPulses()) {
        long s = p.getStartSample(rate);
        if (s >= pieceStart && (s < cut || last)) {
          pulses.add(p.withStart(p.getStart().subtract(origin)));
        }
      }
      BigDecimal length = last ? seq.getDuration().subtract(origin) : Timing.toSeconds(cut - pieceStart, rate);
      pieces.add(new ConcreteSequence(seq.getName(), seq.getScanIndex(), seq.getScanValues(), rate,
          length, length, seq.getRepeatCount(), pulses));
      pieceStart = cut;
    }
    log.debug("Split {} into {} pieces at {}", seq, pieces.size(), cuts);
    return pieces;
  }

  /**
   * Sample intervals covered by pulses, merged, sorted by start.
   */
  private static List<long[]> busyIntervals(ConcreteSequence seq) {
    List<long[]> intervals = Lists.newArrayList();
    for (ConcretePulse p : seq.getPulses()) {
      long s = p.getStartSample(seq.getSampleRate());
      long e = p.getEndSample(seq.getSampleRate());
      if (e > s) {
        intervals.add(new long[] {s, e});
      }
    }
    Collections.sort(intervals, new Comparator<long[]>() {
      @Override
      public int compare(long[] a, long[] b) {
        return Long.compare(a[0], b[0]);
      }
    });
    List<long[]> merged = Lists.newArrayList();
    for (long[] iv : intervals) {
      long[] prev = merged.isEmpty() ? null : merged.get(merged.size() - 1);
      if (prev != null && iv[0] < prev[1]) {
        prev[1] = Math.max(prev[1], iv[1]);
      } else {
        merged.add(new long[] {iv[0], iv[1]});
      }
    }
    return merged;
  }

  /**
   * Latest aligned sample in (pos, limit] that no busy interval strictly contains,
   * or pos if there is none.
   */
  private static long findCut(List<long[]> busy, long pos, long limit, int alignment) {
    long cut = (limit / alignment) * alignment;
    while (cut > pos) {
      long[] blocking = null;
      for (long[] iv : busy) {
        if (iv[0] < cut && cut < iv[1]) {
          blocking = iv;
          break;
        }
      }
      if (blocking == null) {
        return cut;
      }
      cut = (blocking[0] / alignment) * alignment;
    }
    return pos;
  }

  private static final class ScanOutcome {
    final ConcreteSequence sequence;
    final ScanPointFailure failure;

    ScanOutcome(ConcreteSequence sequence, ScanPointFailure failure) {
      this.sequence = sequence;
      this.failure = failure;
    }
  }
}
