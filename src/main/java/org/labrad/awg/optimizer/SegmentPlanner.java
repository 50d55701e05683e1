package org.labrad.awg.optimizer;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.labrad.awg.Constants;
import org.labrad.awg.HardwareProfile;
import org.labrad.awg.builder.ConcretePulse;
import org.labrad.awg.builder.ConcreteSequence;
import org.labrad.awg.builder.SequenceBuilder;
import org.labrad.awg.description.Quantity;
import org.labrad.awg.enums.Dimension;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.enums.PulseShape;
import org.labrad.awg.errors.InvalidParameterException;
import org.labrad.awg.errors.MemoryBudgetException;
import org.labrad.awg.util.Timing;
import org.labrad.awg.waveform.ChannelWaveform;
import org.labrad.awg.waveform.DeadTimeSpan;
import org.labrad.awg.waveform.MarkerSpan;
import org.labrad.awg.waveform.ShapeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

/**
 * Lays out one scan point as alternating active stretches and dead time spans.
 *
 * Gaps between pulses of at least DEAD_TIME_THRESHOLD samples become dead time
 * spans. Active stretches longer than the waveform memory are split at pulse
 * boundaries. The last piece of an active stretch is padded to the waveform
 * granularity by taking samples from the dead time after it, or from the
 * background after the end of the sequence.
 */
class SegmentPlanner {
  private static final Logger log = LoggerFactory.getLogger(SegmentPlanner.class);
  private static final double AMPLITUDE_TOLERANCE = 1e-9;

  private final HardwareProfile profile;

  SegmentPlanner(HardwareProfile profile) {
    this.profile = profile;
  }

  List<Segment> plan(ConcreteSequence seq) {
    BigDecimal rate = seq.getSampleRate();
    long total = seq.getDurationSamples();
    List<ConcretePulse> pulses = quantize(seq);
    List<long[]> busy = busyIntervals(pulses, rate);

    // dead spans, in order
    long threshold = profile.getDeadTimeThreshold();
    List<DeadTimeSpan> dead = Lists.newArrayList();
    long cursor = 0;
    for (long[] iv : busy) {
      if (iv[0] - cursor >= threshold) {
        dead.add(new DeadTimeSpan(cursor, iv[0], Constants.SAFE_LEVEL));
      }
      cursor = Math.max(cursor, iv[1]);
    }
    if (total - cursor >= threshold) {
      dead.add(new DeadTimeSpan(cursor, total, Constants.SAFE_LEVEL));
    }

    List<Segment> segments = Lists.newArrayList();
    long pos = 0;
    int d = 0;
    while (pos < total) {
      if (d < dead.size() && dead.get(d).getStart() == pos) {
        segments.add(Segment.dead(dead.get(d)));
        pos = dead.get(d).getEnd();
        d++;
        continue;
      }
      long regionEnd = d < dead.size() ? dead.get(d).getStart() : total;
      long padding = planRegion(seq, pulses, pos, regionEnd, segments);
      if (padding > 0 && d < dead.size()) {
        DeadTimeSpan next = dead.get(d);
        dead.set(d, new DeadTimeSpan(next.getStart() + padding, next.getEnd(), next.getValue()));
        pos = regionEnd + padding;
      } else {
        pos = regionEnd;
      }
    }
    log.debug("Planned {}: {}", seq, segments);
    return segments;
  }

  /**
   * Plan the active stretch [start, end), appending its pieces. Returns the
   * number of padding samples added after the end.
   */
  private long planRegion(ConcreteSequence seq, List<ConcretePulse> pulses, long start, long end,
      List<Segment> segments) {
    BigDecimal rate = seq.getSampleRate();
    BigDecimal origin = Timing.toSeconds(start, rate);
    List<ConcretePulse> inRegion = Lists.newArrayList();
    for (ConcretePulse p : pulses) {
      long s = p.getStartSample(rate);
      if (s >= start && s < end) {
        inRegion.add(p.withStart(Timing.toSeconds(s - start, rate)));
      }
    }
    BigDecimal length = Timing.toSeconds(end - start, rate);
    ConcreteSequence region = new ConcreteSequence(seq.getName(), seq.getScanIndex(), seq.getScanValues(),
        rate, length, length, seq.getRepeatCount(), inRegion);

    long max = profile.getMaxWaveformSamples();
    List<ConcreteSequence> pieces = SequenceBuilder.splitAtBoundaries(region, max,
        profile.getWaveformGranularity());
    long offset = start;
    long padding = 0;
    for (int i = 0; i < pieces.size(); i++) {
      ConcreteSequence piece = pieces.get(i);
      long len = piece.getDurationSamples();
      long padded = len;
      if (i < pieces.size() - 1) {
        if (len < profile.getMinWaveformLength()) {
          throw new MemoryBudgetException(String.format(
              "%s: piece of %d samples at sample %d is shorter than the minimum waveform length %d",
              seq, len, offset, profile.getMinWaveformLength()));
        }
      } else {
        padded = profile.getPaddedLength(len);
        if (padded > max) {
          throw new MemoryBudgetException(String.format(
              "%s: stretch at sample %d needs %d samples after padding, over the budget of %d",
              seq, offset, padded, max));
        }
        padding = padded - len;
      }
      segments.add(Segment.active(offset, waveforms(piece, padded)));
      offset += len;
    }
    return padding;
  }

  /**
   * One waveform per analog channel for a piece whose pulses start at its origin.
   */
  private ChannelWaveform[] waveforms(ConcreteSequence piece, long length) {
    BigDecimal rate = piece.getSampleRate();
    int channels = profile.getAnalogChannels();
    List<List<ShapeDescriptor>> shapes = Lists.newArrayList();
    List<List<MarkerSpan>> markers = Lists.newArrayList();
    for (int i = 0; i < channels; i++) {
      shapes.add(Lists.<ShapeDescriptor>newArrayList());
      markers.add(Lists.<MarkerSpan>newArrayList());
    }
    for (ConcretePulse p : piece.getPulses()) {
      long s = p.getStartSample(rate);
      long len = p.getEndSample(rate) - s;
      int column = p.getChannel().getAnalogChannel() - 1;
      if (column >= channels) {
        throw new InvalidParameterException(String.format("Pulse %s uses channel %s but the device has %d analog channels",
            p, p.getChannel(), channels));
      }
      if (p.getChannel().isMarker()) {
        markers.get(column).add(new MarkerSpan(p.getChannel().getMarkerShift(), s, len));
      } else {
        double cycles = p.getFrequency() == null ? 0.0
            : p.getFrequency().divide(rate, MathContext.DECIMAL128).doubleValue();
        shapes.get(column).add(new ShapeDescriptor(p.getShape(), s, len, normalize(p),
            p.getPhaseDegrees().doubleValue(), cycles, p.getShape() == PulseShape.LOADFILE ? p.getFile() : null));
      }
    }
    ChannelWaveform[] result = new ChannelWaveform[channels];
    for (int i = 0; i < channels; i++) {
      checkFullScale(shapes.get(i), i + 1, piece);
      result[i] = new ChannelWaveform(length, Constants.SAFE_LEVEL, shapes.get(i), markers.get(i));
    }
    return result;
  }

  /**
   * Amplitude as a fraction of full scale.
   */
  private double normalize(ConcretePulse p) {
    Quantity amp = p.getAmplitude();
    double value = amp.is(Dimension.VOLTAGE)
        ? amp.getValue().doubleValue() / profile.getFullScaleVolts()
        : amp.getValue().doubleValue();
    if (Math.abs(value) > 1 + AMPLITUDE_TOLERANCE) {
      throw new InvalidParameterException(String.format("Pulse %s exceeds full scale (%s)", p, value));
    }
    return value;
  }

  /**
   * Overlapping shapes add, so their summed magnitude must stay within full scale.
   */
  private void checkFullScale(List<ShapeDescriptor> shapes, int channel, ConcreteSequence piece) {
    for (ShapeDescriptor a : shapes) {
      double sum = 0;
      for (ShapeDescriptor b : shapes) {
        if (b.getOffset() <= a.getOffset() && a.getOffset() < b.getEnd()) {
          sum += Math.abs(b.getAmplitude());
        }
      }
      if (sum > 1 + AMPLITUDE_TOLERANCE) {
        throw new InvalidParameterException(String.format(
            "%s: overlapping pulses on channel %d add up to %s of full scale", piece, channel, sum));
      }
    }
  }

  /**
   * Snap every pulse to whole samples so that later moves are exact.
   */
  private static List<ConcretePulse> quantize(ConcreteSequence seq) {
    BigDecimal rate = seq.getSampleRate();
    List<ConcretePulse> result = Lists.newArrayList();
    for (ConcretePulse p : seq.getPulses()) {
      long s = p.getStartSample(rate);
      long e = p.getEndSample(rate);
      if (e <= s) {
        throw new InvalidParameterException(String.format("Pulse %s is shorter than one sample at %s Hz",
            p, rate.toPlainString()));
      }
      result.add(new ConcretePulse(p.getLabel(), p.getChannel(), p.getShape(), Timing.toSeconds(s, rate),
          Timing.toSeconds(e - s, rate), p.getAmplitude(), p.getPhaseDegrees(), p.getFrequency(), p.getFile(),
          p.isConcurrent()));
    }
    return result;
  }

  private static List<long[]> busyIntervals(List<ConcretePulse> pulses, BigDecimal rate) {
    List<long[]> intervals = Lists.newArrayList();
    for (ConcretePulse p : pulses) {
      intervals.add(new long[] {p.getStartSample(rate), p.getEndSample(rate)});
    }
    Collections.sort(intervals, new Comparator<long[]>() {
      @Override
      public int compare(long[] a, long[] b) {
        return Long.compare(a[0], b[0]);
      }
    });
    return intervals;
  }

  /**
   * Analog channels that carry any pulse in the given sequences. When none do,
   * the first channel still plays so every table entry has a waveform.
   */
  static boolean[] usedChannels(List<ConcreteSequence> sequences, int analogChannels) {
    boolean[] used = new boolean[analogChannels];
    boolean any = false;
    for (ConcreteSequence seq : sequences) {
      for (ConcretePulse p : seq.getPulses()) {
        OutputChannel ch = p.getChannel();
        if (ch.getAnalogChannel() <= analogChannels) {
          used[ch.getAnalogChannel() - 1] = true;
          any = true;
        }
      }
    }
    if (!any) {
      used[0] = true;
    }
    return used;
  }
}
