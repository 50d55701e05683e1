package org.labrad.awg.builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.labrad.awg.description.ConditionalDescription;
import org.labrad.awg.description.LoopDescription;
import org.labrad.awg.description.ParameterValue;
import org.labrad.awg.description.Predicate;
import org.labrad.awg.description.PulseDescription;
import org.labrad.awg.description.Quantity;
import org.labrad.awg.description.SequenceDescription;
import org.labrad.awg.description.SequenceNode;
import org.labrad.awg.description.VariableDescription;
import org.labrad.awg.enums.Dimension;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.enums.PulseShape;
import org.labrad.awg.errors.InvalidParameterException;
import org.labrad.awg.errors.TimingOrderException;
import org.labrad.awg.errors.UnresolvedVariableException;
import org.labrad.awg.util.Timing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Resolves one scan point of a sequence into absolute pulse times.
 *
 * Nodes are folded in source order carrying an accumulated shift: every
 * pulse moves by the shift, then grows it by the difference between its
 * actual and nominal duration. A loop moves by the shift and grows it by the
 * difference between its actual and nominal length. Nominal values are the
 * start values of the variables.
 */
class TimelineFold {
  private final SequenceDescription desc;
  private final ImmutableMap<String, Quantity> nominal;

  TimelineFold(SequenceDescription desc) {
    this.desc = desc;
    Map<String, Quantity> values = Maps.newLinkedHashMap();
    for (VariableDescription v : desc.getVariables()) {
      values.put(v.getName(), v.getNominal());
    }
    this.nominal = ImmutableMap.copyOf(values);
  }

  ConcreteSequence resolve(ScanPoint point) {
    Map<String, Quantity> actual = Maps.newHashMap(nominal);
    actual.putAll(point.getValues());

    Timeline timeline = foldBlock(desc.getNodes(), nominal, ImmutableMap.copyOf(actual), Timeline.EMPTY);

    BigDecimal nominalDuration;
    BigDecimal duration;
    if (desc.getDuration() != null) {
      nominalDuration = desc.getDuration().getValue();
      duration = nominalDuration.add(timeline.shift);
    } else {
      nominalDuration = timeline.nominalEnd;
      duration = timeline.actualEnd;
    }
    if (duration.signum() <= 0) {
      throw new InvalidParameterException(String.format(
          "Scan point %s of %s resolves to a non-positive duration %s",
          point, desc.getName(), Timing.format(duration)));
    }
    validate(timeline.pulses, duration, point);
    return new ConcreteSequence(desc.getName(), point.getIndex(), point.getValues(),
        desc.getSampleRate(), nominalDuration, duration, desc.getRepeatCount(), timeline.pulses);
  }

  /**
   * Per channel, pulses must start at or after zero and after the end of the earlier
   * pulses, unless flagged concurrent, and must end within the sequence.
   */
  private void validate(List<ConcretePulse> pulses, BigDecimal duration, ScanPoint point) {
    Map<OutputChannel, BigDecimal> channelEnds = Maps.newEnumMap(OutputChannel.class);
    for (ConcretePulse p : pulses) {
      if (p.getStart().signum() < 0) {
        throw new TimingOrderException(String.format("Pulse %s starts before time zero at scan point %s",
            p, point));
      }
      BigDecimal prevEnd = channelEnds.get(p.getChannel());
      if (prevEnd != null && !p.isConcurrent() && p.getStart().compareTo(prevEnd) < 0) {
        throw new TimingOrderException(String.format(
            "Pulse %s starts before the previous pulse on channel %s ends (%s) at scan point %s",
            p, p.getChannel(), Timing.format(prevEnd), point));
      }
      if (p.getEnd().compareTo(duration) > 0) {
        throw new TimingOrderException(String.format(
            "Pulse %s ends after the sequence (%s) at scan point %s", p, Timing.format(duration), point));
      }
      if (prevEnd == null || p.getEnd().compareTo(prevEnd) > 0) {
        channelEnds.put(p.getChannel(), p.getEnd());
      }
    }
  }

  private Timeline foldBlock(List<SequenceNode> nodes, Map<String, Quantity> nb,
      Map<String, Quantity> ab, Timeline state) {
    Timeline t = state;
    for (SequenceNode node : nodes) {
      if (node instanceof PulseDescription) {
        t = placePulse((PulseDescription) node, nb, ab, t);
      } else if (node instanceof LoopDescription) {
        t = placeLoop((LoopDescription) node, nb, ab, t);
      } else if (node instanceof ConditionalDescription) {
        ConditionalDescription cond = (ConditionalDescription) node;
        boolean taken = evaluate(cond.getPredicate(), ab, cond.getLine());
        t = foldBlock(taken ? cond.getThenBranch() : cond.getElseBranch(), nb, ab, t);
      } else {
        throw new IllegalStateException("Unknown sequence node " + node);
      }
    }
    return t;
  }

  private Timeline placePulse(PulseDescription pd, Map<String, Quantity> nb, Map<String, Quantity> ab,
      Timeline t) {
    String where = describe(pd);
    BigDecimal nominalStart = resolve(pd.getStart(), nb, where, Dimension.TIME).getValue();
    BigDecimal nominalDuration = resolve(pd.getDuration(), nb, where, Dimension.TIME).getValue();
    BigDecimal actualStart = resolve(pd.getStart(), ab, where, Dimension.TIME).getValue();
    BigDecimal actualDuration = resolve(pd.getDuration(), ab, where, Dimension.TIME).getValue();
    if (actualDuration.signum() <= 0) {
      throw new InvalidParameterException(String.format("%s has non-positive duration %s",
          where, Timing.format(actualDuration)));
    }

    Quantity amplitude = resolve(pd.getAmplitude(), ab, where, Dimension.DIMENSIONLESS, Dimension.VOLTAGE);
    BigDecimal phase = pd.getPhase() == null ? BigDecimal.ZERO
        : resolve(pd.getPhase(), ab, where, Dimension.ANGLE, Dimension.DIMENSIONLESS).getValue();
    BigDecimal frequency = null;
    if (pd.getShape() == PulseShape.SINE) {
      if (pd.getFrequency() == null) {
        throw new InvalidParameterException(where + " is a sine pulse without a frequency");
      }
      frequency = resolve(pd.getFrequency(), ab, where, Dimension.FREQUENCY).getValue();
    }

    BigDecimal start = pd.isFixed() ? actualStart : actualStart.add(t.shift);
    ConcretePulse pulse = new ConcretePulse(pd.getLabel(), pd.getChannel(), pd.getShape(), start,
        actualDuration, amplitude, phase, frequency, pd.getFile(), pd.isConcurrent());
    return t.with(pulse, nominalStart.add(nominalDuration), actualDuration.subtract(nominalDuration));
  }

  private Timeline placeLoop(LoopDescription loop, Map<String, Quantity> nb, Map<String, Quantity> ab,
      Timeline t) {
    String where = "loop at line " + loop.getLine();
    BigDecimal nominalStart;
    BigDecimal actualStart;
    if (loop.getStart() != null) {
      nominalStart = resolve(loop.getStart(), nb, where, Dimension.TIME).getValue();
      actualStart = resolve(loop.getStart(), ab, where, Dimension.TIME).getValue().add(t.shift);
    } else {
      nominalStart = t.nominalEnd;
      actualStart = t.nominalEnd.add(t.shift);
    }

    List<Quantity> iterations = iterationValues(loop, where);
    String iterator = loop.getIterator();
    BigDecimal nominalOffset = BigDecimal.ZERO;
    BigDecimal actualOffset = BigDecimal.ZERO;
    List<ConcretePulse> placed = Lists.newArrayList();
    for (Quantity value : iterations) {
      Map<String, Quantity> iterNominal = nb;
      Map<String, Quantity> iterActual = ab;
      if (iterator != null) {
        iterNominal = bind(nb, iterator, value);
        iterActual = bind(ab, iterator, value);
      }
      Timeline nominalIteration = foldBlock(loop.getBody(), iterNominal, iterNominal, Timeline.EMPTY);
      Timeline actualIteration = foldBlock(loop.getBody(), iterNominal, iterActual, Timeline.EMPTY);
      BigDecimal base = actualStart.add(actualOffset);
      for (ConcretePulse p : actualIteration.pulses) {
        placed.add(p.withStart(base.add(p.getStart())));
      }
      nominalOffset = nominalOffset.add(nominalIteration.actualEnd);
      actualOffset = actualOffset.add(actualIteration.actualEnd);
    }
    return t.withAll(placed, nominalStart.add(nominalOffset), actualOffset.subtract(nominalOffset));
  }

  private List<Quantity> iterationValues(LoopDescription loop, String where) {
    ParameterValue source = loop.getIterations();
    if (source.isVariable()) {
      VariableDescription v = desc.getVariable(source.getVariable());
      if (v == null) {
        throw new UnresolvedVariableException(source.getVariable(), where);
      }
      return v.getValues();
    }
    Quantity count = source.getLiteral();
    List<Quantity> values = Lists.newArrayList();
    for (int i = 0; i < count.getValue().intValueExact(); i++) {
      values.add(Quantity.dimensionless(BigDecimal.valueOf(i)));
    }
    return values;
  }

  private boolean evaluate(Predicate predicate, Map<String, Quantity> ab, int line) {
    String where = "condition at line " + line;
    Quantity left = resolve(predicate.getLeft(), ab, where);
    if (predicate.getOperator() == null) {
      return left.signum() != 0;
    }
    Quantity right = resolve(predicate.getRight(), ab, where);
    if (left.getDimension() != right.getDimension()) {
      throw new InvalidParameterException(String.format("%s compares %s with %s", where, left, right));
    }
    return predicate.getOperator().test(left.compareTo(right));
  }

  private Quantity resolve(ParameterValue p, Map<String, Quantity> bindings, String where,
      Dimension... allowed) {
    Quantity q;
    if (p.isVariable()) {
      q = bindings.get(p.getVariable());
      if (q == null) {
        throw new UnresolvedVariableException(p.getVariable(), where);
      }
    } else {
      q = p.getLiteral();
    }
    if (allowed.length == 0) {
      return q;
    }
    for (Dimension d : allowed) {
      if (q.getDimension() == d) {
        return q;
      }
    }
    throw new InvalidParameterException(String.format("%s: %s has dimension %s, expected %s",
        where, p, q.getDimension(), allowed[0]));
  }

  private static Map<String, Quantity> bind(Map<String, Quantity> bindings, String name, Quantity value) {
    Map<String, Quantity> result = Maps.newHashMap(bindings);
    result.put(name, value);
    return result;
  }

  private static String describe(PulseDescription pd) {
    return pd.getLine() > 0
        ? String.format("pulse '%s' (line %d)", pd.getLabel(), pd.getLine())
        : String.format("pulse '%s'", pd.getLabel());
  }

  /**
   * Immutable fold state: placed pulses, accumulated shift, nominal end of the
   * content so far and latest actual end.
   */
  private static final class Timeline {
    static final Timeline EMPTY =
        new Timeline(ImmutableList.<ConcretePulse>of(), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    final ImmutableList<ConcretePulse> pulses;
    final BigDecimal shift;
    final BigDecimal nominalEnd;
    final BigDecimal actualEnd;

    Timeline(ImmutableList<ConcretePulse> pulses, BigDecimal shift, BigDecimal nominalEnd, BigDecimal actualEnd) {
      this.pulses = pulses;
      this.shift = shift;
      this.nominalEnd = nominalEnd;
      this.actualEnd = actualEnd;
    }

    Timeline with(ConcretePulse pulse, BigDecimal pulseNominalEnd, BigDecimal delta) {
      return withAll(ImmutableList.of(pulse), pulseNominalEnd, delta);
    }

    Timeline withAll(List<ConcretePulse> added, BigDecimal addedNominalEnd, BigDecimal delta) {
      BigDecimal end = actualEnd;
      for (ConcretePulse p : added) {
        end = end.max(p.getEnd());
      }
      return new Timeline(
          ImmutableList.<ConcretePulse>builder().addAll(pulses).addAll(added).build(),
          shift.add(delta),
          nominalEnd.max(addedNominalEnd),
          end);
    }
  }
}
