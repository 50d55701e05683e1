package org.labrad.awg.description;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

import org.labrad.awg.enums.Dimension;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A scan variable swept linearly from start to stop in a fixed number of steps.
 *
 * The start value is the nominal value: times written in the sequence are
 * authored for the first scan point.
 */
public final class VariableDescription {
  private final String name;
  private final Quantity start;
  private final Quantity stop;
  private final int steps;

  public VariableDescription(String name, Quantity start, Quantity stop, int steps) {
    Preconditions.checkNotNull(name);
    Preconditions.checkArgument(steps >= 1, "Variable '%s' needs at least one step", name);
    Preconditions.checkArgument(start.getDimension() == stop.getDimension(),
        "Variable '%s' has mismatched start %s and stop %s", name, start, stop);
    this.name = name;
    this.start = start;
    this.stop = stop;
    this.steps = steps;
  }

  public String getName() {
    return name;
  }

  public Quantity getStart() {
    return start;
  }

  public Quantity getStop() {
    return stop;
  }

  public int getSteps() {
    return steps;
  }

  public Dimension getDimension() {
    return start.getDimension();
  }

  public Quantity getNominal() {
    return start;
  }

  /**
   * Generated values, start + i * (stop - start) / (steps - 1).
   */
  public List<Quantity> getValues() {
    ImmutableList.Builder<Quantity> values = ImmutableList.builder();
    if (steps == 1) {
      return values.add(start).build();
    }
    BigDecimal span = stop.getValue().subtract(start.getValue());
    BigDecimal intervals = BigDecimal.valueOf(steps - 1);
    for (int i = 0; i < steps; i++) {
      BigDecimal offset = span.multiply(BigDecimal.valueOf(i)).divide(intervals, MathContext.DECIMAL128);
      values.add(new Quantity(start.getValue().add(offset), getDimension()));
    }
    return values.build();
  }

  @Override
  public String toString() {
    return String.format("%s[%s..%s, %d steps]", name, start, stop, steps);
  }
}
