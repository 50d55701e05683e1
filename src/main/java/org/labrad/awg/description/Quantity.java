package org.labrad.awg.description;

import java.math.BigDecimal;

import org.labrad.awg.enums.Dimension;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * An exact value in SI base units tagged with its physical dimension.
 */
public final class Quantity implements Comparable<Quantity> {
  private final BigDecimal value;
  private final Dimension dimension;

  public Quantity(BigDecimal value, Dimension dimension) {
    Preconditions.checkNotNull(value, "value");
    Preconditions.checkNotNull(dimension, "dimension");
    this.value = value;
    this.dimension = dimension;
  }

  public static Quantity of(String value, Dimension dimension) {
    return new Quantity(new BigDecimal(value), dimension);
  }

  public static Quantity seconds(BigDecimal value) {
    return new Quantity(value, Dimension.TIME);
  }

  public static Quantity dimensionless(BigDecimal value) {
    return new Quantity(value, Dimension.DIMENSIONLESS);
  }

  public BigDecimal getValue() {
    return value;
  }

  public Dimension getDimension() {
    return dimension;
  }

  public boolean is(Dimension d) {
    return dimension == d;
  }

  public Quantity plus(Quantity other) {
    checkSameDimension(other);
    return new Quantity(value.add(other.value), dimension);
  }

  public Quantity minus(Quantity other) {
    checkSameDimension(other);
    return new Quantity(value.subtract(other.value), dimension);
  }

  public int signum() {
    return value.signum();
  }

  @Override
  public int compareTo(Quantity other) {
    checkSameDimension(other);
    return value.compareTo(other.value);
  }

  private void checkSameDimension(Quantity other) {
    Preconditions.checkArgument(dimension == other.dimension,
        "Cannot combine %s with %s", this, other);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Quantity)) {
      return false;
    }
    Quantity other = (Quantity) obj;
    return dimension == other.dimension && value.compareTo(other.value) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value.stripTrailingZeros(), dimension);
  }

  @Override
  public String toString() {
    return value.stripTrailingZeros().toPlainString() + dimension.getBaseUnit();
  }
}
