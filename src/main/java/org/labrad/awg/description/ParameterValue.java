package org.labrad.awg.description;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A pulse or loop parameter: either a literal quantity or a reference to a
 * variable, resolved once per scan point.
 */
public final class ParameterValue {
  private final Quantity literal;
  private final String variable;

  private ParameterValue(Quantity literal, String variable) {
    this.literal = literal;
    this.variable = variable;
  }

  public static ParameterValue literal(Quantity q) {
    Preconditions.checkNotNull(q);
    return new ParameterValue(q, null);
  }

  public static ParameterValue variable(String name) {
    Preconditions.checkNotNull(name);
    return new ParameterValue(null, name);
  }

  public boolean isVariable() {
    return variable != null;
  }

  public String getVariable() {
    Preconditions.checkState(isVariable(), "%s is not a variable reference", this);
    return variable;
  }

  public Quantity getLiteral() {
    Preconditions.checkState(!isVariable(), "%s is a variable reference", this);
    return literal;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ParameterValue)) {
      return false;
    }
    ParameterValue other = (ParameterValue) obj;
    return Objects.equal(literal, other.literal) && Objects.equal(variable, other.variable);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(literal, variable);
  }

  @Override
  public String toString() {
    return isVariable() ? variable : literal.toString();
  }
}
