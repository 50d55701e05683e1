package org.labrad.awg.description;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * A comparison between two operands, or a single operand that holds when non-zero.
 */
public final class Predicate {

  public enum Operator {
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;
    private static final Map<String, Operator> map = Maps.newHashMap();

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String toString() {
      return symbol;
    }

    public boolean test(int comparison) {
      switch (this) {
        case EQ: return comparison == 0;
        case NE: return comparison != 0;
        case LT: return comparison < 0;
        case LE: return comparison <= 0;
        case GT: return comparison > 0;
        case GE: return comparison >= 0;
        default: throw new IllegalStateException("Unhandled operator " + this);
      }
    }

    static {
      for (Operator op : values()) {
        map.put(op.symbol, op);
      }
    }

    public static Operator fromString(String symbol) {
      Preconditions.checkArgument(map.containsKey(symbol),
          "Invalid comparison operator '%s'", symbol);
      return map.get(symbol);
    }
  }

  private final ParameterValue left;
  private final Operator operator;
  private final ParameterValue right;

  public Predicate(ParameterValue left, Operator operator, ParameterValue right) {
    Preconditions.checkNotNull(left);
    Preconditions.checkArgument((operator == null) == (right == null),
        "Operator and right operand must be given together");
    this.left = left;
    this.operator = operator;
    this.right = right;
  }

  public static Predicate of(ParameterValue operand) {
    return new Predicate(operand, null, null);
  }

  public ParameterValue getLeft() {
    return left;
  }

  /**
   * Operator, or null for a bare operand.
   */
  public Operator getOperator() {
    return operator;
  }

  public ParameterValue getRight() {
    return right;
  }

  @Override
  public String toString() {
    return operator == null ? left.toString() : left + " " + operator + " " + right;
  }
}
