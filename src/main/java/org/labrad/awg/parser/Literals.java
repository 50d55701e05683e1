package org.labrad.awg.parser;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.labrad.awg.description.ParameterValue;
import org.labrad.awg.description.Quantity;
import org.labrad.awg.enums.Dimension;
import org.labrad.awg.enums.Unit;
import org.labrad.awg.errors.SequenceSyntaxException;
import org.labrad.awg.errors.UnknownUnitException;

/**
 * Numeric literals with optional unit suffix, normalized exactly to SI.
 */
class Literals {
  private static final Pattern NUMBER =
      Pattern.compile("^([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)\\s*(\\S*)$");
  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private Literals() {}

  public static boolean isIdentifier(String token) {
    return IDENTIFIER.matcher(token).matches();
  }

  public static Quantity parseQuantity(String token, int line) {
    Matcher m = NUMBER.matcher(token.trim());
    if (!m.matches()) {
      throw new SequenceSyntaxException(line, token, "expected a number");
    }
    BigDecimal value = new BigDecimal(m.group(1));
    String suffix = m.group(2);
    if (suffix.isEmpty()) {
      return new Quantity(value, Dimension.DIMENSIONLESS);
    }
    Unit unit = Unit.forSuffix(suffix);
    if (unit == null) {
      throw new UnknownUnitException(line, token);
    }
    return new Quantity(unit.toBase(value), unit.getDimension());
  }

  /**
   * A literal of one of the allowed dimensions.
   */
  public static Quantity parseQuantity(String token, int line, Dimension... allowed) {
    Quantity q = parseQuantity(token, line);
    checkDimension(q, token, line, allowed);
    return q;
  }

  /**
   * A variable reference, or a literal of one of the allowed dimensions.
   */
  public static ParameterValue parseParameter(String token, int line, Dimension... allowed) {
    String t = token.trim();
    if (isIdentifier(t)) {
      return ParameterValue.variable(t);
    }
    return ParameterValue.literal(parseQuantity(t, line, allowed));
  }

  public static long parsePositiveInteger(String token, int line) {
    Quantity q = parseQuantity(token, line, Dimension.DIMENSIONLESS);
    try {
      long value = q.getValue().longValueExact();
      if (value < 1) {
        throw new SequenceSyntaxException(line, token, "expected a positive integer");
      }
      return value;
    } catch (ArithmeticException e) {
      throw new SequenceSyntaxException(line, token, "expected a positive integer");
    }
  }

  private static void checkDimension(Quantity q, String token, int line, Dimension... allowed) {
    if (allowed.length == 0) {
      return;
    }
    for (Dimension d : allowed) {
      if (q.getDimension() == d) {
        return;
      }
    }
    throw new SequenceSyntaxException(line, token,
        "expected a " + allowed[0].name().toLowerCase() + " value");
  }
}
