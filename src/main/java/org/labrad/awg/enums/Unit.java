package org.labrad.awg.enums;

import java.math.BigDecimal;
import java.util.Map;

import com.google.common.collect.Maps;

/**
 * Unit suffixes accepted on numeric literals, with their scale to the SI base unit.
 */
public enum Unit {
  NS("ns", Dimension.TIME, "1E-9"),
  US("us", Dimension.TIME, "1E-6"),
  US_MICRO("µs", Dimension.TIME, "1E-6"),
  US_MU("μs", Dimension.TIME, "1E-6"),
  MS("ms", Dimension.TIME, "1E-3"),
  S("s", Dimension.TIME, "1"),
  MV("mv", Dimension.VOLTAGE, "1E-3"),
  V("v", Dimension.VOLTAGE, "1"),
  HZ("hz", Dimension.FREQUENCY, "1"),
  KHZ("khz", Dimension.FREQUENCY, "1E+3"),
  MHZ("mhz", Dimension.FREQUENCY, "1E+6"),
  GHZ("ghz", Dimension.FREQUENCY, "1E+9"),
  DEG("deg", Dimension.ANGLE, "1");

  private final String suffix;
  private final Dimension dimension;
  private final BigDecimal scale;
  private static final Map<String, Unit> map = Maps.newHashMap();

  Unit(String suffix, Dimension dimension, String scale) {
    this.suffix = suffix;
    this.dimension = dimension;
    this.scale = new BigDecimal(scale);
  }

  public String toString() {
    return suffix;
  }

  public Dimension getDimension() {
    return dimension;
  }

  /**
   * Convert a value given in this unit to the SI base unit, exactly.
   */
  public BigDecimal toBase(BigDecimal value) {
    return value.multiply(scale);
  }

  static {
    for (Unit u : values()) {
      map.put(u.suffix, u);
    }
  }

  /**
   * Look up a unit by suffix, ignoring case. Returns null for an unknown suffix.
   */
  public static Unit forSuffix(String suffix) {
    return map.get(suffix.toLowerCase());
  }
}
