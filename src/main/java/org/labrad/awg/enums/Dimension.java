package org.labrad.awg.enums;

/**
 * Physical dimension of a quantity. Literals are stored in SI base units of their dimension.
 */
public enum Dimension {
  TIME("s"),
  VOLTAGE("V"),
  FREQUENCY("Hz"),
  ANGLE("deg"),
  DIMENSIONLESS("");

  private final String baseUnit;

  Dimension(String baseUnit) {
    this.baseUnit = baseUnit;
  }

  public String getBaseUnit() {
    return baseUnit;
  }
}
