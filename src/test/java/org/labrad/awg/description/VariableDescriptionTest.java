package org.labrad.awg.description;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.labrad.awg.enums.Dimension;

public class VariableDescriptionTest {

  @Test
  void valuesAreEvenlySpacedIncludingEnds() {
    VariableDescription v = new VariableDescription("tau",
        Quantity.of("100E-9", Dimension.TIME), Quantity.of("300E-9", Dimension.TIME), 5);
    List<Quantity> values = v.getValues();
    assertEquals(5, values.size());
    assertEquals(Quantity.of("100E-9", Dimension.TIME), values.get(0));
    assertEquals(Quantity.of("150E-9", Dimension.TIME), values.get(1));
    assertEquals(Quantity.of("300E-9", Dimension.TIME), values.get(4));
  }

  @Test
  void decreasingSweep() {
    VariableDescription v = new VariableDescription("amp",
        Quantity.of("1", Dimension.DIMENSIONLESS), Quantity.of("0", Dimension.DIMENSIONLESS), 3);
    assertEquals(Quantity.of("0.5", Dimension.DIMENSIONLESS), v.getValues().get(1));
  }

  @Test
  void singleStepIsTheStartValue() {
    VariableDescription v = new VariableDescription("tau",
        Quantity.of("1E-6", Dimension.TIME), Quantity.of("2E-6", Dimension.TIME), 1);
    assertEquals(1, v.getValues().size());
    assertEquals(v.getStart(), v.getValues().get(0));
    assertEquals(v.getStart(), v.getNominal());
  }

  @Test
  void rejectsMismatchedDimensions() {
    assertThrows(IllegalArgumentException.class, () -> new VariableDescription("x",
        Quantity.of("1", Dimension.TIME), Quantity.of("1", Dimension.VOLTAGE), 2));
  }

  @Test
  void quantityEqualityIgnoresScale() {
    assertEquals(Quantity.of("1.000E-6", Dimension.TIME), Quantity.of("0.000001", Dimension.TIME));
    assertEquals(Quantity.of("1.000E-6", Dimension.TIME).hashCode(),
        Quantity.of("0.000001", Dimension.TIME).hashCode());
  }
}
