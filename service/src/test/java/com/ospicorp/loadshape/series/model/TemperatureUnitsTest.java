package com.ospicorp.loadshape.series.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TemperatureUnitsTest {

  @Test
  void parsesShortAndLongNames() {
    assertEquals(TemperatureUnits.FAHRENHEIT, TemperatureUnits.parse("F"));
    assertEquals(TemperatureUnits.CELSIUS, TemperatureUnits.parse("c"));
    assertEquals(TemperatureUnits.CELSIUS, TemperatureUnits.parse(" Celsius "));
  }

  @Test
  void defaultsToFahrenheit() {
    assertEquals(TemperatureUnits.FAHRENHEIT, TemperatureUnits.parse(null));
    assertEquals(TemperatureUnits.FAHRENHEIT, TemperatureUnits.parse(""));
  }

  @Test
  void rejectsUnknownUnits() {
    assertThrows(IllegalArgumentException.class, () -> TemperatureUnits.parse("K"));
  }

  @Test
  void exclusionBoundsAreInclusive() {
    Exclusion exclusion = new Exclusion(100L, 200L);
    assertTrue(exclusion.covers(100L));
    assertTrue(exclusion.covers(200L));
    assertFalse(exclusion.covers(201L));
  }
}
