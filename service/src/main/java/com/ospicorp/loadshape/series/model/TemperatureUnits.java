package com.ospicorp.loadshape.series.model;

import java.util.Locale;

public enum TemperatureUnits {
  FAHRENHEIT,
  CELSIUS;

  public static TemperatureUnits parse(String value) {
    if (value == null || value.isBlank()) {
      return FAHRENHEIT;
    }
    return switch (value.trim().toUpperCase(Locale.ROOT)) {
      case "F", "FAHRENHEIT" -> FAHRENHEIT;
      case "C", "CELSIUS" -> CELSIUS;
      default -> throw new IllegalArgumentException("Unknown temperature units: " + value);
    };
  }
}
