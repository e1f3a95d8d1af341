package com.ospicorp.loadshape.exception;

/**
 * Raised when stored series data breaks the series invariants. The message is the first
 * violation found.
 */
public class SeriesValidationException extends LoadshapeException {
  public SeriesValidationException(String message) {
    super("SERIES_VALIDATION", message);
  }
}
