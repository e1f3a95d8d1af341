package com.ospicorp.loadshape.exception;

public class EmptySeriesException extends LoadshapeException {
  public EmptySeriesException(String message) {
    super("EMPTY_SERIES", message);
  }
}
