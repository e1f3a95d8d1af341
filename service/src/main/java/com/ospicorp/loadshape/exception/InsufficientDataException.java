package com.ospicorp.loadshape.exception;

public class InsufficientDataException extends LoadshapeException {
  public InsufficientDataException(String message) {
    super("INSUFFICIENT_DATA", message);
  }
}
