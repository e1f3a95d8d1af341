package com.ospicorp.loadshape.exception;

public class InvalidTimestampException extends LoadshapeException {
  public InvalidTimestampException(String message) {
    super("INVALID_TIMESTAMP", message);
  }

  public InvalidTimestampException(String message, Throwable cause) {
    super("INVALID_TIMESTAMP", message, cause);
  }
}
