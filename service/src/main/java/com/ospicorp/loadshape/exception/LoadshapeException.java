package com.ospicorp.loadshape.exception;

public class LoadshapeException extends RuntimeException {
  private final String errorCode;

  public LoadshapeException(String errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public LoadshapeException(String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public String errorCode() {
    return errorCode;
  }
}
