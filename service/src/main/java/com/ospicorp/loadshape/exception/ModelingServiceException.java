package com.ospicorp.loadshape.exception;

/**
 * Failure reported by a baseline modeling backend. {@link #diagnostics()} holds whatever the
 * backend printed or returned (stderr, stdout, response body) and may be empty.
 */
public class ModelingServiceException extends LoadshapeException {
  private final String diagnostics;

  public ModelingServiceException(String message, String diagnostics) {
    super("MODELING_SERVICE", message);
    this.diagnostics = diagnostics == null ? "" : diagnostics;
  }

  public ModelingServiceException(String message, String diagnostics, Throwable cause) {
    super("MODELING_SERVICE", message, cause);
    this.diagnostics = diagnostics == null ? "" : diagnostics;
  }

  public String diagnostics() {
    return diagnostics;
  }
}
