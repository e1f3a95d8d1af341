package com.ospicorp.loadshape.exception;

public class ZeroBaselineException extends LoadshapeException {
  private final String metric;

  public ZeroBaselineException(String metric) {
    super("ZERO_BASELINE", "Cannot compute percentage: " + metric + " is zero");
    this.metric = metric;
  }

  public String metric() {
    return metric;
  }
}
