package com.ospicorp.loadshape.exception;

public class TariffFormatException extends LoadshapeException {
  public TariffFormatException(String message) {
    super("TARIFF_FORMAT", message);
  }

  public TariffFormatException(String message, Throwable cause) {
    super("TARIFF_FORMAT", message, cause);
  }
}
