package com.ospicorp.loadshape.exception;

public class MissingTariffException extends LoadshapeException {
  public MissingTariffException(String message) {
    super("MISSING_TARIFF", message);
  }
}
