package com.ospicorp.loadshape.exception;

public class UnknownExclusionSetException extends LoadshapeException {
  private final String name;

  public UnknownExclusionSetException(String name) {
    super("UNKNOWN_EXCLUSION_SET", "Unknown named exclusion: " + name);
    this.name = name;
  }

  public String name() {
    return name;
  }
}
