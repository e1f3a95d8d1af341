package com.ospicorp.loadshape.series.model;

public enum Validation {
  STRICT,   // first violation raises SeriesValidationException
  LENIENT   // violations are recorded, offending rows dropped, valid() reports false
}
