package com.ospicorp.loadshape.series.model;

/**
 * Untyped ingestion row. The timestamp may be anything the timestamp normalizer accepts, the
 * value anything coercible to a double.
 */
public record RawReading(Object timestamp, Object value) {}
