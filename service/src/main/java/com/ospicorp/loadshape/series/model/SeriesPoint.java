package com.ospicorp.loadshape.series.model;

// timestamp is UTC epoch seconds
public record SeriesPoint(long timestamp, double value) {}
