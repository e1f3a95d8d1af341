package com.ospicorp.loadshape.series.model;

// closed interval, epoch seconds
public record Exclusion(long start, long end) {

  public boolean covers(long timestamp) {
    return timestamp >= start && timestamp <= end;
  }
}
