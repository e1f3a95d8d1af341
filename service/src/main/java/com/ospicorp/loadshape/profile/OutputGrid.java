package com.ospicorp.loadshape.profile;

import java.util.ArrayList;
import java.util.List;

final class OutputGrid {
  private OutputGrid() {
  }

  /** {@code start, start + step, ...} up to and including {@code end}. */
  static List<Long> timestamps(long start, long end, long stepSize, Integer stepCount) {
    if (end < start) {
      throw new IllegalArgumentException("end " + end + " is before start " + start);
    }
    long step = stepSize;
    if (stepCount != null) {
      if (stepCount <= 0) {
        throw new IllegalArgumentException("step count must be positive, got " + stepCount);
      }
      step = (end - start) / stepCount;
    }
    if (step <= 0) {
      throw new IllegalArgumentException("step size must be positive, got " + step);
    }
    List<Long> out = new ArrayList<>();
    for (long t = start; t <= end; t += step) {
      out.add(t);
    }
    return out;
  }
}
