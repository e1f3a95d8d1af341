package com.ospicorp.loadshape.series.service;

import com.ospicorp.loadshape.exception.InsufficientDataException;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.util.Arrays;
import java.util.List;

/**
 * Piecewise-linear view over time-ordered points with flat extrapolation past both ends.
 * Repeated timestamps collapse to the last value seen.
 */
public final class LinearInterpolator {
  private final long[] xs;
  private final double[] ys;

  public LinearInterpolator(List<SeriesPoint> points) {
    if (points.isEmpty()) {
      throw new InsufficientDataException("cannot interpolate an empty series");
    }
    long[] x = new long[points.size()];
    double[] y = new double[points.size()];
    int n = 0;
    for (SeriesPoint p : points) {
      if (n > 0 && x[n - 1] == p.timestamp()) {
        y[n - 1] = p.value();
        continue;
      }
      if (n > 0 && p.timestamp() < x[n - 1]) {
        throw new IllegalArgumentException("points must be sorted by timestamp");
      }
      x[n] = p.timestamp();
      y[n] = p.value();
      n++;
    }
    this.xs = Arrays.copyOf(x, n);
    this.ys = Arrays.copyOf(y, n);
  }

  public double valueAt(long t) {
    int last = xs.length - 1;
    if (t <= xs[0]) return ys[0];
    if (t >= xs[last]) return ys[last];
    int idx = Arrays.binarySearch(xs, t);
    if (idx >= 0) return ys[idx];
    int hi = -idx - 1;
    int lo = hi - 1;
    double fraction = (double) (t - xs[lo]) / (double) (xs[hi] - xs[lo]);
    return ys[lo] + fraction * (ys[hi] - ys[lo]);
  }

  /**
   * Exact integral of the interpolated curve over {@code [from, to]}, in value-seconds.
   */
  public double integrate(long from, long to) {
    if (to < from) {
      throw new IllegalArgumentException("integration bounds out of order: " + from + " > " + to);
    }
    if (to == from) {
      return 0d;
    }
    int idx = Arrays.binarySearch(xs, from);
    int next = idx >= 0 ? idx + 1 : -idx - 1;

    double total = 0d;
    long prevT = from;
    double prevV = valueAt(from);
    for (int i = next; i < xs.length && xs[i] < to; i++) {
      total += (prevV + ys[i]) / 2d * (xs[i] - prevT);
      prevT = xs[i];
      prevV = ys[i];
    }
    total += (prevV + valueAt(to)) / 2d * (to - prevT);
    return total;
  }
}
