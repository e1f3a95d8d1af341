package com.ospicorp.loadshape.series.service;

import com.ospicorp.loadshape.exception.EmptySeriesException;
import com.ospicorp.loadshape.exception.InsufficientDataException;
import com.ospicorp.loadshape.exception.SeriesValidationException;
import com.ospicorp.loadshape.series.model.Exclusion;
import com.ospicorp.loadshape.series.model.RawReading;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import com.ospicorp.loadshape.series.model.TemperatureUnits;
import com.ospicorp.loadshape.series.model.Validation;
import java.io.Reader;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Time-ordered numeric readings keyed by UTC epoch seconds, with exclusion windows that are
 * filtered out of {@link #data} reads by default.
 *
 * <p>Rows whose value cannot be read as a number (garbage strings, {@code null}, NaN) are dropped
 * while loading. Repeated timestamps are kept, in insertion order. Apart from the exclusion list
 * a series is immutable once built.
 */
public class Series {
  private static final int MAX_SECOND_DIGITS = 10;
  private static final long SECONDS_PER_DAY = 86_400L;

  private final List<SeriesPoint> points;
  private final List<String> violations;
  private final List<Exclusion> exclusions = new ArrayList<>();
  private final ZoneId zone;
  private final TemperatureUnits temperatureUnits;
  private final int dataColumn;

  private Series(Builder builder) {
    this.zone = builder.zone != null ? builder.zone : TimestampNormalizer.resolveZone(null);
    this.temperatureUnits = builder.temperatureUnits;
    this.dataColumn = builder.dataColumn;
    this.violations = new ArrayList<>();

    List<SeriesPoint> loaded = new ArrayList<>();
    if (builder.points != null) {
      for (SeriesPoint p : builder.points) {
        accept(p.timestamp(), p.value(), loaded);
      }
    }
    List<RawReading> readings = builder.readings;
    if (builder.csv != null) {
      readings = SeriesCsvReader.read(builder.csv, dataColumn);
    }
    if (readings != null) {
      for (RawReading row : readings) {
        accept(TimestampNormalizer.normalize(row.timestamp(), zone), row.value(), loaded);
      }
    }
    loaded.sort(Comparator.comparingLong(SeriesPoint::timestamp));
    this.points = Collections.unmodifiableList(loaded);

    if (builder.validation == Validation.STRICT) {
      validate(true);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  // --- reads ---

  public List<SeriesPoint> data() {
    return data(null, null, null, true);
  }

  public List<SeriesPoint> data(Object startAt, Object endAt) {
    return data(startAt, endAt, null, true);
  }

  public List<SeriesPoint> data(Object startAt, Object endAt, boolean exclude) {
    return data(startAt, endAt, null, exclude);
  }

  /**
   * Reads a section of the series.
   *
   * <p>Each bound applies on its own: a lone {@code startAt} keeps everything from that instant
   * on, a lone {@code endAt} everything up to it. Bounds are not ignored when only one is given.
   *
   * @param startAt inclusive lower bound, any normalizable timestamp; defaults to the first point
   * @param endAt inclusive upper bound; defaults to the last point
   * @param stepSize when set, values are linearly interpolated onto a grid from {@code startAt}
   *     stepping by this many seconds and rounded to two decimals
   * @param exclude drop points that fall inside an exclusion window
   */
  public List<SeriesPoint> data(Object startAt, Object endAt, Long stepSize, boolean exclude) {
    if (stepSize == null && points.isEmpty()) {
      return new ArrayList<>();
    }
    if (stepSize != null && points.size() < 2) {
      throw new InsufficientDataException(
          "interpolation needs at least two points, series has " + points.size());
    }
    boolean slice = startAt != null || endAt != null;
    long start = startAt != null ? TimestampNormalizer.normalize(startAt, zone) : startAt();
    long end = endAt != null ? TimestampNormalizer.normalize(endAt, zone) : endAt();

    List<SeriesPoint> out = stepSize != null
        ? interpolate(start, end, stepSize)
        : new ArrayList<>(points);
    if (slice) {
      out = slice(out, start, end);
    }
    if (exclude) {
      for (Exclusion exclusion : exclusions) {
        out = exclude(out, exclusion);
      }
    }
    return out;
  }

  public List<Double> values() {
    List<Double> out = new ArrayList<>(points.size());
    for (SeriesPoint p : points) {
      out.add(p.value());
    }
    return out;
  }

  public double sum() {
    double total = 0d;
    for (SeriesPoint p : points) {
      total += p.value();
    }
    return total;
  }

  public double average() {
    if (points.isEmpty()) {
      throw new EmptySeriesException("cannot average an empty series");
    }
    return sum() / points.size();
  }

  public long startAt() {
    if (points.isEmpty()) {
      throw new EmptySeriesException("empty series has no start");
    }
    return points.get(0).timestamp();
  }

  public long endAt() {
    if (points.isEmpty()) {
      throw new EmptySeriesException("empty series has no end");
    }
    return points.get(points.size() - 1).timestamp();
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  public List<SeriesPoint> points() {
    return points;
  }

  public boolean isFahrenheit() {
    return temperatureUnits == TemperatureUnits.FAHRENHEIT;
  }

  public TemperatureUnits temperatureUnits() {
    return temperatureUnits;
  }

  public int dataColumn() {
    return dataColumn;
  }

  public ZoneId zone() {
    return zone;
  }

  public boolean valid() {
    return validate(false);
  }

  // --- exclusions ---

  public void addExclusion(Object start, Object end) {
    exclusions.add(new Exclusion(
        TimestampNormalizer.normalize(start, zone),
        TimestampNormalizer.normalize(end, zone)));
  }

  public void addNamedExclusion(String name, ExclusionCalendars calendars) {
    for (LocalDate date : calendars.dates(name)) {
      long dayStart = date.atStartOfDay(zone).toEpochSecond();
      exclusions.add(new Exclusion(dayStart, dayStart + SECONDS_PER_DAY));
    }
  }

  public void clearExclusions() {
    exclusions.clear();
  }

  public List<Exclusion> exclusions() {
    return Collections.unmodifiableList(exclusions);
  }

  // --- internals ---

  private void accept(long timestamp, Object rawValue, List<SeriesPoint> sink) {
    String violation = checkEntry(timestamp, rawValue);
    if (violation != null) {
      violations.add(violation);
      return;
    }
    double value = coerce(rawValue);
    if (!Double.isNaN(value)) {
      sink.add(new SeriesPoint(timestamp, value));
    }
  }

  private boolean validate(boolean raise) {
    String first = violations.isEmpty() ? null : violations.get(0);
    for (int i = 0; first == null && i < points.size(); i++) {
      SeriesPoint p = points.get(i);
      first = checkEntry(p.timestamp(), p.value());
    }
    if (first != null && raise) {
      throw new SeriesValidationException(first);
    }
    return first == null;
  }

  private static String checkEntry(long timestamp, Object value) {
    if (TimestampNormalizer.digitCount(timestamp) > MAX_SECOND_DIGITS) {
      return "timestamps must be in seconds since unix epoch, got " + timestamp;
    }
    if (value != null && !(value instanceof Number) && !(value instanceof CharSequence)) {
      return "values must be numbers or null, got " + value.getClass().getSimpleName()
          + " '" + value + "'";
    }
    return null;
  }

  private static double coerce(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof CharSequence text) {
      try {
        return Double.parseDouble(text.toString().trim());
      } catch (NumberFormatException ex) {
        return Double.NaN;
      }
    }
    return Double.NaN;
  }

  private List<SeriesPoint> interpolate(long start, long end, long stepSize) {
    if (stepSize <= 0) {
      throw new IllegalArgumentException("step size must be positive, got " + stepSize);
    }
    LinearInterpolator interpolator = new LinearInterpolator(points);
    List<SeriesPoint> out = new ArrayList<>();
    for (long t = start; t <= end; t += stepSize) {
      out.add(new SeriesPoint(t, round2(interpolator.valueAt(t))));
    }
    return out;
  }

  private static List<SeriesPoint> slice(List<SeriesPoint> in, long start, long end) {
    List<SeriesPoint> out = new ArrayList<>(in.size());
    for (SeriesPoint p : in) {
      if (p.timestamp() >= start && p.timestamp() <= end) {
        out.add(p);
      }
    }
    return out;
  }

  private static List<SeriesPoint> exclude(List<SeriesPoint> in, Exclusion exclusion) {
    List<SeriesPoint> out = new ArrayList<>(in.size());
    for (SeriesPoint p : in) {
      if (!exclusion.covers(p.timestamp())) {
        out.add(p);
      }
    }
    return out;
  }

  static double round2(double value) {
    return Math.round(value * 100d) / 100d;
  }

  public static final class Builder {
    private List<RawReading> readings;
    private List<SeriesPoint> points;
    private Reader csv;
    private ZoneId zone;
    private TemperatureUnits temperatureUnits = TemperatureUnits.FAHRENHEIT;
    private int dataColumn = 1;
    private Validation validation = Validation.STRICT;

    private Builder() {
    }

    public Builder readings(List<RawReading> readings) {
      this.readings = readings;
      return this;
    }

    public Builder points(List<SeriesPoint> points) {
      this.points = points;
      return this;
    }

    /** Delimited rows: column 0 timestamp, {@link #dataColumn(int)} value. */
    public Builder csv(Reader csv) {
      this.csv = csv;
      return this;
    }

    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public Builder temperatureUnits(TemperatureUnits temperatureUnits) {
      this.temperatureUnits = temperatureUnits != null
          ? temperatureUnits
          : TemperatureUnits.FAHRENHEIT;
      return this;
    }

    public Builder dataColumn(int dataColumn) {
      if (dataColumn < 1) {
        throw new IllegalArgumentException("data column must be >= 1, got " + dataColumn);
      }
      this.dataColumn = dataColumn;
      return this;
    }

    public Builder validation(Validation validation) {
      this.validation = validation;
      return this;
    }

    public Series build() {
      return new Series(this);
    }
  }
}
