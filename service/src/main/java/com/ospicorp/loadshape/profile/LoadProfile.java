package com.ospicorp.loadshape.profile;

import com.ospicorp.loadshape.baseline.BaselineModelingService;
import com.ospicorp.loadshape.baseline.BaselineRequest;
import com.ospicorp.loadshape.baseline.BaselineResponse;
import com.ospicorp.loadshape.exception.MissingTariffException;
import com.ospicorp.loadshape.exception.ZeroBaselineException;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import com.ospicorp.loadshape.series.model.Validation;
import com.ospicorp.loadshape.series.service.ExclusionCalendars;
import com.ospicorp.loadshape.series.service.LinearInterpolator;
import com.ospicorp.loadshape.series.service.Series;
import com.ospicorp.loadshape.series.service.TimestampNormalizer;
import com.ospicorp.loadshape.tariff.CostResult;
import com.ospicorp.loadshape.tariff.ScheduleTariffCostModel;
import com.ospicorp.loadshape.tariff.Tariff;
import com.ospicorp.loadshape.tariff.TariffCostModel;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A building's metered load together with the baseline fitted to it.
 *
 * <p>{@link #baseline(BaselineParameters)} fits the baseline through the configured
 * {@link BaselineModelingService}; diff, cumulative sum and event performance are then derived
 * from the actual load and that baseline. Reads that need a baseline fit one with
 * {@link BaselineParameters#defaults()} when none exists. Instances are not thread-safe.
 */
public class LoadProfile {
  private static final Logger log = LoggerFactory.getLogger(LoadProfile.class);
  private static final double SECONDS_PER_HOUR = 3_600d;
  private static final int DEFAULT_FIRST_HOLIDAY_YEAR = 2005;
  private static final int DEFAULT_LAST_HOLIDAY_YEAR = 2035;

  private final Series trainingLoad;
  private final Series trainingTemperature;
  private final Series forecastTemperature;
  private final Double floorArea;
  private final ZoneId zone;
  private final BaselineModelingService modelingService;
  private final TariffCostModel costModel;
  private final ExclusionCalendars calendars;
  private Tariff tariff;

  private Series baselineSeries;
  private Map<String, Double> errorStats;

  private LoadProfile(Builder builder) {
    this.trainingLoad = Objects.requireNonNull(builder.trainingLoad, "trainingLoad");
    this.modelingService = Objects.requireNonNull(builder.modelingService, "modelingService");
    if (builder.trainingTemperature == null && builder.forecastTemperature != null) {
      log.warn("Forecast temperature supplied without training temperature; it will be ignored");
    }
    this.trainingTemperature = builder.trainingTemperature;
    this.forecastTemperature = builder.forecastTemperature;
    this.floorArea = builder.floorArea;
    this.zone = trainingLoad.zone();
    this.tariff = builder.tariff;
    this.costModel = builder.costModel != null ? builder.costModel : new ScheduleTariffCostModel();
    this.calendars = builder.calendars != null
        ? builder.calendars
        : ExclusionCalendars.withBuiltIns(DEFAULT_FIRST_HOLIDAY_YEAR, DEFAULT_LAST_HOLIDAY_YEAR);
  }

  public static Builder builder() {
    return new Builder();
  }

  // --- baseline ---

  public Series baseline() {
    return baseline(BaselineParameters.defaults());
  }

  public Series baseline(BaselineParameters parameters) {
    resetDerivedData();
    List<Long> grid = grid(parameters.startAt(), parameters.endAt(), parameters.stepSize(), null);

    List<SeriesPoint> temperature = null;
    Boolean fahrenheit = null;
    List<SeriesPoint> forecast = null;
    if (trainingTemperature != null) {
      temperature = trainingTemperature.data();
      fahrenheit = trainingTemperature.isFahrenheit();
      if (forecastTemperature != null) {
        forecast = forecastTemperature.data();
      }
    }
    BaselineRequest request = new BaselineRequest(trainingLoad.data(), temperature, fahrenheit,
        grid, forecast, parameters.weightingDays(),
        (int) (parameters.modelingInterval() / 60), zone);

    log.info("Fitting baseline for {} prediction points ({} to {})", grid.size(),
        TimestampNormalizer.format(grid.get(0), zone),
        TimestampNormalizer.format(grid.get(grid.size() - 1), zone));
    BaselineResponse response = modelingService.predict(request);

    this.baselineSeries = Series.builder()
        .points(response.predictions())
        .zone(zone)
        .validation(Validation.LENIENT)
        .build();
    this.errorStats = response.errorStats();
    log.debug("Baseline fitted: {} points, error stats {}", baselineSeries.size(), errorStats);
    return baselineSeries;
  }

  public boolean isBaselined() {
    return baselineSeries != null;
  }

  public Series baselineSeries() {
    requireBaseline();
    return baselineSeries;
  }

  public Map<String, Double> errorStats() {
    requireBaseline();
    return errorStats;
  }

  // --- derived reads ---

  public DiffResult diff() {
    return diff(DiffWindow.all());
  }

  public DiffResult diff(DiffWindow window) {
    ensureBaseline();
    List<Long> grid = grid(window.startAt(), window.endAt(), window.stepSize(), window.stepCount());
    LinearInterpolator load = new LinearInterpolator(trainingLoad.data(null, null, false));
    LinearInterpolator base = new LinearInterpolator(baselineSeries.points());

    List<SeriesPoint> kwDiff = new ArrayList<>(grid.size());
    List<SeriesPoint> kwBase = new ArrayList<>(grid.size());
    List<SeriesPoint> kwhDiff = new ArrayList<>(grid.size());
    List<SeriesPoint> kwhBase = new ArrayList<>(grid.size());

    long first = grid.get(0);
    kwDiff.add(new SeriesPoint(first, load.valueAt(first) - base.valueAt(first)));
    kwBase.add(new SeriesPoint(first, base.valueAt(first)));
    kwhDiff.add(new SeriesPoint(first, 0d));
    kwhBase.add(new SeriesPoint(first, 0d));

    double cumulativeDiff = 0d;
    double cumulativeBase = 0d;
    for (int i = 1; i < grid.size(); i++) {
      long from = grid.get(i - 1);
      long to = grid.get(i);
      double loadEnergy = load.integrate(from, to);
      double baseEnergy = base.integrate(from, to);
      double seconds = to - from;
      kwDiff.add(new SeriesPoint(to, (loadEnergy - baseEnergy) / seconds));
      kwBase.add(new SeriesPoint(to, baseEnergy / seconds));
      cumulativeDiff += (loadEnergy - baseEnergy) / SECONDS_PER_HOUR;
      cumulativeBase += baseEnergy / SECONDS_PER_HOUR;
      kwhDiff.add(new SeriesPoint(to, cumulativeDiff));
      kwhBase.add(new SeriesPoint(to, cumulativeBase));
    }
    return new DiffResult(toSeries(kwDiff), toSeries(kwBase), toSeries(kwhDiff),
        toSeries(kwhBase));
  }

  public Series cumulativeSum() {
    return cumulativeSum(null, null, DiffWindow.DEFAULT_STEP_SECONDS);
  }

  public Series cumulativeSum(Object startAt, Object endAt, long stepSize) {
    return cumulativeSum(DiffWindow.stepped(startAt, endAt, stepSize));
  }

  public Series cumulativeSum(DiffWindow window) {
    return diff(window).cumulativeKwhDiff();
  }

  /**
   * Savings over one window, measured as a single interval. Percentages are relative to the
   * baseline; every figure is rounded to two decimals.
   */
  public Map<String, Double> eventPerformance(Object startAt, Object endAt) {
    DiffResult diff = diff(DiffWindow.counted(startAt, endAt, 1));

    Map<String, Double> performance = new LinkedHashMap<>();
    double avgKwShed = -last(diff.kwDiff());
    double avgKwBase = last(diff.kwBase());
    performance.put("avg_kw_shed", avgKwShed);
    performance.put("avg_percent_kw_shed", percent(avgKwShed, avgKwBase, "avg_kw_base"));

    double kwhReduction = -last(diff.cumulativeKwhDiff());
    double kwhBase = last(diff.cumulativeKwhBase());
    performance.put("kwh_reduction", kwhReduction);
    performance.put("percent_kwh_reduction", percent(kwhReduction, kwhBase, "kwh_base"));

    if (floorArea != null && floorArea > 0d) {
      performance.put("avg_w_sq_ft_shed", avgKwShed * 1000d / floorArea);
    }

    if (tariff != null) {
      double totalLoadCost = last(cost(trainingLoad, startAt, endAt, 1).cumulativeCost());
      double totalBaseCost = last(cost(baselineSeries, startAt, endAt, 1).cumulativeCost());
      double savings = totalBaseCost - totalLoadCost;
      performance.put("total_savings", savings);
      performance.put("total_percent_savings", percent(savings, totalBaseCost, "total_base_cost"));
    }

    performance.replaceAll((key, value) -> round2(value));
    return performance;
  }

  public CostResult cost(Series load, Object startAt, Object endAt, Integer stepCount) {
    if (tariff == null) {
      throw new MissingTariffException("cannot calculate cost - no tariff provided");
    }
    Series priced = load != null ? load : trainingLoad;
    List<Long> grid = grid(startAt, endAt, DiffWindow.DEFAULT_STEP_SECONDS, stepCount);
    return costModel.cost(priced.data(null, null, false), grid, tariff, zone);
  }

  // --- proxies ---

  public List<SeriesPoint> actualData(Object startAt, Object endAt, boolean exclude,
      Long stepSize) {
    return trainingLoad.data(startAt, endAt, stepSize, exclude);
  }

  public List<SeriesPoint> baselineData(Object startAt, Object endAt, boolean exclude,
      Long stepSize) {
    requireBaseline();
    return baselineSeries.data(startAt, endAt, stepSize, exclude);
  }

  public void addExclusion(Object startAt, Object endAt) {
    trainingLoad.addExclusion(startAt, endAt);
  }

  public void addNamedExclusion(String name) {
    trainingLoad.addNamedExclusion(name, calendars);
  }

  public void clearExclusions() {
    trainingLoad.clearExclusions();
  }

  public void setTariff(Tariff tariff) {
    this.tariff = tariff;
  }

  public Tariff tariff() {
    return tariff;
  }

  public Series trainingLoad() {
    return trainingLoad;
  }

  public ZoneId zone() {
    return zone;
  }

  // --- internals ---

  private List<Long> grid(Object startAt, Object endAt, long stepSize, Integer stepCount) {
    long start = startAt != null
        ? TimestampNormalizer.normalize(startAt, zone)
        : trainingLoad.startAt();
    long end = endAt != null
        ? TimestampNormalizer.normalize(endAt, zone)
        : trainingLoad.endAt();
    return OutputGrid.timestamps(start, end, stepSize, stepCount);
  }

  private void ensureBaseline() {
    if (!isBaselined()) {
      log.debug("No baseline yet; fitting one with default parameters");
      baseline(BaselineParameters.defaults());
    }
  }

  private void requireBaseline() {
    if (!isBaselined()) {
      throw new IllegalStateException("load profile has not been baselined");
    }
  }

  private void resetDerivedData() {
    baselineSeries = null;
    errorStats = null;
  }

  private Series toSeries(List<SeriesPoint> points) {
    return Series.builder().points(points).zone(zone).validation(Validation.LENIENT).build();
  }

  private static double last(Series series) {
    List<SeriesPoint> points = series.points();
    return points.get(points.size() - 1).value();
  }

  private static double percent(double numerator, double denominator, String metric) {
    if (denominator == 0d) {
      throw new ZeroBaselineException(metric);
    }
    return numerator / denominator * 100d;
  }

  private static double round2(double value) {
    return Math.round(value * 100d) / 100d;
  }

  public static final class Builder {
    private Series trainingLoad;
    private Series trainingTemperature;
    private Series forecastTemperature;
    private Double floorArea;
    private Tariff tariff;
    private BaselineModelingService modelingService;
    private TariffCostModel costModel;
    private ExclusionCalendars calendars;

    private Builder() {
    }

    public Builder trainingLoad(Series trainingLoad) {
      this.trainingLoad = trainingLoad;
      return this;
    }

    public Builder trainingTemperature(Series trainingTemperature) {
      this.trainingTemperature = trainingTemperature;
      return this;
    }

    public Builder forecastTemperature(Series forecastTemperature) {
      this.forecastTemperature = forecastTemperature;
      return this;
    }

    public Builder floorArea(Double floorArea) {
      this.floorArea = floorArea;
      return this;
    }

    public Builder tariff(Tariff tariff) {
      this.tariff = tariff;
      return this;
    }

    public Builder modelingService(BaselineModelingService modelingService) {
      this.modelingService = modelingService;
      return this;
    }

    public Builder costModel(TariffCostModel costModel) {
      this.costModel = costModel;
      return this;
    }

    public Builder calendars(ExclusionCalendars calendars) {
      this.calendars = calendars;
      return this;
    }

    public LoadProfile build() {
      return new LoadProfile(this);
    }
  }
}
