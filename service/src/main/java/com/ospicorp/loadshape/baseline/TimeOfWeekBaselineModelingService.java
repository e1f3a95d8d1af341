package com.ospicorp.loadshape.baseline;

import com.ospicorp.loadshape.exception.ModelingServiceException;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * In-process baseline: each prediction is the average of training loads observed in the same
 * weekday and interval-of-day slot, weighted by {@code exp(-age / weightingDays)}. Temperature
 * inputs are accepted and ignored.
 */
@Service
@ConditionalOnProperty(name = "loadshape.baseline.mode", havingValue = "in-process",
    matchIfMissing = true)
public class TimeOfWeekBaselineModelingService implements BaselineModelingService {

  private static final Logger log =
      LoggerFactory.getLogger(TimeOfWeekBaselineModelingService.class);
  private static final double SECONDS_PER_DAY = 86_400d;

  @Override
  public BaselineResponse predict(BaselineRequest request) {
    if (request.trainingLoad().isEmpty()) {
      throw new ModelingServiceException("No training load data to fit a baseline", "");
    }
    if (request.hasTemperature()) {
      log.debug("Time-of-week model ignores temperature data ({} points)",
          request.trainingTemperature().size());
    }
    Model model = new Model(request.trainingLoad(), request.zone(), request.intervalMinutes(),
        request.weightingDays());

    List<SeriesPoint> predictions = new ArrayList<>(request.predictionTimestamps().size());
    for (long t : request.predictionTimestamps()) {
      predictions.add(new SeriesPoint(t, model.estimate(t)));
    }
    Map<String, Double> stats = errorStats(model, request.trainingLoad());
    log.info("Time-of-week baseline: {} training points, {} predictions, cvrmse={}",
        request.trainingLoad().size(), predictions.size(), stats.get("cvrmse"));
    return new BaselineResponse(predictions, stats);
  }

  private static Map<String, Double> errorStats(Model model, List<SeriesPoint> training) {
    double squared = 0d;
    double bias = 0d;
    double actualTotal = 0d;
    for (SeriesPoint p : training) {
      double residual = p.value() - model.estimate(p.timestamp());
      squared += residual * residual;
      bias += residual;
      actualTotal += p.value();
    }
    int n = training.size();
    double mean = actualTotal / n;
    double rmse = Math.sqrt(squared / n);
    Map<String, Double> stats = new LinkedHashMap<>();
    stats.put("rmse", rmse);
    stats.put("cvrmse", mean == 0d ? Double.NaN : rmse / mean * 100d);
    stats.put("nmbe", mean == 0d ? Double.NaN : bias / (n * mean) * 100d);
    return stats;
  }

  private static final class Model {
    private final Map<Integer, List<SeriesPoint>> byWeekSlot = new HashMap<>();
    private final Map<Integer, List<SeriesPoint>> byDaySlot = new HashMap<>();
    private final List<SeriesPoint> all;
    private final ZoneId zone;
    private final int intervalMinutes;
    private final double timescaleSeconds;

    Model(List<SeriesPoint> training, ZoneId zone, int intervalMinutes, int weightingDays) {
      this.all = training;
      this.zone = zone;
      this.intervalMinutes = intervalMinutes;
      this.timescaleSeconds = weightingDays > 0 ? weightingDays * SECONDS_PER_DAY : 0d;
      for (SeriesPoint p : training) {
        ZonedDateTime local = local(p.timestamp());
        byDaySlot.computeIfAbsent(daySlot(local), k -> new ArrayList<>()).add(p);
        byWeekSlot.computeIfAbsent(weekSlot(local), k -> new ArrayList<>()).add(p);
      }
    }

    double estimate(long t) {
      ZonedDateTime local = local(t);
      List<SeriesPoint> candidates = byWeekSlot.get(weekSlot(local));
      if (candidates == null) {
        candidates = byDaySlot.get(daySlot(local));
      }
      if (candidates == null) {
        candidates = all;
      }
      return weightedAverage(candidates, t);
    }

    private double weightedAverage(List<SeriesPoint> candidates, long t) {
      long nearest = Long.MAX_VALUE;
      for (SeriesPoint p : candidates) {
        nearest = Math.min(nearest, Math.abs(p.timestamp() - t));
      }
      double weighted = 0d;
      double weights = 0d;
      for (SeriesPoint p : candidates) {
        // offset by the nearest age so the closest sample always weighs 1
        double w = timescaleSeconds > 0d
            ? Math.exp(-(Math.abs(p.timestamp() - t) - nearest) / timescaleSeconds)
            : 1d;
        weighted += w * p.value();
        weights += w;
      }
      return weighted / weights;
    }

    private ZonedDateTime local(long t) {
      return Instant.ofEpochSecond(t).atZone(zone);
    }

    private int daySlot(ZonedDateTime local) {
      return (local.getHour() * 60 + local.getMinute()) / intervalMinutes;
    }

    private int weekSlot(ZonedDateTime local) {
      return local.getDayOfWeek().getValue() * 10_000 + daySlot(local);
    }
  }
}
