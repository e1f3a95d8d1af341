package com.ospicorp.loadshape.tariff;

import com.ospicorp.loadshape.series.model.SeriesPoint;
import com.ospicorp.loadshape.series.model.Validation;
import com.ospicorp.loadshape.series.service.LinearInterpolator;
import com.ospicorp.loadshape.series.service.Series;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Prices a kW load against a {@link Tariff}. Each output interval is integrated piecewise-linearly
 * and split at local hour boundaries, so every slice is charged at the rate the schedule assigns
 * to its hour.
 */
@Component
public class ScheduleTariffCostModel implements TariffCostModel {
  private static final Logger log = LoggerFactory.getLogger(ScheduleTariffCostModel.class);
  private static final double SECONDS_PER_HOUR = 3_600d;

  @Override
  public CostResult cost(List<SeriesPoint> load, List<Long> outputTimestamps, Tariff tariff,
      ZoneId zone) {
    LinearInterpolator interpolator = new LinearInterpolator(load);
    List<SeriesPoint> cost = new ArrayList<>(outputTimestamps.size());
    List<SeriesPoint> cumulative = new ArrayList<>(outputTimestamps.size());
    double total = 0d;
    Long previous = null;
    for (long t : outputTimestamps) {
      double intervalCost = previous == null
          ? 0d
          : intervalCost(interpolator, previous, t, tariff, zone);
      total += intervalCost;
      cost.add(new SeriesPoint(t, intervalCost));
      cumulative.add(new SeriesPoint(t, total));
      previous = t;
    }
    log.debug("Priced {} intervals, total cost {}", outputTimestamps.size(), total);
    return new CostResult(toSeries(cost, zone), toSeries(cumulative, zone));
  }

  private static double intervalCost(LinearInterpolator load, long from, long to, Tariff tariff,
      ZoneId zone) {
    double cost = 0d;
    long sliceStart = from;
    while (sliceStart < to) {
      ZonedDateTime local = Instant.ofEpochSecond(sliceStart).atZone(zone);
      long nextHour = local.truncatedTo(ChronoUnit.HOURS).plusHours(1).toEpochSecond();
      long sliceEnd = Math.min(nextHour, to);
      double kwh = load.integrate(sliceStart, sliceEnd) / SECONDS_PER_HOUR;
      cost += kwh * tariff.rateAt(local);
      sliceStart = sliceEnd;
    }
    return cost;
  }

  private static Series toSeries(List<SeriesPoint> points, ZoneId zone) {
    return Series.builder().points(points).zone(zone).validation(Validation.LENIENT).build();
  }
}
