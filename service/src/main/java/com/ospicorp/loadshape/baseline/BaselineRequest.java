package com.ospicorp.loadshape.baseline;

import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Inputs for one baseline fit. Temperature fields are null when no temperature data is
 * available; forecast temperature is only sent alongside training temperature.
 */
public record BaselineRequest(
    List<SeriesPoint> trainingLoad,
    List<SeriesPoint> trainingTemperature,
    Boolean fahrenheit,
    List<Long> predictionTimestamps,
    List<SeriesPoint> forecastTemperature,
    int weightingDays,
    int intervalMinutes,
    ZoneId zone
) {
  public BaselineRequest {
    Objects.requireNonNull(trainingLoad, "trainingLoad");
    Objects.requireNonNull(predictionTimestamps, "predictionTimestamps");
    Objects.requireNonNull(zone, "zone");
    if (trainingTemperature == null && forecastTemperature != null) {
      throw new IllegalArgumentException(
          "forecast temperature requires training temperature");
    }
    if (intervalMinutes <= 0) {
      throw new IllegalArgumentException("interval must be at least one minute");
    }
    trainingLoad = List.copyOf(trainingLoad);
    predictionTimestamps = List.copyOf(predictionTimestamps);
    trainingTemperature = trainingTemperature == null ? null : List.copyOf(trainingTemperature);
    forecastTemperature = forecastTemperature == null ? null : List.copyOf(forecastTemperature);
  }

  public boolean hasTemperature() {
    return trainingTemperature != null;
  }
}
