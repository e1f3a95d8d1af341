package com.ospicorp.loadshape.baseline;

import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// predictions are aligned to the request's prediction timestamps
public record BaselineResponse(List<SeriesPoint> predictions, Map<String, Double> errorStats) {
  public BaselineResponse {
    predictions = List.copyOf(predictions);
    errorStats = Collections.unmodifiableMap(new LinkedHashMap<>(errorStats));
  }
}
