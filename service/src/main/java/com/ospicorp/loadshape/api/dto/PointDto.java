package com.ospicorp.loadshape.api.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ospicorp.loadshape.series.model.SeriesPoint;
import com.ospicorp.loadshape.series.service.Series;
import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"timestamp", "value"})
public record PointDto(long timestamp, double value) {

  public static List<PointDto> of(Series series) {
    return of(series.points());
  }

  public static List<PointDto> of(List<SeriesPoint> points) {
    List<PointDto> out = new ArrayList<>(points.size());
    for (SeriesPoint p : points) {
      out.add(new PointDto(p.timestamp(), p.value()));
    }
    return out;
  }
}
