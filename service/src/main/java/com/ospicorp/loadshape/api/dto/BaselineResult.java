package com.ospicorp.loadshape.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record BaselineResult(
    String timezone,
    List<PointDto> baseline,
    @JsonProperty("error_stats") Map<String, Double> errorStats
) {
}
