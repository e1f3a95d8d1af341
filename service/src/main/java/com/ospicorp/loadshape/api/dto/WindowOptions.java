package com.ospicorp.loadshape.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;

public record WindowOptions(
    @JsonProperty("start_at") Object startAt,
    @JsonProperty("end_at") Object endAt,
    @JsonProperty("step_size") @Positive Long stepSize,
    @JsonProperty("step_count") @Positive Integer stepCount
) {
}
