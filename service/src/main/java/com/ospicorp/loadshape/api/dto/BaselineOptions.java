package com.ospicorp.loadshape.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;

// unset fields fall back to BaselineParameters.defaults()
public record BaselineOptions(
    @JsonProperty("start_at") Object startAt,
    @JsonProperty("end_at") Object endAt,
    @JsonProperty("weighting_days") @Positive Integer weightingDays,
    @JsonProperty("modeling_interval") @Positive Long modelingInterval,
    @JsonProperty("step_size") @Positive Long stepSize
) {
}
