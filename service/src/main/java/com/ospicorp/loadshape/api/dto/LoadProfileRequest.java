package com.ospicorp.loadshape.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to rebuild a load profile for one request. Readings are
 * {@code [timestamp, value]} pairs; timestamps may be epoch seconds, epoch milliseconds or
 * {@code yyyy-MM-dd HH:mm:ss} strings in {@code timezone}.
 */
public record LoadProfileRequest(
    @Schema(example = "America/Los_Angeles") String timezone,
    @JsonProperty("temperature_units") @Schema(example = "F") String temperatureUnits,
    @JsonProperty("floor_area") @Positive Double floorArea,
    @NotEmpty List<List<Object>> load,
    List<List<Object>> temperature,
    @JsonProperty("forecast_temperature") List<List<Object>> forecastTemperature,
    @Valid List<ExclusionWindow> exclusions,
    @JsonProperty("named_exclusions") List<String> namedExclusions,
    @Schema(description = "OpenEI utility rate document") Map<String, Object> tariff,
    @JsonProperty("demand_response_periods") @Valid List<DemandResponseDates> demandResponsePeriods,
    @Valid BaselineOptions baseline,
    @Valid WindowOptions window
) {
}
