package com.ospicorp.loadshape.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.loadshape.tariff.CostResult;
import java.util.List;

public record CostResponse(
    List<PointDto> cost,
    @JsonProperty("cumulative_cost") List<PointDto> cumulativeCost
) {

  public static CostResponse of(CostResult result) {
    return new CostResponse(PointDto.of(result.cost()), PointDto.of(result.cumulativeCost()));
  }
}
