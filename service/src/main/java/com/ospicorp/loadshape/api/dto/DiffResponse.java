package com.ospicorp.loadshape.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.loadshape.profile.DiffResult;
import java.util.List;

public record DiffResponse(
    @JsonProperty("kw_diff") List<PointDto> kwDiff,
    @JsonProperty("kw_base") List<PointDto> kwBase,
    @JsonProperty("cumulative_kwh_diff") List<PointDto> cumulativeKwhDiff,
    @JsonProperty("cumulative_kwh_base") List<PointDto> cumulativeKwhBase
) {

  public static DiffResponse of(DiffResult diff) {
    return new DiffResponse(
        PointDto.of(diff.kwDiff()),
        PointDto.of(diff.kwBase()),
        PointDto.of(diff.cumulativeKwhDiff()),
        PointDto.of(diff.cumulativeKwhBase()));
  }
}
