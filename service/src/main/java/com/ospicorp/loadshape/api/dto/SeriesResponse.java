package com.ospicorp.loadshape.api.dto;

import java.util.List;

public record SeriesResponse(String timezone, List<PointDto> points) {
}
