package com.ospicorp.loadshape.api.dto;

import jakarta.validation.constraints.NotNull;

public record ExclusionWindow(@NotNull Object start, @NotNull Object end) {
}
