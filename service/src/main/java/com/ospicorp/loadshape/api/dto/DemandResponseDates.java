package com.ospicorp.loadshape.api.dto;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

public record DemandResponseDates(@NotNull LocalDate start, @NotNull LocalDate end) {
}
