package com.ospicorp.loadshape.tariff;

import java.time.LocalDate;

// inclusive range of local dates priced with the DR-day schedule
public record DemandResponsePeriod(LocalDate firstDay, LocalDate lastDay) {
  public DemandResponsePeriod {
    if (lastDay.isBefore(firstDay)) {
      throw new IllegalArgumentException(
          "demand response period ends before it starts: " + firstDay + " > " + lastDay);
    }
  }

  public boolean covers(LocalDate day) {
    return !day.isBefore(firstDay) && !day.isAfter(lastDay);
  }
}
