package com.ospicorp.loadshape.series.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.loadshape.exception.UnknownExclusionSetException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExclusionCalendarsTest {

  @Test
  void federalHolidaysFor2013() {
    List<LocalDate> dates = ExclusionCalendars.usFederalHolidays(2013, 2013);

    assertThat(dates).containsExactlyInAnyOrder(
        LocalDate.of(2013, 1, 1),
        LocalDate.of(2013, 1, 21),
        LocalDate.of(2013, 2, 18),
        LocalDate.of(2013, 5, 27),
        LocalDate.of(2013, 7, 4),
        LocalDate.of(2013, 9, 2),
        LocalDate.of(2013, 10, 14),
        LocalDate.of(2013, 11, 11),
        LocalDate.of(2013, 11, 28),
        LocalDate.of(2013, 12, 25));
  }

  @Test
  void builtInsCoverTheConfiguredYears() {
    var calendars = ExclusionCalendars.withBuiltIns(2010, 2012);
    List<LocalDate> dates = calendars.dates(ExclusionCalendars.US_HOLIDAYS);

    assertEquals(30, dates.size());
    assertEquals(LocalDate.of(2010, 1, 1), dates.get(0));
    assertEquals(LocalDate.of(2012, 12, 25), dates.get(dates.size() - 1));
    assertThat(calendars.names()).containsExactly(ExclusionCalendars.US_HOLIDAYS);
  }

  @Test
  void customCalendarsAreSortedAndDeduplicated() {
    var calendars = new ExclusionCalendars(Map.of("SHUTDOWN", List.of(
        LocalDate.of(2014, 3, 2), LocalDate.of(2014, 1, 5), LocalDate.of(2014, 3, 2))));

    assertEquals(List.of(LocalDate.of(2014, 1, 5), LocalDate.of(2014, 3, 2)),
        calendars.dates("SHUTDOWN"));
  }

  @Test
  void unknownNameFails() {
    var calendars = ExclusionCalendars.withBuiltIns(2013, 2013);
    var ex = assertThrows(UnknownExclusionSetException.class, () -> calendars.dates("EU_HOLIDAYS"));
    assertEquals("EU_HOLIDAYS", ex.name());
    assertEquals("UNKNOWN_EXCLUSION_SET", ex.errorCode());
  }

  @Test
  void yearRangeMustBeOrdered() {
    assertThrows(IllegalArgumentException.class, () -> ExclusionCalendars.withBuiltIns(2020, 2019));
  }
}
