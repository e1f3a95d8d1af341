package com.ospicorp.loadshape.series.service;

import com.ospicorp.loadshape.exception.UnknownExclusionSetException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable table of named holiday calendars. Each date excludes one local midnight-to-midnight
 * day from a series.
 */
public final class ExclusionCalendars {
  public static final String US_HOLIDAYS = "US_HOLIDAYS";

  private final Map<String, List<LocalDate>> calendars;

  public ExclusionCalendars(Map<String, ? extends Iterable<LocalDate>> calendars) {
    Map<String, List<LocalDate>> copy = new LinkedHashMap<>();
    calendars.forEach((name, dates) -> {
      TreeSet<LocalDate> ordered = new TreeSet<>();
      dates.forEach(ordered::add);
      copy.put(name, List.copyOf(ordered));
    });
    this.calendars = Collections.unmodifiableMap(copy);
  }

  public static ExclusionCalendars withBuiltIns(int firstYear, int lastYear) {
    if (lastYear < firstYear) {
      throw new IllegalArgumentException(
          "last year " + lastYear + " is before first year " + firstYear);
    }
    return new ExclusionCalendars(Map.of(US_HOLIDAYS, usFederalHolidays(firstYear, lastYear)));
  }

  public List<LocalDate> dates(String name) {
    List<LocalDate> dates = name == null ? null : calendars.get(name);
    if (dates == null) {
      throw new UnknownExclusionSetException(name);
    }
    return dates;
  }

  public Set<String> names() {
    return calendars.keySet();
  }

  static List<LocalDate> usFederalHolidays(int firstYear, int lastYear) {
    List<LocalDate> out = new ArrayList<>();
    for (int year = firstYear; year <= lastYear; year++) {
      out.add(LocalDate.of(year, Month.JANUARY, 1));
      out.add(nth(year, Month.JANUARY, 3, DayOfWeek.MONDAY));
      out.add(nth(year, Month.FEBRUARY, 3, DayOfWeek.MONDAY));
      out.add(LocalDate.of(year, Month.MAY, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)));
      out.add(LocalDate.of(year, Month.JULY, 4));
      out.add(nth(year, Month.SEPTEMBER, 1, DayOfWeek.MONDAY));
      out.add(nth(year, Month.OCTOBER, 2, DayOfWeek.MONDAY));
      out.add(LocalDate.of(year, Month.NOVEMBER, 11));
      out.add(nth(year, Month.NOVEMBER, 4, DayOfWeek.THURSDAY));
      out.add(LocalDate.of(year, Month.DECEMBER, 25));
    }
    return out;
  }

  private static LocalDate nth(int year, Month month, int ordinal, DayOfWeek day) {
    return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(ordinal, day));
  }
}
