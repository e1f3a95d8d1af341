package com.ospicorp.loadshape.tariff;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.loadshape.exception.TariffFormatException;
import java.io.IOException;
import java.io.Reader;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Energy tariff read from an OpenEI utility-rate document: a $/kWh rate per period and 24-slot
 * period schedules for weekdays, weekends and demand-response days.
 *
 * <p>Both the flat key layout ({@code "energyratestructure/period0/tier0rate": 0.12}) and the
 * nested layout ({@code "energyratestructure": [[{"rate": 0.12}]]}) are understood. Only the
 * first tier of each period is priced. Schedules with twelve rows are indexed by month.
 */
public class Tariff {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String RATE_STRUCTURE = "energyratestructure";
  private static final Pattern FLAT_KEY =
      Pattern.compile("energyratestructure/period(\\d+)/tier(\\d+)(rate|adj)");
  private static final int SLOTS_PER_DAY = 24;

  public enum ScheduleType {
    WEEKDAY("energyweekdayschedule"),
    WEEKEND("energyweekendschedule"),
    DEMAND_RESPONSE("energydrdayschedule");

    private final String key;

    ScheduleType(String key) {
      this.key = key;
    }

    public String key() {
      return key;
    }
  }

  private final Map<Integer, Double> periodRates;
  private final Map<ScheduleType, List<int[]>> schedules;
  private final List<DemandResponsePeriod> demandResponsePeriods = new ArrayList<>();

  private Tariff(Map<Integer, Double> periodRates, Map<ScheduleType, List<int[]>> schedules) {
    this.periodRates = Collections.unmodifiableMap(periodRates);
    this.schedules = schedules;
  }

  public static Tariff read(Reader reader) {
    try {
      return parse(MAPPER.readTree(reader));
    } catch (IOException ex) {
      throw new TariffFormatException("Unable to read tariff document: " + ex.getMessage(), ex);
    }
  }

  public static Tariff parse(JsonNode document) {
    if (document == null || document.isNull() || document.isMissingNode()) {
      throw new TariffFormatException("tariff document is empty");
    }
    JsonNode item = document.has("items") ? document.path("items").path(0) : document;
    if (!item.isObject()) {
      throw new TariffFormatException("tariff document has no rate item");
    }

    Map<Integer, Double> rates = item.path(RATE_STRUCTURE).isArray()
        ? parseNestedRates(item.get(RATE_STRUCTURE))
        : parseFlatRates(item);
    if (rates.isEmpty()) {
      throw new TariffFormatException("tariff has no energy rate structure");
    }

    Map<ScheduleType, List<int[]>> schedules = new EnumMap<>(ScheduleType.class);
    for (ScheduleType type : ScheduleType.values()) {
      JsonNode node = item.get(type.key());
      if (node != null && !node.isNull()) {
        schedules.put(type, parseSchedule(type, node));
      }
    }
    if (!schedules.containsKey(ScheduleType.WEEKDAY)) {
      throw new TariffFormatException("tariff has no " + ScheduleType.WEEKDAY.key());
    }
    return new Tariff(rates, schedules);
  }

  public void addDemandResponsePeriod(LocalDate firstDay, LocalDate lastDay) {
    demandResponsePeriods.add(new DemandResponsePeriod(firstDay, lastDay));
  }

  public List<DemandResponsePeriod> demandResponsePeriods() {
    return Collections.unmodifiableList(demandResponsePeriods);
  }

  public Map<Integer, Double> periodRates() {
    return periodRates;
  }

  public boolean hasSchedule(ScheduleType type) {
    return schedules.containsKey(type);
  }

  public ScheduleType scheduleFor(LocalDate day) {
    if (hasSchedule(ScheduleType.DEMAND_RESPONSE)) {
      for (DemandResponsePeriod period : demandResponsePeriods) {
        if (period.covers(day)) {
          return ScheduleType.DEMAND_RESPONSE;
        }
      }
    }
    DayOfWeek dow = day.getDayOfWeek();
    boolean weekend = dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    if (weekend && hasSchedule(ScheduleType.WEEKEND)) {
      return ScheduleType.WEEKEND;
    }
    return ScheduleType.WEEKDAY;
  }

  public int periodAt(ZonedDateTime local) {
    List<int[]> rows = schedules.get(scheduleFor(local.toLocalDate()));
    int[] row = rows.get((local.getMonthValue() - 1) % rows.size());
    return row[local.getHour()];
  }

  // $/kWh in effect at the given local time
  public double rateAt(ZonedDateTime local) {
    int period = periodAt(local);
    Double rate = periodRates.get(period);
    if (rate == null) {
      throw new TariffFormatException("schedule references period " + period
          + " which has no rate; known periods " + periodRates.keySet());
    }
    return rate;
  }

  private static Map<Integer, Double> parseFlatRates(JsonNode item) {
    Map<Integer, TreeMap<Integer, double[]>> tiers = new TreeMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      Matcher m = FLAT_KEY.matcher(field.getKey());
      if (!m.matches()) {
        continue;
      }
      int period = Integer.parseInt(m.group(1));
      int tier = Integer.parseInt(m.group(2));
      double[] rateAndAdj = tiers.computeIfAbsent(period, k -> new TreeMap<>())
          .computeIfAbsent(tier, k -> new double[] {Double.NaN, 0d});
      double value = number(field.getKey(), field.getValue());
      if ("rate".equals(m.group(3))) {
        rateAndAdj[0] = value;
      } else {
        rateAndAdj[1] = value;
      }
    }
    Map<Integer, Double> rates = new TreeMap<>();
    tiers.forEach((period, byTier) -> {
      for (double[] rateAndAdj : byTier.values()) {
        if (!Double.isNaN(rateAndAdj[0])) {
          rates.put(period, rateAndAdj[0] + rateAndAdj[1]);
          return;
        }
      }
    });
    return rates;
  }

  private static Map<Integer, Double> parseNestedRates(JsonNode structure) {
    Map<Integer, Double> rates = new TreeMap<>();
    for (int period = 0; period < structure.size(); period++) {
      JsonNode firstTier = structure.get(period).path(0);
      if (!firstTier.has("rate")) {
        throw new TariffFormatException("period " + period + " has no first-tier rate");
      }
      double adj = firstTier.has("adj") ? number("adj", firstTier.get("adj")) : 0d;
      rates.put(period, number("rate", firstTier.get("rate")) + adj);
    }
    return rates;
  }

  private static List<int[]> parseSchedule(ScheduleType type, JsonNode node) {
    if (!node.isArray() || node.isEmpty()) {
      throw new TariffFormatException(type.key() + " must be a non-empty array");
    }
    List<int[]> rows = new ArrayList<>();
    if (node.get(0).isArray()) {
      for (JsonNode row : node) {
        rows.add(slots(type, row, 0));
      }
    } else {
      if (node.size() % SLOTS_PER_DAY != 0) {
        throw new TariffFormatException(
            type.key() + " length " + node.size() + " is not a multiple of 24");
      }
      for (int offset = 0; offset < node.size(); offset += SLOTS_PER_DAY) {
        rows.add(slots(type, node, offset));
      }
    }
    return rows;
  }

  private static int[] slots(ScheduleType type, JsonNode node, int offset) {
    if (node.size() - offset < SLOTS_PER_DAY) {
      throw new TariffFormatException(type.key() + " rows must have 24 hourly slots");
    }
    int[] row = new int[SLOTS_PER_DAY];
    for (int hour = 0; hour < SLOTS_PER_DAY; hour++) {
      JsonNode slot = node.get(offset + hour);
      if (!slot.canConvertToInt()) {
        throw new TariffFormatException(type.key() + " has a non-integer period: " + slot);
      }
      row[hour] = slot.asInt();
    }
    return row;
  }

  private static double number(String name, JsonNode node) {
    if (node.isNumber()) {
      return node.asDouble();
    }
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException ex) {
        throw new TariffFormatException(name + " is not a number: " + node.asText(), ex);
      }
    }
    throw new TariffFormatException(name + " is not a number: " + node);
  }
}
