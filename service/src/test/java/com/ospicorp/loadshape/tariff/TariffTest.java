package com.ospicorp.loadshape.tariff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.loadshape.exception.TariffFormatException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import org.junit.jupiter.api.Test;

public class TariffTest {
  private static final ZoneId LA = ZoneId.of("America/Los_Angeles");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static Tariff fixture() {
    Reader reader = new InputStreamReader(
        TariffTest.class.getResourceAsStream("/fixtures/tariff.json"), StandardCharsets.UTF_8);
    return Tariff.read(reader);
  }

  private static ZonedDateTime at(int month, int day, int hour) {
    return ZonedDateTime.of(2013, month, day, hour, 0, 0, 0, LA);
  }

  private static String hours(int value) {
    return String.join(",", Collections.nCopies(24, String.valueOf(value)));
  }

  @Test
  void readsFlatOpenEiKeys() {
    Tariff tariff = fixture();

    assertThat(tariff.periodRates()).containsOnlyKeys(0, 1, 2);
    assertEquals(0.10, tariff.periodRates().get(0), 1e-12);
    // lowest tier plus adjustment
    assertEquals(0.25, tariff.periodRates().get(1), 1e-12);
  }

  @Test
  void weekdayPeakAndOffPeak() {
    Tariff tariff = fixture();
    // Wednesday
    assertEquals(0.25, tariff.rateAt(at(9, 18, 13)), 1e-12);
    assertEquals(0.10, tariff.rateAt(at(9, 18, 9)), 1e-12);
    assertEquals(0.10, tariff.rateAt(at(9, 18, 18)), 1e-12);
  }

  @Test
  void weekendUsesWeekendSchedule() {
    Tariff tariff = fixture();
    assertEquals(Tariff.ScheduleType.WEEKEND, tariff.scheduleFor(LocalDate.of(2013, 9, 21)));
    assertEquals(0.10, tariff.rateAt(at(9, 21, 13)), 1e-12);
  }

  @Test
  void demandResponseDaysUseDrSchedule() {
    Tariff tariff = fixture();
    tariff.addDemandResponsePeriod(LocalDate.of(2013, 9, 18), LocalDate.of(2013, 9, 19));

    assertEquals(1.00, tariff.rateAt(at(9, 18, 13)), 1e-12);
    assertEquals(1.00, tariff.rateAt(at(9, 19, 17)), 1e-12);
    assertEquals(0.25, tariff.rateAt(at(9, 20, 13)), 1e-12);
    assertEquals(1, tariff.demandResponsePeriods().size());
  }

  @Test
  void demandResponsePeriodMustBeOrdered() {
    Tariff tariff = fixture();
    assertThrows(IllegalArgumentException.class, () -> tariff.addDemandResponsePeriod(
        LocalDate.of(2013, 9, 19), LocalDate.of(2013, 9, 18)));
  }

  @Test
  void readsNestedStructureAndSingleFlatSchedule() throws Exception {
    String json = "{\"energyratestructure\": [[{\"rate\": 0.11}], [{\"rate\": 0.3, \"adj\": 0.01},"
        + " {\"rate\": 0.5}]], \"energyweekdayschedule\": [" + hours(1) + "]}";

    Tariff tariff = Tariff.parse(MAPPER.readTree(json));

    assertEquals(0.31, tariff.rateAt(at(2, 2, 3)), 1e-12);
    assertFalse(tariff.hasSchedule(Tariff.ScheduleType.WEEKEND));
    // no weekend schedule, weekday applies
    assertEquals(Tariff.ScheduleType.WEEKDAY, tariff.scheduleFor(LocalDate.of(2013, 2, 2)));
  }

  @Test
  void rejectsUnusableDocuments() {
    assertThrows(TariffFormatException.class, () -> Tariff.parse(MAPPER.readTree(
        "{\"energyweekdayschedule\": [" + hours(0) + "]}")));
    assertThrows(TariffFormatException.class, () -> Tariff.parse(MAPPER.readTree(
        "{\"energyratestructure/period0/tier0rate\": 0.1}")));
    assertThrows(TariffFormatException.class, () -> Tariff.parse(MAPPER.readTree(
        "{\"energyratestructure/period0/tier0rate\": 0.1, \"energyweekdayschedule\": [0, 0]}")));
    assertThrows(TariffFormatException.class, () -> Tariff.parse(MAPPER.readTree(
        "{\"energyratestructure/period0/tier0rate\": \"cheap\", \"energyweekdayschedule\": ["
            + hours(0) + "]}")));
    assertThrows(TariffFormatException.class, () -> Tariff.parse(MAPPER.readTree("{\"items\": []}")));
    assertThrows(TariffFormatException.class, () -> Tariff.read(new StringReader("{not json")));
  }

  @Test
  void unknownPeriodFailsWhenPriced() throws Exception {
    Tariff tariff = Tariff.parse(MAPPER.readTree(
        "{\"energyratestructure/period0/tier0rate\": 0.1, \"energyweekdayschedule\": ["
            + hours(3) + "]}"));

    var ex = assertThrows(TariffFormatException.class, () -> tariff.rateAt(at(5, 1, 12)));
    assertThat(ex.getMessage()).contains("period 3");
  }
}
