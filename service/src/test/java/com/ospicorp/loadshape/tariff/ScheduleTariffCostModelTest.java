package com.ospicorp.loadshape.tariff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScheduleTariffCostModelTest {
  private static final ZoneId LA = ZoneId.of("America/Los_Angeles");

  private final ScheduleTariffCostModel model = new ScheduleTariffCostModel();

  private static long at(int hour, int minute) {
    // Wednesday
    return ZonedDateTime.of(2013, 9, 18, hour, minute, 0, 0, LA).toEpochSecond();
  }

  private static List<SeriesPoint> flatLoad(double kw) {
    return List.of(new SeriesPoint(at(0, 0), kw), new SeriesPoint(at(23, 0), kw));
  }

  @Test
  void pricesEachIntervalAtItsHourlyRate() {
    CostResult result = model.cost(flatLoad(10d), List.of(at(11, 0), at(12, 0), at(13, 0)),
        TariffTest.fixture(), LA);

    assertThat(result.cost().values()).containsExactly(0d, 1.0, 2.5);
    assertEquals(List.of(0d, 1.0, 3.5), result.cumulativeCost().values());
  }

  @Test
  void splitsIntervalsAtHourBoundaries() {
    CostResult result = model.cost(flatLoad(10d), List.of(at(11, 30), at(12, 30)),
        TariffTest.fixture(), LA);

    // half an hour off-peak then half an hour on-peak
    assertEquals(0.5 + 1.25, result.cost().values().get(1), 1e-9);
  }

  @Test
  void integratesRampingLoad() {
    List<SeriesPoint> ramp = List.of(new SeriesPoint(at(9, 0), 0d), new SeriesPoint(at(10, 0), 20d));

    CostResult result = model.cost(ramp, List.of(at(9, 0), at(10, 0)), TariffTest.fixture(), LA);

    // 10 kWh at off-peak
    assertEquals(1.0, result.cumulativeCost().values().get(1), 1e-9);
  }

  @Test
  void costSeriesUseOutputTimestamps() {
    List<Long> grid = List.of(at(11, 0), at(11, 15));
    CostResult result = model.cost(flatLoad(4d), grid, TariffTest.fixture(), LA);

    assertThat(result.cost().points()).extracting(SeriesPoint::timestamp)
        .containsExactlyElementsOf(grid);
    assertEquals(LA, result.cost().zone());
  }
}
