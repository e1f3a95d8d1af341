package com.ospicorp.loadshape.tariff;

import com.ospicorp.loadshape.series.model.SeriesPoint;
import java.time.ZoneId;
import java.util.List;

public interface TariffCostModel {

  /**
   * Prices {@code load} (kW) over the intervals between consecutive output timestamps. The first
   * timestamp opens the window and carries zero cost.
   */
  CostResult cost(List<SeriesPoint> load, List<Long> outputTimestamps, Tariff tariff, ZoneId zone);
}
