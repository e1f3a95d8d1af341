package com.ospicorp.loadshape.profile;

import com.ospicorp.loadshape.series.service.Series;

/**
 * Actual-minus-baseline figures on a shared grid. The kW series hold the average power over the
 * interval ending at each timestamp (the instantaneous value at the first one); the cumulative
 * kWh series start at zero.
 */
public record DiffResult(
    Series kwDiff,
    Series kwBase,
    Series cumulativeKwhDiff,
    Series cumulativeKwhBase
) {}
