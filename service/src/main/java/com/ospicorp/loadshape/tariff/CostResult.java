package com.ospicorp.loadshape.tariff;

import com.ospicorp.loadshape.series.service.Series;

/**
 * Cost aligned to the requested output timestamps: {@code cost} holds the cost of the interval
 * ending at each timestamp, {@code cumulativeCost} its running total.
 */
public record CostResult(Series cost, Series cumulativeCost) {}
