package com.meteoharvest.ingest.upstream;

import com.meteoharvest.core.model.HourlyVariable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Hourly block of one location in a batched forecast response. {@code start} is inclusive,
 * {@code end} exclusive, both epoch seconds UTC. Arrays are keyed by variable, not by position.
 */
public record ForecastSeries(
        long start,
        long end,
        long interval,
        String timezone,
        Map<HourlyVariable, double[]> hourly
) {
    public ForecastSeries {
        hourly = Collections.unmodifiableMap(new EnumMap<>(hourly));
    }

    public double[] values(HourlyVariable variable) {
        return hourly.get(variable);
    }
}
