package com.meteoharvest.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One normalized hourly row for a location. {@code values} always covers every {@link HourlyVariable};
 * a provider-side null is carried as {@link Double#NaN}.
 */
public record ObservationRecord(
        String locationId,
        String locationLabel,
        Instant timestamp,
        Map<HourlyVariable, Double> values
) {
    public ObservationRecord {
        Objects.requireNonNull(locationId, "locationId is required");
        Objects.requireNonNull(locationLabel, "locationLabel is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(values, "values is required");
        EnumMap<HourlyVariable, Double> copy = new EnumMap<>(HourlyVariable.class);
        copy.putAll(values);
        if (copy.size() != HourlyVariable.values().length) {
            throw new IllegalArgumentException("Observation for " + locationId + " at " + timestamp
                    + " covers " + copy.size() + " of " + HourlyVariable.values().length + " variables");
        }
        values = Collections.unmodifiableMap(copy);
    }

    public double value(HourlyVariable variable) {
        return values.get(variable);
    }
}
