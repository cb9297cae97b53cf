package com.meteoharvest.ingest.normalize;

import com.meteoharvest.core.error.NormalizationException;
import com.meteoharvest.core.model.HourlyVariable;
import com.meteoharvest.core.model.Location;
import com.meteoharvest.core.model.ObservationRecord;
import com.meteoharvest.ingest.upstream.ForecastSeries;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens batched forecast series into hourly records, one per timestamp of
 * {@code [start, end)} stepped by {@code interval}, tagged with the owning location.
 */
public final class ForecastNormalizer {

    public List<ObservationRecord> normalize(List<ForecastSeries> series, List<Location> locations) {
        if (series.size() != locations.size()) {
            throw new NormalizationException(NormalizationException.BATCH_SCOPE,
                    "Got " + series.size() + " forecast series for " + locations.size() + " locations");
        }
        List<ObservationRecord> records = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            records.addAll(normalize(series.get(i), locations.get(i)));
        }
        return records;
    }

    public List<ObservationRecord> normalize(ForecastSeries series, Location location) {
        List<Instant> timestamps = timestamps(series, location);
        Map<HourlyVariable, double[]> columns = new EnumMap<>(HourlyVariable.class);
        for (HourlyVariable variable : HourlyVariable.values()) {
            double[] values = series.values(variable);
            if (values == null) {
                throw new NormalizationException(location.id(), "Missing variable " + variable.wireName()
                        + " for " + location.id());
            }
            if (values.length != timestamps.size()) {
                throw new NormalizationException(location.id(), "Variable " + variable.wireName() + " for "
                        + location.id() + " has " + values.length + " values for " + timestamps.size() + " timestamps");
            }
            columns.put(variable, values);
        }

        List<ObservationRecord> records = new ArrayList<>(timestamps.size());
        for (int row = 0; row < timestamps.size(); row++) {
            Map<HourlyVariable, Double> values = new EnumMap<>(HourlyVariable.class);
            for (Map.Entry<HourlyVariable, double[]> column : columns.entrySet()) {
                values.put(column.getKey(), column.getValue()[row]);
            }
            records.add(new ObservationRecord(location.id(), location.label(), timestamps.get(row), values));
        }
        return records;
    }

    static List<Instant> timestamps(ForecastSeries series, Location location) {
        long interval = series.interval();
        long span = series.end() - series.start();
        if (interval <= 0) {
            throw new NormalizationException(location.id(), "Non-positive sampling interval for " + location.id());
        }
        if (span < 0) {
            throw new NormalizationException(location.id(), "Series end precedes start for " + location.id());
        }
        if (span % interval != 0) {
            throw new NormalizationException(location.id(), "Series span for " + location.id()
                    + " is not a whole number of " + interval + "s intervals");
        }
        int count = Math.toIntExact(span / interval);
        List<Instant> timestamps = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            timestamps.add(Instant.ofEpochSecond(series.start() + i * interval));
        }
        return timestamps;
    }
}
