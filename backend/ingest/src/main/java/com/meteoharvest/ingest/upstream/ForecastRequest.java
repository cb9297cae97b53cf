package com.meteoharvest.ingest.upstream;

import com.meteoharvest.core.model.DailyVariable;
import com.meteoharvest.core.model.HourlyVariable;
import com.meteoharvest.core.model.Location;

import java.util.List;

/**
 * One batched forecast call covering every location. Built fresh for each run.
 */
public record ForecastRequest(
        List<Location> locations,
        List<HourlyVariable> hourly,
        List<DailyVariable> daily,
        String timezone,
        int forecastDays
) {
    public ForecastRequest {
        locations = List.copyOf(locations);
        hourly = List.copyOf(hourly);
        daily = List.copyOf(daily);
        if (locations.isEmpty()) {
            throw new IllegalArgumentException("Forecast request needs at least one location");
        }
        if (forecastDays < 1) {
            throw new IllegalArgumentException("forecastDays must be positive");
        }
    }

    /**
     * The current-day request: full hourly schema, sunrise/sunset/precipitation hours, local timezone
     * resolved per location.
     */
    public static ForecastRequest currentDay(List<Location> locations) {
        return new ForecastRequest(
                locations,
                List.of(HourlyVariable.values()),
                List.of(DailyVariable.values()),
                "auto",
                1
        );
    }
}
