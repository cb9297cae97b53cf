package com.meteoharvest.ingest.support;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.meteoharvest.core.model.HourlyVariable;
import com.meteoharvest.core.model.Location;
import com.meteoharvest.core.util.JsonUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds provider-shaped batched forecast bodies (unix time axis) for arbitrary location counts.
 */
public final class ForecastFixtures {
    private ForecastFixtures() {
    }

    public static List<Location> locations(int count) {
        List<Location> locations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            locations.add(new Location("city-" + i, "City " + i, 20.0 + i, -10.0 + i));
        }
        return locations;
    }

    public static String forecastJson(int locations, int hours, Instant start) {
        ArrayNode root = JsonUtils.objectMapper().createArrayNode();
        for (int l = 0; l < locations; l++) {
            ObjectNode block = root.addObject();
            block.put("latitude", 20.0 + l);
            block.put("longitude", -10.0 + l);
            block.put("utc_offset_seconds", 3600);
            block.put("timezone", "Africa/Casablanca");
            ObjectNode hourly = block.putObject("hourly");
            ArrayNode time = hourly.putArray("time");
            for (int h = 0; h < hours; h++) {
                time.add(start.getEpochSecond() + h * 3600L);
            }
            for (HourlyVariable variable : HourlyVariable.values()) {
                ArrayNode values = hourly.putArray(variable.wireName());
                for (int h = 0; h < hours; h++) {
                    values.add(l * 100 + variable.ordinal() + h / 10.0);
                }
            }
            ObjectNode daily = block.putObject("daily");
            daily.putArray("time").add(start.getEpochSecond());
            daily.putArray("sunrise").add(start.getEpochSecond() + 6 * 3600L);
            daily.putArray("sunset").add(start.getEpochSecond() + 19 * 3600L);
            daily.putArray("precipitation_hours").add(0.0);
        }
        return root.toString();
    }
}
