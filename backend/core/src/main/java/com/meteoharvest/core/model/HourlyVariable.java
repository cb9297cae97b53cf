package com.meteoharvest.core.model;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed hourly schema requested from the forecast provider. Declaration order is the request order
 * and the CSV column order.
 */
public enum HourlyVariable {
    TEMPERATURE_2M("temperature_2m"),
    RELATIVE_HUMIDITY_2M("relative_humidity_2m"),
    APPARENT_TEMPERATURE("apparent_temperature"),
    PRECIPITATION("precipitation"),
    RAIN("rain"),
    SNOWFALL("snowfall"),
    SNOW_DEPTH("snow_depth"),
    WIND_SPEED_10M("wind_speed_10m"),
    WIND_DIRECTION_10M("wind_direction_10m"),
    WIND_GUSTS_10M("wind_gusts_10m"),
    IS_DAY("is_day"),
    DEW_POINT_2M("dew_point_2m"),
    PRESSURE_MSL("pressure_msl"),
    SURFACE_PRESSURE("surface_pressure"),
    CLOUD_COVER("cloud_cover"),
    CLOUD_COVER_LOW("cloud_cover_low"),
    CLOUD_COVER_MID("cloud_cover_mid"),
    CLOUD_COVER_HIGH("cloud_cover_high"),
    SHORTWAVE_RADIATION("shortwave_radiation"),
    DIRECT_RADIATION("direct_radiation");

    private final String wireName;

    HourlyVariable(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(HourlyVariable::wireName).toList();
    }

}
