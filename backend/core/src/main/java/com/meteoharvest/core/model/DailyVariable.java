package com.meteoharvest.core.model;

/**
 * Daily fields requested alongside the hourly series. They are not persisted by the batched pipeline;
 * joining them onto hourly rows happens downstream.
 */
public enum DailyVariable {
    SUNRISE("sunrise"),
    SUNSET("sunset"),
    PRECIPITATION_HOURS("precipitation_hours");

    private final String wireName;

    DailyVariable(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
