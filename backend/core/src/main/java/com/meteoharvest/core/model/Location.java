package com.meteoharvest.core.model;

import java.util.Objects;

/**
 * A named point whose weather is ingested. Instances are immutable and validated on construction.
 */
public record Location(String id, String label, double latitude, double longitude) {
    public Location {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(label, "label is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Location id must not be blank");
        }
        if (label.isBlank()) {
            throw new IllegalArgumentException("Location label must not be blank for " + id);
        }
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Latitude out of range for " + id + ": " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Longitude out of range for " + id + ": " + longitude);
        }
    }
}
