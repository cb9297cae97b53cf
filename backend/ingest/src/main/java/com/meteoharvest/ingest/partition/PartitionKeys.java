package com.meteoharvest.ingest.partition;

import com.meteoharvest.core.model.Location;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Storage paths for run artifacts. Keys depend only on the run minute (UTC) and, for per-location
 * artifacts, the location label, so a rerun within the same minute overwrites the same object.
 */
public final class PartitionKeys {
    public static final String BATCHED_PREFIX = "ingestion-v2";
    public static final String PER_LOCATION_PREFIX = "api-ingestion";

    private PartitionKeys() {
    }

    public static String batched(Instant runAt, String extension) {
        ZonedDateTime t = minuteOf(runAt);
        return String.format("%s/%04d/%02d/%02d/weather_%02d%02d.%s",
                BATCHED_PREFIX, t.getYear(), t.getMonthValue(), t.getDayOfMonth(), t.getHour(), t.getMinute(), extension);
    }

    public static String perLocation(Instant runAt, Location location, String extension) {
        ZonedDateTime t = minuteOf(runAt);
        return String.format("%s/%s/%04d/%02d/%02d/%02d-%02d_data.%s",
                PER_LOCATION_PREFIX, labelSegment(location.label()), t.getYear(), t.getMonthValue(), t.getDayOfMonth(),
                t.getHour(), t.getMinute(), extension);
    }

    private static ZonedDateTime minuteOf(Instant runAt) {
        return runAt.truncatedTo(ChronoUnit.MINUTES).atZone(ZoneOffset.UTC);
    }

    /**
     * Folder name a label maps to under {@link #PER_LOCATION_PREFIX}. Distinct labels can share a folder.
     */
    public static String labelSegment(String label) {
        return label.trim().replace('/', '_').replace('\\', '_');
    }
}
