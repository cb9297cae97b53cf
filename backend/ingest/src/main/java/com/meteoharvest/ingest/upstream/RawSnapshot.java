package com.meteoharvest.ingest.upstream;

import com.meteoharvest.core.model.Location;

import java.time.Instant;

/**
 * Current-conditions body for one location, exactly as the provider sent it.
 */
public record RawSnapshot(Location location, byte[] body, Instant fetchedAt) {
}
