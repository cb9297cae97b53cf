package com.meteoharvest.ingest.normalize;

import com.meteoharvest.core.model.Location;

import java.time.Instant;

public record SnapshotPayload(Location location, Instant ingestedAt, byte[] body) {
}
