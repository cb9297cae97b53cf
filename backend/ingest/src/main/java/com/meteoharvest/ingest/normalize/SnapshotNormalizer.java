package com.meteoharvest.ingest.normalize;

import com.meteoharvest.ingest.upstream.RawSnapshot;

import java.time.Instant;

/**
 * Current-conditions snapshots are stored as received: no field is extracted or renamed.
 */
public final class SnapshotNormalizer {

    public SnapshotPayload normalize(RawSnapshot snapshot, Instant ingestedAt) {
        return new SnapshotPayload(snapshot.location(), ingestedAt, snapshot.body());
    }
}
