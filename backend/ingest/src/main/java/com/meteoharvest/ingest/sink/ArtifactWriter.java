package com.meteoharvest.ingest.sink;

import com.meteoharvest.core.error.SinkException;
import com.meteoharvest.core.model.StoredArtifact;
import com.meteoharvest.core.result.Outcome;
import com.meteoharvest.ingest.api.BlobStore;

import java.io.IOException;

/**
 * Writes run artifacts into the fixed raw-weather container, overwriting whatever is at the path.
 */
public final class ArtifactWriter {
    public static final String DEFAULT_CONTAINER = "weather-raw";

    private final BlobStore blobStore;
    private final String container;

    public ArtifactWriter(BlobStore blobStore) {
        this(blobStore, DEFAULT_CONTAINER);
    }

    public ArtifactWriter(BlobStore blobStore, String container) {
        this.blobStore = blobStore;
        this.container = container;
    }

    public Outcome<StoredArtifact> write(String scope, String path, byte[] payload) {
        try {
            blobStore.upload(container, path, payload);
            return Outcome.success(new StoredArtifact(scope, container, path, payload.length));
        } catch (IOException | RuntimeException e) {
            return Outcome.failure(new SinkException(scope, "Failed writing " + container + "/" + path, e));
        }
    }

    public String container() {
        return container;
    }
}
