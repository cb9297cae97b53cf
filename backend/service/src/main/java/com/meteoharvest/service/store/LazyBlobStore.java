package com.meteoharvest.service.store;

import com.meteoharvest.ingest.api.BlobStore;

import java.io.IOException;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Builds the storage client on first upload instead of at startup, so a client that cannot be
 * constructed fails the artifacts of a run rather than the process. A failed build is retried on the
 * next upload; a successful one is kept.
 */
public final class LazyBlobStore implements BlobStore {
    private static final Logger LOGGER = Logger.getLogger(LazyBlobStore.class.getName());

    private final String description;
    private final Supplier<BlobStore> factory;
    private volatile BlobStore delegate;

    public LazyBlobStore(String description, Supplier<BlobStore> factory) {
        this.description = description;
        this.factory = factory;
    }

    @Override
    public void upload(String container, String path, byte[] payload) throws IOException {
        delegate().upload(container, path, payload);
    }

    private BlobStore delegate() throws IOException {
        BlobStore current = delegate;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (delegate == null) {
                try {
                    delegate = factory.get();
                    LOGGER.info("sink.client.ready sink=" + description);
                } catch (RuntimeException e) {
                    LOGGER.warning("sink.client.failed sink=" + description + " error=" + e);
                    throw new IOException("Could not create storage client for " + description, e);
                }
            }
            return delegate;
        }
    }
}
