package com.meteoharvest.ingest.api;

import java.io.IOException;

/**
 * Object storage addressed by container and path. {@code upload} creates or replaces exactly one
 * object; readers never observe a partially written payload.
 */
public interface BlobStore {
    void upload(String container, String path, byte[] payload) throws IOException;
}
