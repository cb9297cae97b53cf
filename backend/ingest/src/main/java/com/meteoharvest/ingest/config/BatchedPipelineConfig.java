package com.meteoharvest.ingest.config;

import com.meteoharvest.ingest.upstream.OpenMeteoClient;

public record BatchedPipelineConfig(Boolean enabled, String endpoint) {
    public BatchedPipelineConfig {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        endpoint = endpoint == null || endpoint.isBlank() ? OpenMeteoClient.DEFAULT_ENDPOINT : endpoint;
    }

    public static BatchedPipelineConfig defaults() {
        return new BatchedPipelineConfig(null, null);
    }
}
