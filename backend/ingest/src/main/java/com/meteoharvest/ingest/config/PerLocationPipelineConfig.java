package com.meteoharvest.ingest.config;

import com.meteoharvest.ingest.upstream.OpenWeatherClient;

public record PerLocationPipelineConfig(
        Boolean enabled,
        String endpoint,
        String vaultId,
        String secretName,
        Integer parallelism
) {
    public static final String DEFAULT_SECRET_NAME = "OpenWeatherApiKey";
    public static final int DEFAULT_PARALLELISM = 4;

    public PerLocationPipelineConfig {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        endpoint = endpoint == null || endpoint.isBlank() ? OpenWeatherClient.DEFAULT_ENDPOINT : endpoint;
        vaultId = vaultId == null ? "" : vaultId.trim();
        secretName = secretName == null || secretName.isBlank() ? DEFAULT_SECRET_NAME : secretName;
        parallelism = parallelism == null ? DEFAULT_PARALLELISM : parallelism;
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
    }

    public static PerLocationPipelineConfig defaults() {
        return new PerLocationPipelineConfig(null, null, null, null, null);
    }
}
