package com.meteoharvest.service.config;

import com.meteoharvest.ingest.config.BatchedPipelineConfig;
import com.meteoharvest.ingest.config.PerLocationPipelineConfig;
import com.meteoharvest.ingest.sink.ArtifactWriter;
import com.meteoharvest.ingest.upstream.ResponseCache;
import com.meteoharvest.ingest.upstream.RetryPolicy;

import java.time.Duration;
import java.util.Locale;

/**
 * Contents of {@code config/ingestion.json}. Every section and field is optional; absent values take
 * the defaults below.
 */
public record IngestionConfig(
        SchedulerConfig scheduler,
        HttpConfig http,
        BatchedPipelineConfig batched,
        PerLocationPipelineConfig perLocation,
        SinkConfig sink
) {
    public IngestionConfig {
        scheduler = scheduler == null ? SchedulerConfig.defaults() : scheduler;
        http = http == null ? HttpConfig.defaults() : http;
        batched = batched == null ? BatchedPipelineConfig.defaults() : batched;
        perLocation = perLocation == null ? PerLocationPipelineConfig.defaults() : perLocation;
        sink = sink == null ? SinkConfig.defaults() : sink;
    }

    public record SchedulerConfig(Duration interval, Boolean runOnStartup, Duration runTimeout) {
        public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);
        public static final Duration DEFAULT_RUN_TIMEOUT = Duration.ofMinutes(10);

        public SchedulerConfig {
            interval = interval == null ? DEFAULT_INTERVAL : interval;
            runOnStartup = runOnStartup == null ? Boolean.TRUE : runOnStartup;
            runTimeout = runTimeout == null ? DEFAULT_RUN_TIMEOUT : runTimeout;
            if (interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("scheduler.interval must be positive");
            }
            if (runTimeout.isNegative() || runTimeout.isZero()) {
                throw new IllegalArgumentException("scheduler.runTimeout must be positive");
            }
        }

        public static SchedulerConfig defaults() {
            return new SchedulerConfig(null, null, null);
        }
    }

    public record HttpConfig(Duration requestTimeout, Duration cacheTtl, String userAgent, RetryConfig retry) {
        public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(20);
        public static final String DEFAULT_USER_AGENT = "meteo-harvest/0.1";

        public HttpConfig {
            requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
            cacheTtl = cacheTtl == null ? ResponseCache.DEFAULT_TTL : cacheTtl;
            userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
            retry = retry == null ? RetryConfig.defaults() : retry;
        }

        public static HttpConfig defaults() {
            return new HttpConfig(null, null, null, null);
        }
    }

    public record RetryConfig(Integer maxAttempts, Duration baseDelay, Double multiplier) {
        public RetryConfig {
            maxAttempts = maxAttempts == null ? RetryPolicy.DEFAULT.maxAttempts() : maxAttempts;
            baseDelay = baseDelay == null ? RetryPolicy.DEFAULT.baseDelay() : baseDelay;
            multiplier = multiplier == null ? RetryPolicy.DEFAULT.multiplier() : multiplier;
        }

        public static RetryConfig defaults() {
            return new RetryConfig(null, null, null);
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, multiplier);
        }
    }

    public record SinkConfig(String type, String container, String root, String bucket, String endpoint, String region) {
        public static final String FILESYSTEM = "filesystem";
        public static final String S3 = "s3";
        public static final String DEFAULT_ROOT = "data/blobs";

        public SinkConfig {
            type = type == null || type.isBlank() ? FILESYSTEM : type.trim().toLowerCase(Locale.ROOT);
            container = container == null || container.isBlank() ? ArtifactWriter.DEFAULT_CONTAINER : container;
            root = root == null || root.isBlank() ? DEFAULT_ROOT : root;
            if (!FILESYSTEM.equals(type) && !S3.equals(type)) {
                throw new IllegalArgumentException("sink.type must be one of filesystem, s3: " + type);
            }
        }

        public static SinkConfig defaults() {
            return new SinkConfig(null, null, null, null, null, null);
        }
    }
}
