package com.meteoharvest.ingest.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.meteoharvest.core.error.FetchException;
import com.meteoharvest.core.model.Location;
import com.meteoharvest.core.util.JsonUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * Per-location current-conditions client. The API key is passed in already resolved.
 */
public final class OpenWeatherClient {
    public static final String DEFAULT_ENDPOINT = "https://api.openweathermap.org/data/2.5/weather";

    private final HttpFetcher fetcher;
    private final String endpoint;
    private final Clock clock;

    public OpenWeatherClient(HttpFetcher fetcher, String endpoint, Clock clock) {
        this.fetcher = fetcher;
        this.endpoint = endpoint;
        this.clock = clock;
    }

    public RawSnapshot fetchOne(Location location, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key is required");
        }
        String coordinates = "lat=" + location.latitude() + "&lon=" + location.longitude();
        URI uri = URI.create(endpoint + "?" + coordinates
                + "&appid=" + URLEncoder.encode(apiKey.trim(), StandardCharsets.UTF_8)
                + "&units=metric");
        String logUri = endpoint + "?" + coordinates + "&units=metric";

        byte[] body = fetcher.getBytes(uri, logUri, location.id());
        try {
            // structure check only; ISO-8859-1 maps each byte to one char, so bodies that are not UTF-8 still pass
            JsonNode parsed = JsonUtils.objectMapper().readTree(new String(body, StandardCharsets.ISO_8859_1));
            if (parsed == null || !parsed.isObject()) {
                throw new FetchException(location.id(), "Current conditions for " + location.id() + " is not a JSON object");
            }
        } catch (JsonProcessingException e) {
            throw new FetchException(location.id(), "Current conditions for " + location.id() + " is not valid JSON", e);
        }
        Instant fetchedAt = clock.instant();
        return new RawSnapshot(location, body, fetchedAt);
    }
}
