package com.meteoharvest.ingest.upstream;

import com.meteoharvest.core.error.FetchException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * GETs a body through the response cache, retrying transient failures per {@link RetryPolicy}.
 * Every failure surfaces as a {@link FetchException} for the caller's scope.
 */
public final class HttpFetcher {
    private static final Logger LOGGER = Logger.getLogger(HttpFetcher.class.getName());

    private final HttpClient httpClient;
    private final ResponseCache cache;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final String userAgent;
    private final Sleeper sleeper;

    public HttpFetcher(HttpClient httpClient, ResponseCache cache, RetryPolicy retryPolicy, Duration timeout, String userAgent) {
        this(httpClient, cache, retryPolicy, timeout, userAgent, Sleeper.SYSTEM);
    }

    public HttpFetcher(
            HttpClient httpClient,
            ResponseCache cache,
            RetryPolicy retryPolicy,
            Duration timeout,
            String userAgent,
            Sleeper sleeper
    ) {
        this.httpClient = httpClient;
        this.cache = cache;
        this.retryPolicy = retryPolicy;
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.sleeper = sleeper;
    }

    /**
     * Body decoded as UTF-8, the encoding JSON is exchanged in.
     */
    public String getJson(URI uri, String scope) {
        return new String(getBytes(uri, uri.toString(), scope), StandardCharsets.UTF_8);
    }

    /**
     * @param uri      request target
     * @param logUri   representation safe to log and put in error messages (no credentials)
     * @param scope    location id or batch scope the failure is attributed to
     * @return the response body exactly as received
     */
    public byte[] getBytes(URI uri, String logUri, String scope) {
        String cacheKey = uri.toString();
        Optional<byte[]> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            LOGGER.fine(() -> "upstream.cache hit scope=" + scope + " uri=" + logUri);
            return cached.get();
        }

        int attempt = 0;
        while (true) {
            attempt++;
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .header("User-Agent", userAgent)
                    .build();
            try {
                HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
                int status = response.statusCode();
                if (status / 100 == 2) {
                    cache.put(cacheKey, response.body());
                    return response.body();
                }
                if (!retryPolicy.isRetryableStatus(status) || attempt >= retryPolicy.maxAttempts()) {
                    throw new FetchException(scope, "Upstream returned HTTP " + status + " for " + logUri
                            + " after " + attempt + " attempt(s)");
                }
                LOGGER.warning("upstream.retry scope=" + scope + " attempt=" + attempt + " status=" + status);
            } catch (IOException e) {
                if (attempt >= retryPolicy.maxAttempts()) {
                    throw new FetchException(scope, "Request to " + logUri + " failed after " + attempt + " attempt(s)", e);
                }
                LOGGER.warning("upstream.retry scope=" + scope + " attempt=" + attempt + " error=" + e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(scope, "Interrupted while requesting " + logUri, e);
            }
            backoff(attempt, scope, logUri);
        }
    }

    private void backoff(int attempt, String scope, String logUri) {
        try {
            sleeper.sleep(retryPolicy.delayAfterAttempt(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(scope, "Interrupted during retry backoff for " + logUri, e);
        }
    }
}
