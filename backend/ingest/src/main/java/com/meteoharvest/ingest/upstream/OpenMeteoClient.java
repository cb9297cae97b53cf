package com.meteoharvest.ingest.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.meteoharvest.core.error.FetchException;
import com.meteoharvest.core.error.IngestionException;
import com.meteoharvest.core.model.DailyVariable;
import com.meteoharvest.core.model.HourlyVariable;
import com.meteoharvest.core.model.Location;
import com.meteoharvest.core.util.JsonUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Batched forecast client: one GET for all locations, one {@link ForecastSeries} back per location in
 * request order.
 */
public final class OpenMeteoClient {
    public static final String DEFAULT_ENDPOINT = "https://api.open-meteo.com/v1/forecast";

    private static final String SCOPE = IngestionException.BATCH_SCOPE;
    private static final long DEFAULT_INTERVAL_SECONDS = 3600;

    private final HttpFetcher fetcher;
    private final String endpoint;

    public OpenMeteoClient(HttpFetcher fetcher, String endpoint) {
        this.fetcher = fetcher;
        this.endpoint = endpoint;
    }

    public List<ForecastSeries> fetch(ForecastRequest request) {
        URI uri = buildUri(request);
        String body = fetcher.getJson(uri, SCOPE);
        return decode(body, request);
    }

    URI buildUri(ForecastRequest request) {
        String query = "latitude=" + joined(request.locations(), location -> Double.toString(location.latitude()))
                + "&longitude=" + joined(request.locations(), location -> Double.toString(location.longitude()))
                + "&hourly=" + joined(request.hourly(), HourlyVariable::wireName)
                + "&daily=" + joined(request.daily(), DailyVariable::wireName)
                + "&timezone=" + encode(request.timezone())
                + "&forecast_days=" + request.forecastDays()
                + "&timeformat=unixtime";
        return URI.create(endpoint + "?" + query);
    }

    List<ForecastSeries> decode(String body, ForecastRequest request) {
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException(SCOPE, "Forecast response is not valid JSON", e);
        }
        List<JsonNode> perLocation = new ArrayList<>();
        if (root != null && root.isArray()) {
            root.forEach(perLocation::add);
        } else if (root != null && root.isObject()) {
            perLocation.add(root);
        } else {
            throw new FetchException(SCOPE, "Forecast response must be a JSON object or array");
        }
        if (perLocation.size() != request.locations().size()) {
            throw new FetchException(SCOPE, "Forecast response has " + perLocation.size()
                    + " location blocks for " + request.locations().size() + " requested locations");
        }

        List<ForecastSeries> series = new ArrayList<>(perLocation.size());
        for (int i = 0; i < perLocation.size(); i++) {
            series.add(decodeLocation(perLocation.get(i), request.locations().get(i), request.hourly()));
        }
        return series;
    }

    private ForecastSeries decodeLocation(JsonNode node, Location location, List<HourlyVariable> variables) {
        if (node.path("error").asBoolean(false)) {
            throw new FetchException(SCOPE, "Provider error for " + location.id() + ": " + node.path("reason").asText(""));
        }
        JsonNode hourly = node.path("hourly");
        JsonNode time = hourly.path("time");
        if (!time.isArray() || time.isEmpty()) {
            throw new FetchException(SCOPE, "Forecast block for " + location.id() + " has no hourly time axis");
        }
        long[] epochs = new long[time.size()];
        for (int i = 0; i < time.size(); i++) {
            if (!time.get(i).canConvertToLong()) {
                throw new FetchException(SCOPE, "Non-numeric hourly timestamp for " + location.id() + ": " + time.get(i));
            }
            epochs[i] = time.get(i).asLong();
        }
        long interval = epochs.length > 1 ? epochs[1] - epochs[0] : DEFAULT_INTERVAL_SECONDS;
        if (interval <= 0) {
            throw new FetchException(SCOPE, "Hourly time axis for " + location.id() + " is not increasing");
        }
        for (int i = 1; i < epochs.length; i++) {
            if (epochs[i] - epochs[i - 1] != interval) {
                throw new FetchException(SCOPE, "Hourly time axis for " + location.id() + " is not evenly spaced");
            }
        }

        Map<HourlyVariable, double[]> values = new EnumMap<>(HourlyVariable.class);
        for (HourlyVariable variable : variables) {
            JsonNode array = hourly.get(variable.wireName());
            if (array == null || !array.isArray()) {
                throw new FetchException(SCOPE, "Forecast block for " + location.id() + " is missing " + variable.wireName());
            }
            values.put(variable, toDoubles(array, location, variable));
        }

        long start = epochs[0];
        long end = epochs[epochs.length - 1] + interval;
        return new ForecastSeries(start, end, interval, node.path("timezone").asText("GMT"), values);
    }

    private double[] toDoubles(JsonNode array, Location location, HourlyVariable variable) {
        double[] out = new double[array.size()];
        for (int i = 0; i < array.size(); i++) {
            JsonNode value = array.get(i);
            if (value.isNull()) {
                out[i] = Double.NaN;
            } else if (value.isNumber()) {
                out[i] = value.asDouble();
            } else {
                throw new FetchException(SCOPE, "Non-numeric " + variable.wireName() + " value for " + location.id());
            }
        }
        return out;
    }

    private static <T> String joined(List<T> items, Function<T, String> toValue) {
        return items.stream().map(toValue).map(OpenMeteoClient::encode).collect(Collectors.joining(","));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
