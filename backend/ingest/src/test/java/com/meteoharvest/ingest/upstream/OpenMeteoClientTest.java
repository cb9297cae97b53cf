package com.meteoharvest.ingest.upstream;

import com.meteoharvest.core.error.FetchException;
import com.meteoharvest.core.model.HourlyVariable;
import com.meteoharvest.core.model.Location;
import com.meteoharvest.core.model.ObservationRecord;
import com.meteoharvest.ingest.normalize.ForecastNormalizer;
import com.meteoharvest.ingest.support.FixtureUtils;
import com.meteoharvest.ingest.support.ForecastFixtures;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenMeteoClientTest {
    private static final List<Location> TWO_CITIES = List.of(
            new Location("casablanca", "Casablanca", 33.5731, -7.5898),
            new Location("rabat", "Rabat", 34.0209, -6.8416)
    );

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void sendsOneBatchedRequestAndDecodesSeriesInLocationOrder() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        startServer(FixtureUtils.fixture("fixtures/open-meteo-2x3.json"), query);

        List<ForecastSeries> series = client().fetch(ForecastRequest.currentDay(TWO_CITIES));

        String decoded = URLDecoder.decode(query.get(), StandardCharsets.UTF_8);
        assertTrue(decoded.contains("latitude=33.5731,34.0209"));
        assertTrue(decoded.contains("longitude=-7.5898,-6.8416"));
        assertTrue(decoded.contains("hourly=" + String.join(",", HourlyVariable.wireNames())));
        assertTrue(decoded.contains("daily=sunrise,sunset,precipitation_hours"));
        assertTrue(decoded.contains("timezone=auto"));
        assertTrue(decoded.contains("forecast_days=1"));

        assertEquals(2, series.size());
        ForecastSeries casablanca = series.get(0);
        assertEquals(1709251200L, casablanca.start());
        assertEquals(1709251200L + 3 * 3600, casablanca.end());
        assertEquals(3600, casablanca.interval());
        assertEquals(0.0, casablanca.values(HourlyVariable.TEMPERATURE_2M)[0]);
        assertEquals(11.0, series.get(1).values(HourlyVariable.RELATIVE_HUMIDITY_2M)[0]);
        assertTrue(Double.isNaN(series.get(1).values(HourlyVariable.SNOW_DEPTH)[1]));
    }

    @Test
    void locationCountMismatchIsFetchError() throws Exception {
        startServer(FixtureUtils.fixture("fixtures/open-meteo-2x3.json"), new AtomicReference<>());
        List<Location> three = List.of(TWO_CITIES.get(0), TWO_CITIES.get(1), new Location("safi", "Safi", 32.2994, -9.2372));

        FetchException ex = assertThrows(FetchException.class, () -> client().fetch(ForecastRequest.currentDay(three)));
        assertTrue(ex.getMessage().contains("2 location blocks for 3"));
    }

    @Test
    void missingVariableAndBadJsonAreDecodeFailures() {
        OpenMeteoClient client = new OpenMeteoClient(null, "http://unused");
        ForecastRequest request = ForecastRequest.currentDay(List.of(TWO_CITIES.get(0)));

        assertThrows(FetchException.class, () -> client.decode("{not json", request));
        FetchException missing = assertThrows(FetchException.class, () -> client.decode(
                "{\"hourly\":{\"time\":[0,3600],\"temperature_2m\":[1,2]}}", request));
        assertTrue(missing.getMessage().contains("relative_humidity_2m"));
        FetchException uneven = assertThrows(FetchException.class, () -> client.decode(
                "{\"hourly\":{\"time\":[0,3600,9000]}}", request));
        assertTrue(uneven.getMessage().contains("not evenly spaced"));
    }

    @Test
    void singleObjectResponseIsAcceptedForOneLocation() {
        OpenMeteoClient client = new OpenMeteoClient(null, "http://unused");
        StringBuilder hourly = new StringBuilder("{\"time\":[7200]");
        for (String name : HourlyVariable.wireNames()) {
            hourly.append(",\"").append(name).append("\":[1.5]");
        }
        hourly.append('}');

        List<ForecastSeries> series = client.decode("{\"timezone\":\"Africa/Casablanca\",\"hourly\":" + hourly + "}",
                ForecastRequest.currentDay(List.of(TWO_CITIES.get(0))));

        assertEquals(1, series.size());
        assertEquals(7200, series.get(0).start());
        assertEquals(10800, series.get(0).end());
        assertEquals("Africa/Casablanca", series.get(0).timezone());
    }

    @Test
    void decodedBatchNormalizesToOneRecordPerLocationHour() {
        OpenMeteoClient client = new OpenMeteoClient(null, "http://unused");
        List<ForecastSeries> series = client.decode(
                FixtureUtils.fixture("fixtures/open-meteo-2x3.json"), ForecastRequest.currentDay(TWO_CITIES));

        List<ObservationRecord> records = new ForecastNormalizer().normalize(series, TWO_CITIES);

        assertEquals(6, records.size());
        Instant start = Instant.parse("2024-03-01T00:00:00Z");
        for (int i = 0; i < 6; i++) {
            assertEquals(i < 3 ? "casablanca" : "rabat", records.get(i).locationId());
            assertEquals(start.plusSeconds(3600L * (i % 3)), records.get(i).timestamp());
        }
        assertEquals(1.0, records.get(2).value(HourlyVariable.TEMPERATURE_2M));
        assertEquals(29.5, records.get(4).value(HourlyVariable.DIRECT_RADIATION));
        assertTrue(Double.isNaN(records.get(4).value(HourlyVariable.SNOW_DEPTH)));
    }

    @Test
    void generatedBatchKeepsSpanOverIntervalRecordsPerLocation() {
        List<Location> locations = ForecastFixtures.locations(5);
        List<ForecastSeries> series = new OpenMeteoClient(null, "http://unused").decode(
                ForecastFixtures.forecastJson(5, 24, Instant.parse("2024-03-01T00:00:00Z")),
                ForecastRequest.currentDay(locations));

        List<ObservationRecord> records = new ForecastNormalizer().normalize(series, locations);

        for (int i = 0; i < locations.size(); i++) {
            ForecastSeries s = series.get(i);
            String id = locations.get(i).id();
            assertEquals((s.end() - s.start()) / s.interval(),
                    records.stream().filter(r -> r.locationId().equals(id)).count());
        }
        assertEquals(120, records.size());
    }

    private OpenMeteoClient client() {
        HttpFetcher fetcher = new HttpFetcher(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                new ResponseCache(Duration.ofHours(1), Clock.systemUTC()),
                new RetryPolicy(1, Duration.ZERO, 1.0),
                Duration.ofSeconds(2),
                "meteo-harvest-test"
        );
        return new OpenMeteoClient(fetcher, "http://localhost:" + server.getAddress().getPort() + "/v1/forecast");
    }

    private void startServer(String body, AtomicReference<String> query) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/forecast", exchange -> {
            query.set(exchange.getRequestURI().getRawQuery());
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }
}
