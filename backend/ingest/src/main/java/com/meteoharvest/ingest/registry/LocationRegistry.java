package com.meteoharvest.ingest.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meteoharvest.core.model.Location;
import com.meteoharvest.core.util.JsonUtils;
import com.meteoharvest.ingest.partition.PartitionKeys;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The fixed set of points ingested on every run, in declaration order.
 */
public final class LocationRegistry {
    public static final String DEFAULT_RESOURCE = "registry/morocco-cities.json";

    private final List<Location> locations;

    private LocationRegistry(List<Location> locations) {
        if (locations.isEmpty()) {
            throw new IllegalArgumentException("Location registry must not be empty");
        }
        Set<String> ids = new HashSet<>();
        Map<String, String> labelsBySegment = new HashMap<>();
        for (Location location : locations) {
            if (!ids.add(location.id())) {
                throw new IllegalArgumentException("Duplicate location id: " + location.id());
            }
            String clash = labelsBySegment.putIfAbsent(PartitionKeys.labelSegment(location.label()), location.label());
            if (clash != null) {
                throw new IllegalArgumentException("Location labels '" + clash + "' and '" + location.label()
                        + "' share the storage folder " + PartitionKeys.labelSegment(location.label()));
            }
        }
        this.locations = List.copyOf(locations);
    }

    public static LocationRegistry of(List<Location> locations) {
        return new LocationRegistry(locations);
    }

    public static LocationRegistry load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return fromEntries(read(in));
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading location registry from " + file, e);
        }
    }

    public static LocationRegistry defaults() {
        try (InputStream in = LocationRegistry.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled registry " + DEFAULT_RESOURCE);
            }
            return fromEntries(read(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading bundled registry " + DEFAULT_RESOURCE, e);
        }
    }

    public List<Location> locations() {
        return locations;
    }

    public int size() {
        return locations.size();
    }

    static String slug(String label) {
        String ascii = Normalizer.normalize(label, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return ascii.toLowerCase(Locale.ROOT).trim().replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
    }

    private static List<LocationEntry> read(InputStream in) throws IOException {
        return JsonUtils.objectMapper().readValue(in, new TypeReference<List<LocationEntry>>() {
        });
    }

    private static LocationRegistry fromEntries(List<LocationEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("Location registry must be a JSON array");
        }
        return new LocationRegistry(entries.stream()
                .map(entry -> {
                    if (entry.label() == null || entry.latitude() == null || entry.longitude() == null) {
                        throw new IllegalArgumentException("Location entry needs label, latitude and longitude: " + entry);
                    }
                    String id = entry.id() == null || entry.id().isBlank() ? slug(entry.label()) : entry.id();
                    return new Location(id, entry.label(), entry.latitude(), entry.longitude());
                })
                .toList());
    }

    private record LocationEntry(String id, String label, Double latitude, Double longitude) {
    }
}
