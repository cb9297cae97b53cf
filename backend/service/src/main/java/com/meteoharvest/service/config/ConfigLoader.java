package com.meteoharvest.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meteoharvest.core.util.JsonUtils;
import com.meteoharvest.ingest.registry.LocationRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

public final class ConfigLoader {
    public static final String INGESTION_FILE = "ingestion.json";
    public static final String LOCATIONS_FILE = "locations.json";

    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static IngestionConfig loadIngestion(Path configDir) {
        IngestionConfig config = read(configDir.resolve(INGESTION_FILE), new TypeReference<>() {
        });
        if (config == null) {
            throw new IllegalStateException("Empty config in " + configDir.resolve(INGESTION_FILE));
        }
        return config;
    }

    public static LocationRegistry loadLocations(Path configDir) {
        Path file = configDir.resolve(LOCATIONS_FILE);
        if (!Files.exists(file)) {
            LOGGER.warning("No " + file + " found; using the bundled location registry");
            return LocationRegistry.defaults();
        }
        return LocationRegistry.load(file);
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
