package com.meteoharvest.service.secrets;

import com.meteoharvest.core.error.SecretResolutionException;
import com.meteoharvest.ingest.api.SecretResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves secrets from environment variables. For vault {@code kv-weather} and secret
 * {@code OpenWeatherApiKey} the candidates are, in order: {@code OpenWeatherApiKey},
 * {@code OPEN_WEATHER_API_KEY}, {@code KV_WEATHER_OPEN_WEATHER_API_KEY}.
 */
public final class EnvironmentSecretResolver implements SecretResolver {
    private final Map<String, String> environment;

    public EnvironmentSecretResolver() {
        this(System.getenv());
    }

    public EnvironmentSecretResolver(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    @Override
    public String resolve(String vaultId, String secretName) {
        if (secretName == null || secretName.isBlank()) {
            throw new SecretResolutionException("Secret name is required");
        }
        List<String> candidates = candidates(vaultId, secretName);
        for (String candidate : candidates) {
            String value = environment.get(candidate);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        throw new SecretResolutionException("Secret " + secretName + " not found in environment (tried "
                + String.join(", ", candidates) + ")");
    }

    static List<String> candidates(String vaultId, String secretName) {
        List<String> names = new ArrayList<>();
        names.add(secretName);
        String snake = upperSnake(secretName);
        if (!snake.equals(secretName)) {
            names.add(snake);
        }
        if (vaultId != null && !vaultId.isBlank()) {
            names.add(upperSnake(vaultId) + "_" + snake);
        }
        return names;
    }

    static String upperSnake(String name) {
        String spaced = name.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replaceAll("[^A-Za-z0-9]+", "_");
        return spaced.toUpperCase(Locale.ROOT);
    }
}
