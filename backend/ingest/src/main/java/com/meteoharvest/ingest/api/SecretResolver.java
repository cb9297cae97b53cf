package com.meteoharvest.ingest.api;

/**
 * Looks up a named secret in a vault. Implementations throw
 * {@link com.meteoharvest.core.error.SecretResolutionException} when the secret is missing or empty.
 */
@FunctionalInterface
public interface SecretResolver {
    String resolve(String vaultId, String secretName);
}
