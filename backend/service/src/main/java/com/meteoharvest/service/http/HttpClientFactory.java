package com.meteoharvest.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Shared client for both upstream providers. A custom truststore is picked up from
 * {@code TRUSTSTORE_PATH} / {@code TRUSTSTORE_PASSWORD} when set.
 */
public final class HttpClientFactory {
    public static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    public static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        String truststorePath = environment.get(TRUSTSTORE_PATH);
        if (truststorePath != null && !truststorePath.isBlank()) {
            builder.sslContext(truststoreContext(Path.of(truststorePath), environment.get(TRUSTSTORE_PASSWORD)));
            LOGGER.info("http.client truststore=" + truststorePath);
        }
        return builder.build();
    }

    private static SSLContext truststoreContext(Path path, String password) {
        if (password == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(storeType(path));
            trustStore.load(in, password.toCharArray());
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), new SecureRandom());
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    private static String storeType(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".p12") || name.endsWith(".pfx") || name.endsWith(".pkcs12") ? "PKCS12" : "JKS";
    }
}
