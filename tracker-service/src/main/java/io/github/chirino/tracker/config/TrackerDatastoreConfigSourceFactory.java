package io.github.chirino.tracker.config;

import io.smallrye.config.ConfigSourceContext;
import io.smallrye.config.ConfigSourceFactory;
import io.smallrye.config.ConfigValue;
import io.smallrye.config.PropertiesConfigSource;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.spi.ConfigSource;

/**
 * Derives the Quarkus MongoDB client configuration from tracker-store properties.
 *
 * <ul>
 *   <li>{@code tracker-store.url} → {@code quarkus.mongodb.connection-string}
 *   <li>{@code tracker-store.username} → {@code quarkus.mongodb.credentials.username}
 *   <li>{@code tracker-store.password} → {@code quarkus.mongodb.credentials.password}
 *   <li>{@code tracker-store.auth-source} → {@code quarkus.mongodb.credentials.auth-source}
 *   <li>{@code tracker-store.database} → {@code quarkus.mongodb.database}
 * </ul>
 *
 * <p>Unset keys are not routed, so MongoDB dev services stay active in dev and test mode unless a
 * url is configured. Credentials are only routed together with a username.
 */
public class TrackerDatastoreConfigSourceFactory implements ConfigSourceFactory {

    static final String URL = "tracker-store.url";
    static final String USERNAME = "tracker-store.username";
    static final String PASSWORD = "tracker-store.password";
    static final String AUTH_SOURCE = "tracker-store.auth-source";
    static final String DATABASE = "tracker-store.database";

    static final String DEFAULT_AUTH_SOURCE = "admin";

    // Ordinal 275: higher than application.properties (250), but lower than
    // system properties (300) and environment variables (400), so explicit overrides still win.
    static final int ORDINAL = 275;

    @Override
    public Iterable<ConfigSource> getConfigSources(ConfigSourceContext context) {
        Map<String, String> properties = new HashMap<>();

        String url = getStringValue(context, URL);
        if (url != null) {
            properties.put("quarkus.mongodb.connection-string", url);
        }

        String username = getStringValue(context, USERNAME);
        if (username != null) {
            properties.put("quarkus.mongodb.credentials.username", username);
            String password = getStringValue(context, PASSWORD);
            if (password != null) {
                properties.put("quarkus.mongodb.credentials.password", password);
            }
            String authSource = getStringValue(context, AUTH_SOURCE);
            properties.put(
                    "quarkus.mongodb.credentials.auth-source",
                    authSource != null ? authSource : DEFAULT_AUTH_SOURCE);
        }

        String database = getStringValue(context, DATABASE);
        if (database != null) {
            properties.put("quarkus.mongodb.database", database);
        }

        return List.of(
                new PropertiesConfigSource(properties, "tracker-store-auto-config", ORDINAL));
    }

    private static String getStringValue(ConfigSourceContext context, String key) {
        ConfigValue value = context.getValue(key);
        if (value == null || value.getValue() == null || value.getValue().isBlank()) {
            return null;
        }
        return value.getValue().trim();
    }
}
