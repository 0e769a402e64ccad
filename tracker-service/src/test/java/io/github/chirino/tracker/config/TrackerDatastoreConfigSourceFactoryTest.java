package io.github.chirino.tracker.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.smallrye.config.ConfigSourceContext;
import io.smallrye.config.ConfigValue;
import java.util.Iterator;
import org.eclipse.microprofile.config.spi.ConfigSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrackerDatastoreConfigSourceFactoryTest {

    private ConfigSourceContext context;

    @BeforeEach
    void setUp() {
        context = mock(ConfigSourceContext.class);
    }

    @Test
    void routes_url_and_database_to_the_mongo_client() {
        given(TrackerDatastoreConfigSourceFactory.URL, "mongodb://db:27017 ");
        given(TrackerDatastoreConfigSourceFactory.DATABASE, "bots");

        ConfigSource source = createSource();

        assertEquals("mongodb://db:27017", source.getValue("quarkus.mongodb.connection-string"));
        assertEquals("bots", source.getValue("quarkus.mongodb.database"));
        assertNull(source.getValue("quarkus.mongodb.credentials.username"));
        assertEquals(TrackerDatastoreConfigSourceFactory.ORDINAL, source.getOrdinal());
    }

    @Test
    void credentials_default_to_admin_auth_source() {
        given(TrackerDatastoreConfigSourceFactory.USERNAME, "tracker");
        given(TrackerDatastoreConfigSourceFactory.PASSWORD, "secret");

        ConfigSource source = createSource();

        assertEquals("tracker", source.getValue("quarkus.mongodb.credentials.username"));
        assertEquals("secret", source.getValue("quarkus.mongodb.credentials.password"));
        assertEquals("admin", source.getValue("quarkus.mongodb.credentials.auth-source"));
    }

    @Test
    void explicit_auth_source_wins() {
        given(TrackerDatastoreConfigSourceFactory.USERNAME, "tracker");
        given(TrackerDatastoreConfigSourceFactory.AUTH_SOURCE, "bots");

        ConfigSource source = createSource();

        assertEquals("bots", source.getValue("quarkus.mongodb.credentials.auth-source"));
        assertNull(source.getValue("quarkus.mongodb.credentials.password"));
    }

    @Test
    void password_without_username_is_not_routed() {
        given(TrackerDatastoreConfigSourceFactory.PASSWORD, "secret");
        given(TrackerDatastoreConfigSourceFactory.URL, "  ");

        ConfigSource source = createSource();

        assertTrue(source.getPropertyNames().isEmpty());
    }

    private void given(String key, String value) {
        when(context.getValue(key))
                .thenReturn(ConfigValue.builder().withName(key).withValue(value).build());
    }

    private ConfigSource createSource() {
        Iterator<ConfigSource> sources =
                new TrackerDatastoreConfigSourceFactory().getConfigSources(context).iterator();
        ConfigSource source = sources.next();
        assertEquals("tracker-store-auto-config", source.getName().split("\\[")[0].trim());
        return source;
    }
}
