package io.github.chirino.tracker.mongo;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class TrackerIndexMigration {

    private static final Logger LOG = Logger.getLogger(TrackerIndexMigration.class);

    @ConfigProperty(name = "tracker-store.migrate-at-start", defaultValue = "true")
    boolean migrateAtStart;

    @Inject TrackerIndexManager indexManager;

    void onStart(@Observes StartupEvent ignored) {
        if (!migrateAtStart) {
            LOG.debug("Skipping tracker index creation, tracker-store.migrate-at-start=false");
            return;
        }
        indexManager.ensureIndexes();
    }
}
