package io.github.chirino.tracker.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import io.github.chirino.tracker.mongo.TrackerDocuments;
import io.github.chirino.tracker.mongo.TrackerIndexManager;
import io.github.chirino.tracker.mongo.repo.MongoTrackerEventRepository;
import io.github.chirino.tracker.store.MeteredTrackerStore;
import io.github.chirino.tracker.store.TrackerEventsAppended;
import io.github.chirino.tracker.store.TrackerStore;
import io.github.chirino.tracker.store.impl.MongoTrackerStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.bson.Document;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Builds the tracker store graph once from configuration. The {@link MongoClient} is owned by the
 * Quarkus MongoDB extension, which opens it on first use and closes it on shutdown.
 */
@ApplicationScoped
public class TrackerStoreProducer {

    private static final Logger LOG = Logger.getLogger(TrackerStoreProducer.class);

    @ConfigProperty(name = "tracker-store.database", defaultValue = "tracker_store")
    String databaseName;

    @ConfigProperty(name = "tracker-store.collection", defaultValue = "conversations")
    String collectionName;

    @Inject MongoClient mongoClient;

    @Inject MeterRegistry meterRegistry;

    @Inject Event<TrackerEventsAppended> appendedEvents;

    MongoCollection<Document> trackerCollection() {
        return mongoClient.getDatabase(databaseName).getCollection(collectionName);
    }

    @Produces
    @Singleton
    public TrackerStore trackerStore() {
        LOG.infof("Using tracker collection %s.%s", databaseName, collectionName);
        TrackerStore store =
                new MongoTrackerStore(
                        new MongoTrackerEventRepository(trackerCollection()),
                        TrackerDocuments::newBatchId,
                        appendedEvents::fire);
        return new MeteredTrackerStore(meterRegistry, store);
    }

    @Produces
    @Singleton
    public TrackerIndexManager trackerIndexManager() {
        return new TrackerIndexManager(trackerCollection());
    }
}
