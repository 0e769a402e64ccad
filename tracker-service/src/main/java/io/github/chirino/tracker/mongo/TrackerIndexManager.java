package io.github.chirino.tracker.mongo;

import static io.github.chirino.tracker.mongo.TrackerDocuments.CONVERSATION_ID;
import static io.github.chirino.tracker.mongo.TrackerDocuments.EVENT_NAME;
import static io.github.chirino.tracker.mongo.TrackerDocuments.EVENT_TIMESTAMP;
import static io.github.chirino.tracker.mongo.TrackerDocuments.EVENT_TYPE;
import static io.github.chirino.tracker.mongo.TrackerDocuments.SENDER_ID;
import static io.github.chirino.tracker.mongo.TrackerDocuments.TIMESTAMP;
import static io.github.chirino.tracker.mongo.TrackerDocuments.TYPE;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.IndexModel;
import com.mongodb.client.model.Indexes;
import java.util.List;
import org.bson.Document;
import org.jboss.logging.Logger;

/**
 * Declares the indexes the tracker queries rely on. Creating an index that already exists with the
 * same keys is a no-op on the server, so {@link #ensureIndexes()} can run on every boot.
 */
public class TrackerIndexManager {

    private static final Logger LOG = Logger.getLogger(TrackerIndexManager.class);

    static final List<IndexModel> INDEXES =
            List.of(
                    new IndexModel(Indexes.ascending(SENDER_ID, EVENT_TYPE)),
                    new IndexModel(Indexes.ascending(TYPE, TIMESTAMP)),
                    new IndexModel(Indexes.ascending(SENDER_ID, CONVERSATION_ID)),
                    new IndexModel(
                            Indexes.compoundIndex(
                                    Indexes.ascending(EVENT_TYPE),
                                    Indexes.descending(EVENT_TIMESTAMP))),
                    new IndexModel(
                            Indexes.compoundIndex(
                                    Indexes.ascending(EVENT_NAME),
                                    Indexes.descending(EVENT_TIMESTAMP))),
                    new IndexModel(Indexes.descending(EVENT_TIMESTAMP)));

    private final MongoCollection<Document> collection;

    public TrackerIndexManager(MongoCollection<Document> collection) {
        this.collection = collection;
    }

    public List<IndexModel> indexModels() {
        return INDEXES;
    }

    /**
     * @return the names of the ensured indexes, as reported by the server
     */
    public List<String> ensureIndexes() {
        List<String> names = collection.createIndexes(INDEXES);
        LOG.infof(
                "Ensured %d indexes on tracker collection '%s': %s",
                names.size(), collection.getNamespace().getCollectionName(), names);
        return names;
    }
}
