package io.github.chirino.tracker.mongo.repo;

import static io.github.chirino.tracker.mongo.TrackerDocuments.FLATTENED_TYPE;
import static io.github.chirino.tracker.mongo.TrackerDocuments.SENDER_ID;
import static io.github.chirino.tracker.mongo.TrackerDocuments.TIMESTAMP;
import static io.github.chirino.tracker.mongo.TrackerDocuments.TYPE;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;
import io.github.chirino.tracker.mongo.EventQuery;
import io.github.chirino.tracker.store.TrackerEventRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.bson.BsonValue;
import org.bson.Document;
import org.jboss.logging.Logger;

/** {@link TrackerEventRepository} over a single MongoDB collection. */
public class MongoTrackerEventRepository implements TrackerEventRepository {

    private static final Logger LOG = Logger.getLogger(MongoTrackerEventRepository.class);

    private final MongoCollection<Document> collection;

    public MongoTrackerEventRepository(MongoCollection<Document> collection) {
        this.collection = collection;
    }

    @Override
    public Optional<List<Document>> findEvents(EventQuery query) {
        Document grouped = collection.aggregate(query.toPipeline()).first();
        if (grouped == null) {
            return Optional.empty();
        }
        List<Document> events;
        if (query.accumulation() == EventQuery.Accumulation.LATEST) {
            Document latest = grouped.get(EventQuery.LATEST_FIELD, Document.class);
            events = latest != null ? List.of(latest) : List.of();
        } else {
            events = grouped.getList(EventQuery.EVENTS_FIELD, Document.class, List.of());
        }
        return events.isEmpty() ? Optional.empty() : Optional.of(events);
    }

    @Override
    public void insertBatch(List<Document> documents) {
        if (documents.isEmpty()) {
            return;
        }
        collection.insertMany(documents);
    }

    @Override
    public long rewriteLegacySenderId(long legacySenderId, String senderId) {
        // numeric equality in queries spans int32, int64 and double
        UpdateResult result =
                collection.updateMany(
                        Filters.eq(SENDER_ID, legacySenderId), Updates.set(SENDER_ID, senderId));
        return result.getModifiedCount();
    }

    @Override
    public Set<String> distinctSenderIds() {
        Set<String> senderIds = new TreeSet<>();
        for (BsonValue value :
                collection.distinct(SENDER_ID, BsonValue.class).into(new ArrayList<>())) {
            if (value.isString()) {
                senderIds.add(value.asString().getValue());
            } else if (value.isInt32()) {
                senderIds.add(Integer.toString(value.asInt32().getValue()));
            } else if (value.isInt64()) {
                senderIds.add(Long.toString(value.asInt64().getValue()));
            } else if (isWholeDouble(value)) {
                senderIds.add(Long.toString((long) value.asDouble().getValue()));
            } else {
                LOG.debugf("Skipping sender id %s of BSON type %s", value, value.getBsonType());
            }
        }
        return senderIds;
    }

    // legacy writers may have stored numeric ids as doubles
    private static boolean isWholeDouble(BsonValue value) {
        if (!value.isDouble()) {
            return false;
        }
        double number = value.asDouble().getValue();
        return number == Math.rint(number) && Math.abs(number) < 0x1p53;
    }

    @Override
    public List<Document> findFlattenedTurns(String senderId, int limit) {
        return collection
                .find(
                        Filters.and(
                                Filters.eq(TYPE, FLATTENED_TYPE), Filters.eq(SENDER_ID, senderId)))
                .sort(Sorts.descending(TIMESTAMP))
                .limit(limit)
                .into(new ArrayList<>());
    }
}
