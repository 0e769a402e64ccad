package io.github.chirino.tracker.store;

import io.github.chirino.tracker.mongo.EventQuery;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.bson.Document;

/** Storage operations the tracker store needs from its backing collection. */
public interface TrackerEventRepository {

    /**
     * Runs the query and returns the matching event payloads in timestamp order.
     *
     * @return empty when no event matches; never an empty list
     */
    Optional<List<Document>> findEvents(EventQuery query);

    /** Appends all documents in one ordered write. */
    void insertBatch(List<Document> documents);

    /**
     * Rewrites every record stored under the integer form of a sender id to its string form.
     *
     * @return the number of records rewritten
     */
    long rewriteLegacySenderId(long legacySenderId, String senderId);

    Set<String> distinctSenderIds();

    /** Flattened turn records of a sender, newest first. */
    List<Document> findFlattenedTurns(String senderId, int limit);
}
