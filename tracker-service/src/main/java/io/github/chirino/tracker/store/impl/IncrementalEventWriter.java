package io.github.chirino.tracker.store.impl;

import io.github.chirino.tracker.model.SessionWindow;
import io.github.chirino.tracker.model.TrackerEvent;
import io.github.chirino.tracker.mongo.TrackerDocuments;
import io.github.chirino.tracker.store.TrackerEventRepository;
import io.github.chirino.tracker.store.TrackerEventsAppended;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.bson.Document;
import org.jboss.logging.Logger;

/**
 * Appends the part of a conversation's history that is not persisted yet.
 *
 * <p>The persisted part is identified by length alone: the first {@code n} events of the supplied
 * history are assumed to be the {@code n} events already stored. This holds only while the history
 * is append-only and a single writer handles the conversation.
 */
public class IncrementalEventWriter {

    private static final Logger LOG = Logger.getLogger(IncrementalEventWriter.class);

    private final TrackerEventRepository repository;
    private final TrackerEventReader reader;
    private final FlattenedTurnMaterializer materializer;
    private final Supplier<String> batchIds;
    private final Consumer<TrackerEventsAppended> appendListener;

    public IncrementalEventWriter(
            TrackerEventRepository repository,
            TrackerEventReader reader,
            FlattenedTurnMaterializer materializer,
            Supplier<String> batchIds,
            Consumer<TrackerEventsAppended> appendListener) {
        this.repository = repository;
        this.reader = reader;
        this.materializer = materializer;
        this.batchIds = batchIds;
        this.appendListener = appendListener;
    }

    /**
     * Stores the unpersisted suffix of {@code history} and then hands it to the append listener.
     * Nothing is published when nothing was stored.
     *
     * @return the number of events appended
     */
    public int append(String senderId, List<TrackerEvent> history) {
        int persisted =
                reader.read(senderId, SessionWindow.unbounded()).map(List::size).orElse(0);
        if (persisted > history.size()) {
            LOG.warnf(
                    "Tracker '%s' has %d persisted events but only %d were supplied, nothing"
                            + " appended",
                    senderId, persisted, history.size());
            return 0;
        }
        List<TrackerEvent> suffix = history.subList(persisted, history.size());
        if (suffix.isEmpty()) {
            LOG.debugf("Tracker '%s' is up to date with %d events", senderId, persisted);
            return 0;
        }

        String batchId = batchIds.get();
        List<Document> batch = new ArrayList<>(suffix.size() + 1);
        for (TrackerEvent event : suffix) {
            batch.add(TrackerDocuments.eventDocument(senderId, batchId, event));
        }
        materializer
                .materialize(senderId, batchId, suffix)
                .map(TrackerDocuments::flattenedDocument)
                .ifPresent(batch::add);
        repository.insertBatch(batch);
        appendListener.accept(new TrackerEventsAppended(senderId, batchId, suffix));

        LOG.debugf(
                "Appended %d events to tracker '%s' in batch %s (%d records)",
                suffix.size(), senderId, batchId, batch.size());
        return suffix.size();
    }
}
