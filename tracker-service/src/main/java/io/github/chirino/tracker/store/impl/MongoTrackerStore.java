package io.github.chirino.tracker.store.impl;

import io.github.chirino.tracker.model.ConversationTracker;
import io.github.chirino.tracker.model.FlattenedTurn;
import io.github.chirino.tracker.model.TrackerEvent;
import io.github.chirino.tracker.mongo.TrackerDocuments;
import io.github.chirino.tracker.store.TrackerEventRepository;
import io.github.chirino.tracker.store.TrackerEventsAppended;
import io.github.chirino.tracker.store.TrackerNotFoundException;
import io.github.chirino.tracker.store.TrackerStore;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

public class MongoTrackerStore implements TrackerStore {

    private final TrackerEventRepository repository;
    private final SenderIdNormalizer senderIdNormalizer;
    private final SessionWindowResolver sessionWindowResolver;
    private final TrackerEventReader eventReader;
    private final IncrementalEventWriter eventWriter;

    public MongoTrackerStore(TrackerEventRepository repository) {
        this(repository, TrackerDocuments::newBatchId);
    }

    public MongoTrackerStore(TrackerEventRepository repository, Supplier<String> batchIds) {
        this(repository, batchIds, appended -> {});
    }

    /**
     * @param appendListener receives every non-empty batch of events after it is stored
     */
    public MongoTrackerStore(
            TrackerEventRepository repository,
            Supplier<String> batchIds,
            Consumer<TrackerEventsAppended> appendListener) {
        this.repository = repository;
        this.senderIdNormalizer = new SenderIdNormalizer(repository);
        this.sessionWindowResolver = new SessionWindowResolver(repository);
        this.eventReader = new TrackerEventReader(repository);
        this.eventWriter =
                new IncrementalEventWriter(
                        repository,
                        eventReader,
                        new FlattenedTurnMaterializer(),
                        batchIds,
                        appendListener);
    }

    @Override
    public int save(String senderId, List<TrackerEvent> events) {
        requireSenderId(senderId);
        if (events == null) {
            throw new IllegalArgumentException("events must not be null");
        }
        return eventWriter.append(senderId, events);
    }

    @Override
    public Optional<ConversationTracker> retrieve(String senderId) {
        return retrieve(senderId, false);
    }

    @Override
    public Optional<ConversationTracker> retrieveFull(String senderId) {
        return retrieve(senderId, true);
    }

    @Override
    public ConversationTracker getTracker(String senderId, boolean fullHistory) {
        return retrieve(senderId, fullHistory)
                .orElseThrow(() -> new TrackerNotFoundException(senderId));
    }

    @Override
    public Set<String> keys() {
        return repository.distinctSenderIds();
    }

    @Override
    public List<FlattenedTurn> listFlattenedTurns(String senderId, int limit) {
        requireSenderId(senderId);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return repository.findFlattenedTurns(senderId, limit).stream()
                .map(TrackerDocuments::toFlattenedTurn)
                .toList();
    }

    private Optional<ConversationTracker> retrieve(String senderId, boolean fullHistory) {
        requireSenderId(senderId);
        Optional<List<TrackerEvent>> events = readEvents(senderId, fullHistory);
        if (events.isEmpty() && senderIdNormalizer.migrateLegacySenderId(senderId)) {
            events = readEvents(senderId, fullHistory);
        }
        return events.map(list -> new ConversationTracker(senderId, list));
    }

    private Optional<List<TrackerEvent>> readEvents(String senderId, boolean fullHistory) {
        return eventReader.read(senderId, sessionWindowResolver.resolve(senderId, !fullHistory));
    }

    private static void requireSenderId(String senderId) {
        if (senderId == null || senderId.isBlank()) {
            throw new IllegalArgumentException("senderId must not be blank");
        }
    }
}
