package io.github.chirino.tracker.store;

import io.github.chirino.tracker.model.ConversationTracker;
import io.github.chirino.tracker.model.FlattenedTurn;
import io.github.chirino.tracker.model.TrackerEvent;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decorator that wraps a TrackerStore implementation with timing metrics. Every operation is
 * recorded with the Micrometer timer "tracker.store.operation" and an "operation" tag naming the
 * method.
 */
public class MeteredTrackerStore implements TrackerStore {

    static final String TIMER_NAME = "tracker.store.operation";

    private final MeterRegistry registry;
    private final TrackerStore delegate;

    public MeteredTrackerStore(MeterRegistry registry, TrackerStore delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    @Override
    public int save(String senderId, List<TrackerEvent> events) {
        return registry.timer(TIMER_NAME, "operation", "save")
                .record(() -> delegate.save(senderId, events));
    }

    @Override
    public Optional<ConversationTracker> retrieve(String senderId) {
        return registry.timer(TIMER_NAME, "operation", "retrieve")
                .record(() -> delegate.retrieve(senderId));
    }

    @Override
    public Optional<ConversationTracker> retrieveFull(String senderId) {
        return registry.timer(TIMER_NAME, "operation", "retrieveFull")
                .record(() -> delegate.retrieveFull(senderId));
    }

    @Override
    public ConversationTracker getTracker(String senderId, boolean fullHistory) {
        return registry.timer(TIMER_NAME, "operation", "getTracker")
                .record(() -> delegate.getTracker(senderId, fullHistory));
    }

    @Override
    public Set<String> keys() {
        return registry.timer(TIMER_NAME, "operation", "keys").record(delegate::keys);
    }

    @Override
    public List<FlattenedTurn> listFlattenedTurns(String senderId, int limit) {
        return registry.timer(TIMER_NAME, "operation", "listFlattenedTurns")
                .record(() -> delegate.listFlattenedTurns(senderId, limit));
    }
}
