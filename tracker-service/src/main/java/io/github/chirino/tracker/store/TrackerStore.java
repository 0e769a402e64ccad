package io.github.chirino.tracker.store;

import io.github.chirino.tracker.model.ConversationTracker;
import io.github.chirino.tracker.model.FlattenedTurn;
import io.github.chirino.tracker.model.TrackerEvent;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface TrackerStore {

    /**
     * Persists the events of {@code events} that are not stored yet.
     *
     * <p>The caller must pass the complete, append-only history of the conversation and must be the
     * only writer for that sender id while the call runs. Persisted events are matched by position
     * only, so a truncated or reordered history is not detected beyond a length check.
     *
     * @return the number of events appended
     */
    int save(String senderId, List<TrackerEvent> events);

    /** Events of the current session, without its {@code session_started} marker. */
    Optional<ConversationTracker> retrieve(String senderId);

    /** The complete event history. */
    Optional<ConversationTracker> retrieveFull(String senderId);

    /**
     * Like {@link #retrieve(String)} and {@link #retrieveFull(String)}, but a missing conversation
     * is an error.
     *
     * @throws TrackerNotFoundException when no event is stored under the sender id
     */
    ConversationTracker getTracker(String senderId, boolean fullHistory);

    Set<String> keys();

    List<FlattenedTurn> listFlattenedTurns(String senderId, int limit);
}
