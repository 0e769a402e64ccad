package io.github.chirino.tracker.model;

import java.util.Map;

/** Marks the beginning of a session window within a conversation. */
public record SessionStartedEvent(Map<String, Object> payload) implements TrackerEvent {

    public SessionStartedEvent {
        payload = EventPayloads.freeze(payload, SESSION_STARTED);
    }
}
