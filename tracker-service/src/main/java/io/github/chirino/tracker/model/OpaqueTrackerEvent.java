package io.github.chirino.tracker.model;

import java.util.Map;

/** Any event kind the store does not need to understand (slots, forms, restarts, ...). */
public record OpaqueTrackerEvent(Map<String, Object> payload) implements TrackerEvent {

    public OpaqueTrackerEvent {
        payload = EventPayloads.freeze(payload, null);
    }
}
