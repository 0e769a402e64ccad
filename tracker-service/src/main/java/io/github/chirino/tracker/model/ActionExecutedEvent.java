package io.github.chirino.tracker.model;

import java.util.Map;

public record ActionExecutedEvent(Map<String, Object> payload) implements TrackerEvent {

    public ActionExecutedEvent {
        payload = EventPayloads.freeze(payload, ACTION);
    }

    public String name() {
        return EventPayloads.string(payload, "name");
    }
}
