package io.github.chirino.tracker.model;

import java.util.Map;

public record BotUtteredEvent(Map<String, Object> payload) implements TrackerEvent {

    public BotUtteredEvent {
        payload = EventPayloads.freeze(payload, BOT);
    }

    public String text() {
        return EventPayloads.string(payload, "text");
    }

    /** Auxiliary response data (buttons, attachments, custom json); may be null. */
    public Object data() {
        return payload.get("data");
    }
}
