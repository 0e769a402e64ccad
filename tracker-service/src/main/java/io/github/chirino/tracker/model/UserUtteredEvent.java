package io.github.chirino.tracker.model;

import java.util.Map;

/** A user message together with the NLU parse the dialogue engine attached to it. */
public record UserUtteredEvent(Map<String, Object> payload) implements TrackerEvent {

    public UserUtteredEvent {
        payload = EventPayloads.freeze(payload, USER);
    }

    public String text() {
        return EventPayloads.string(payload, "text");
    }

    public String intentName() {
        return EventPayloads.string(payload, "parse_data", "intent", "name");
    }

    public Double intentConfidence() {
        Object confidence = EventPayloads.nested(payload, "parse_data", "intent", "confidence");
        return confidence instanceof Number number ? number.doubleValue() : null;
    }
}
