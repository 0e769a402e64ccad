package io.github.chirino.tracker.model;

import java.util.Map;

/**
 * One immutable event of a conversation, as produced by the dialogue engine.
 *
 * <p>The store only inspects the {@code event} tag and the {@code timestamp}. Every variant keeps
 * the complete payload it was created from so events round trip through the store unchanged. Use
 * {@link #of(Map)} to obtain the variant matching a payload's tag.
 */
public interface TrackerEvent {

    String TYPE_FIELD = "event";
    String TIMESTAMP_FIELD = "timestamp";

    String USER = "user";
    String ACTION = "action";
    String BOT = "bot";
    String SESSION_STARTED = "session_started";

    /** The full event payload, including the {@code event} tag and {@code timestamp}. */
    Map<String, Object> payload();

    default String type() {
        return (String) payload().get(TYPE_FIELD);
    }

    /** Seconds since the epoch, as recorded by the dialogue engine. */
    default double timestamp() {
        return ((Number) payload().get(TIMESTAMP_FIELD)).doubleValue();
    }

    static TrackerEvent of(Map<String, Object> payload) {
        EventPayloads.validate(payload);
        String type = (String) payload.get(TYPE_FIELD);
        return switch (type) {
            case USER -> new UserUtteredEvent(payload);
            case ACTION -> new ActionExecutedEvent(payload);
            case BOT -> new BotUtteredEvent(payload);
            case SESSION_STARTED -> new SessionStartedEvent(payload);
            default -> new OpaqueTrackerEvent(payload);
        };
    }
}
