package io.github.chirino.tracker.model;

/**
 * Derived timestamp interval {@code [start, +inf)} of a conversation.
 *
 * @param start inclusive lower bound in epoch seconds, or null for the full history
 * @param excludeSessionStarts whether {@code session_started} markers are left out of the window
 */
public record SessionWindow(Double start, boolean excludeSessionStarts) {

    private static final SessionWindow UNBOUNDED = new SessionWindow(null, false);

    public static SessionWindow unbounded() {
        return UNBOUNDED;
    }

    public static SessionWindow currentSession(Double start) {
        return new SessionWindow(start, true);
    }

    public boolean isBounded() {
        return start != null;
    }
}
