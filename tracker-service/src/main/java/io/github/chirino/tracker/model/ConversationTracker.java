package io.github.chirino.tracker.model;

import java.util.List;

/** Reconstructed conversation state handed back to the dialogue engine. */
public record ConversationTracker(String senderId, List<TrackerEvent> events) {

    public ConversationTracker {
        events = List.copyOf(events);
    }

    public TrackerEvent latestEvent() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }
}
