package io.github.chirino.tracker.store;

import io.github.chirino.tracker.model.TrackerEvent;
import java.util.List;

/**
 * CDI event fired after a save has stored new events of a conversation. Observers stream the
 * events to an event broker or any other downstream consumer.
 *
 * <p>Only the appended suffix is carried, oldest first. Observers run synchronously on the saving
 * thread after the batch is stored, so a failing observer fails the save without undoing the
 * write.
 */
public class TrackerEventsAppended {

    private final String senderId;
    private final String batchId;
    private final List<TrackerEvent> events;

    public TrackerEventsAppended(String senderId, String batchId, List<TrackerEvent> events) {
        this.senderId = senderId;
        this.batchId = batchId;
        this.events = List.copyOf(events);
    }

    public String getSenderId() {
        return senderId;
    }

    public String getBatchId() {
        return batchId;
    }

    public List<TrackerEvent> getEvents() {
        return events;
    }
}
