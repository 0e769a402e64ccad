package io.github.chirino.tracker.api.dto;

import io.github.chirino.tracker.model.ConversationTracker;
import io.github.chirino.tracker.model.TrackerEvent;
import java.util.List;
import java.util.Map;

public class TrackerDto {

    private String senderId;
    private List<Map<String, Object>> events;

    public TrackerDto() {}

    public static TrackerDto from(ConversationTracker tracker) {
        TrackerDto dto = new TrackerDto();
        dto.setSenderId(tracker.senderId());
        dto.setEvents(tracker.events().stream().map(TrackerEvent::payload).toList());
        return dto;
    }

    public String getSenderId() {
        return senderId;
    }

    public void setSenderId(String senderId) {
        this.senderId = senderId;
    }

    public List<Map<String, Object>> getEvents() {
        return events;
    }

    public void setEvents(List<Map<String, Object>> events) {
        this.events = events;
    }
}
