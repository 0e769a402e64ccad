package io.github.chirino.tracker;

import io.github.chirino.tracker.model.TrackerEvent;
import java.util.LinkedHashMap;
import java.util.Map;

/** Event payloads shaped like the ones the dialogue engine sends. */
public final class TestEvents {

    private TestEvents() {}

    public static TrackerEvent user(
            double timestamp, String text, String intent, double confidence) {
        Map<String, Object> intentData = new LinkedHashMap<>();
        intentData.put("name", intent);
        intentData.put("confidence", confidence);
        Map<String, Object> parseData = new LinkedHashMap<>();
        parseData.put("intent", intentData);
        parseData.put("text", text);
        Map<String, Object> payload = payload("user", timestamp);
        payload.put("text", text);
        payload.put("parse_data", parseData);
        return TrackerEvent.of(payload);
    }

    public static TrackerEvent action(double timestamp, String name) {
        Map<String, Object> payload = payload("action", timestamp);
        payload.put("name", name);
        payload.put("policy", "policy_0_MemoizationPolicy");
        return TrackerEvent.of(payload);
    }

    public static TrackerEvent bot(double timestamp, String text) {
        Map<String, Object> payload = payload("bot", timestamp);
        payload.put("text", text);
        return TrackerEvent.of(payload);
    }

    public static TrackerEvent bot(double timestamp, String text, Map<String, Object> data) {
        Map<String, Object> payload = payload("bot", timestamp);
        payload.put("text", text);
        payload.put("data", data);
        return TrackerEvent.of(payload);
    }

    public static TrackerEvent sessionStarted(double timestamp) {
        return TrackerEvent.of(payload("session_started", timestamp));
    }

    public static TrackerEvent slot(double timestamp, String name, Object value) {
        Map<String, Object> payload = payload("slot", timestamp);
        payload.put("name", name);
        payload.put("value", value);
        return TrackerEvent.of(payload);
    }

    public static Map<String, Object> payload(String type, double timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", type);
        payload.put("timestamp", timestamp);
        return payload;
    }
}
