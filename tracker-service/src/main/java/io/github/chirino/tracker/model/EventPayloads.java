package io.github.chirino.tracker.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class EventPayloads {

    private EventPayloads() {}

    static void validate(Map<String, Object> payload) {
        if (payload == null) {
            throw new IllegalArgumentException("event payload must not be null");
        }
        if (!(payload.get(TrackerEvent.TYPE_FIELD) instanceof String type) || type.isBlank()) {
            throw new IllegalArgumentException(
                    "event payload requires a non-blank '" + TrackerEvent.TYPE_FIELD + "' tag");
        }
        if (!(payload.get(TrackerEvent.TIMESTAMP_FIELD) instanceof Number)) {
            throw new IllegalArgumentException(
                    "event payload requires a numeric '" + TrackerEvent.TIMESTAMP_FIELD + "'");
        }
    }

    static Map<String, Object> freeze(Map<String, Object> payload, String expectedType) {
        validate(payload);
        Object type = payload.get(TrackerEvent.TYPE_FIELD);
        if (expectedType != null && !expectedType.equals(type)) {
            throw new IllegalArgumentException(
                    "expected '" + expectedType + "' event but got '" + type + "'");
        }
        return immutableMap(payload);
    }

    /** Nested maps and lists are copied as well. */
    private static Map<String, Object> immutableMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), immutableValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(immutableValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /** Walks nested maps, returning null as soon as a segment is missing. */
    static Object nested(Map<String, Object> payload, String... path) {
        Object current = payload;
        for (String segment : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    static String string(Map<String, Object> payload, String... path) {
        Object value = nested(payload, path);
        return value != null ? value.toString() : null;
    }
}
