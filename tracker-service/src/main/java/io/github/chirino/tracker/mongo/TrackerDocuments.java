package io.github.chirino.tracker.mongo;

import io.github.chirino.tracker.model.FlattenedTurn;
import io.github.chirino.tracker.model.FlattenedTurn.BotResponse;
import io.github.chirino.tracker.model.TrackerEvent;
import io.github.chirino.tracker.store.CorruptTrackerRecordException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * Field names and conversions for the records kept in the tracker collection.
 *
 * <p>Event records look like {@code {sender_id, conversation_id, event: {event, timestamp, ...}}}.
 * Flattened turns share the collection and are tagged with {@code type: "flattened"}; they carry
 * no {@code event} field.
 */
public final class TrackerDocuments {

    public static final String ID = "_id";
    public static final String SENDER_ID = "sender_id";
    public static final String CONVERSATION_ID = "conversation_id";
    public static final String EVENT = "event";
    public static final String TYPE = "type";
    public static final String TIMESTAMP = "timestamp";
    public static final String DATA = "data";

    public static final String EVENT_TYPE = EVENT + "." + TrackerEvent.TYPE_FIELD;
    public static final String EVENT_TIMESTAMP = EVENT + "." + TrackerEvent.TIMESTAMP_FIELD;
    public static final String EVENT_NAME = EVENT + ".name";

    public static final String FLATTENED_TYPE = "flattened";

    static final String USER_INPUT = "user_input";
    static final String INTENT = "intent";
    static final String CONFIDENCE = "confidence";
    static final String ACTION = "action";
    static final String BOT_RESPONSE = "bot_response";
    static final String TEXT = "text";

    private TrackerDocuments() {}

    /**
     * Identifier shared by every record written in one batch. Ids sort in creation order, so the
     * (sender_id, conversation_id) index lists a sender's batches oldest first.
     */
    public static String newBatchId() {
        return new ObjectId().toHexString();
    }

    public static Document eventDocument(String senderId, String batchId, TrackerEvent event) {
        // Explicit ids keep insertion order as the tie-breaker for equal timestamps.
        return new Document(ID, new ObjectId())
                .append(SENDER_ID, senderId)
                .append(CONVERSATION_ID, batchId)
                .append(EVENT, new Document(event.payload()));
    }

    /**
     * @throws CorruptTrackerRecordException when the stored payload lacks its tag or a numeric
     *     timestamp
     */
    public static TrackerEvent toEvent(Document payload) {
        try {
            return TrackerEvent.of(toPlainMap(payload));
        } catch (IllegalArgumentException e) {
            throw new CorruptTrackerRecordException(
                    "Stored tracker event cannot be decoded: " + e.getMessage(), e);
        }
    }

    public static Document flattenedDocument(FlattenedTurn turn) {
        List<Document> botResponses = new ArrayList<>();
        for (BotResponse response : turn.botResponses()) {
            botResponses.add(new Document(TEXT, response.text()).append(DATA, response.data()));
        }
        Document data =
                new Document(USER_INPUT, turn.userInput())
                        .append(INTENT, turn.intentName())
                        .append(CONFIDENCE, turn.intentConfidence())
                        .append(ACTION, new ArrayList<>(turn.actionNames()))
                        .append(BOT_RESPONSE, botResponses);
        return new Document(ID, new ObjectId())
                .append(TYPE, FLATTENED_TYPE)
                .append(SENDER_ID, turn.senderId())
                .append(CONVERSATION_ID, turn.turnId())
                .append(TIMESTAMP, turn.timestamp())
                .append(DATA, data);
    }

    public static FlattenedTurn toFlattenedTurn(Document document) {
        Document data = document.get(DATA, Document.class);
        if (data == null) {
            data = new Document();
        }
        List<String> actions = new ArrayList<>();
        List<?> storedActions = data.get(ACTION, List.class);
        if (storedActions != null) {
            for (Object action : storedActions) {
                actions.add(action != null ? action.toString() : null);
            }
        }
        List<BotResponse> responses = new ArrayList<>();
        List<?> storedResponses = data.get(BOT_RESPONSE, List.class);
        if (storedResponses != null) {
            for (Object stored : storedResponses) {
                if (stored instanceof Document response) {
                    responses.add(
                            new BotResponse(
                                    response.getString(TEXT), toPlainValue(response.get(DATA))));
                }
            }
        }
        Number timestamp = document.get(TIMESTAMP, Number.class);
        Number confidence = data.get(CONFIDENCE, Number.class);
        return new FlattenedTurn(
                document.getString(SENDER_ID),
                document.getString(CONVERSATION_ID),
                timestamp != null ? timestamp.doubleValue() : null,
                data.getString(USER_INPUT),
                data.getString(INTENT),
                confidence != null ? confidence.doubleValue() : null,
                actions,
                responses);
    }

    /** Copies a decoded BSON document into plain maps and lists, recursively. */
    public static Map<String, Object> toPlainMap(Map<String, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            result.put(entry.getKey(), toPlainValue(entry.getValue()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Object toPlainValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return toPlainMap((Map<String, ?>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(toPlainValue(item));
            }
            return copy;
        }
        return value;
    }
}
