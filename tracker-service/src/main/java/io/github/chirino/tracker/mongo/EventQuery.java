package io.github.chirino.tracker.mongo;

import static io.github.chirino.tracker.mongo.TrackerDocuments.EVENT;
import static io.github.chirino.tracker.mongo.TrackerDocuments.EVENT_TIMESTAMP;
import static io.github.chirino.tracker.mongo.TrackerDocuments.EVENT_TYPE;
import static io.github.chirino.tracker.mongo.TrackerDocuments.ID;
import static io.github.chirino.tracker.mongo.TrackerDocuments.SENDER_ID;

import com.mongodb.client.model.Accumulators;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import io.github.chirino.tracker.model.SessionWindow;
import io.github.chirino.tracker.model.TrackerEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.conversions.Bson;

/**
 * Describes a read over one sender's events and renders it as a filter, sort, group and project
 * aggregation pipeline.
 *
 * <p>Both the session window lookup and the event read are expressed with this type, so the two
 * always agree on which records count as events and how they are ordered.
 */
public final class EventQuery {

    /** How matching events are folded into the single group of the sender. */
    public enum Accumulation {
        /** Every matching event, in timestamp order, under {@link #EVENTS_FIELD}. */
        ALL,
        /** Only the last matching event in timestamp order, under {@link #LATEST_FIELD}. */
        LATEST
    }

    public static final String EVENTS_FIELD = "events";
    public static final String LATEST_FIELD = "event";

    private final String senderId;
    private final String eventType;
    private final String excludedEventType;
    private final Double fromTimestamp;
    private final Accumulation accumulation;

    private EventQuery(Builder builder) {
        this.senderId = builder.senderId;
        this.eventType = builder.eventType;
        this.excludedEventType = builder.excludedEventType;
        this.fromTimestamp = builder.fromTimestamp;
        this.accumulation = builder.accumulation;
    }

    public static Builder forSender(String senderId) {
        return new Builder(senderId);
    }

    /** All events of a sender inside the given window. */
    public static EventQuery events(String senderId, SessionWindow window) {
        Builder builder = forSender(senderId).from(window.start());
        if (window.excludeSessionStarts()) {
            builder.excludingType(TrackerEvent.SESSION_STARTED);
        }
        return builder.build();
    }

    /** The most recent event of the given type. */
    public static EventQuery latestOfType(String senderId, String eventType) {
        return forSender(senderId).ofType(eventType).latestOnly().build();
    }

    public String senderId() {
        return senderId;
    }

    public String eventType() {
        return eventType;
    }

    public String excludedEventType() {
        return excludedEventType;
    }

    public Double fromTimestamp() {
        return fromTimestamp;
    }

    public Accumulation accumulation() {
        return accumulation;
    }

    public String outputField() {
        return accumulation == Accumulation.LATEST ? LATEST_FIELD : EVENTS_FIELD;
    }

    public Bson filter() {
        List<Bson> filters = new ArrayList<>();
        filters.add(Filters.eq(SENDER_ID, senderId));
        // flattened turns live in the same collection but carry no event
        filters.add(Filters.exists(EVENT));
        if (eventType != null) {
            filters.add(Filters.eq(EVENT_TYPE, eventType));
        }
        if (excludedEventType != null) {
            filters.add(Filters.ne(EVENT_TYPE, excludedEventType));
        }
        if (fromTimestamp != null) {
            filters.add(Filters.gte(EVENT_TIMESTAMP, fromTimestamp));
        }
        return Filters.and(filters);
    }

    public List<Bson> toPipeline() {
        String eventRef = "$" + EVENT;
        List<Bson> pipeline = new ArrayList<>();
        pipeline.add(Aggregates.match(filter()));
        pipeline.add(Aggregates.sort(Sorts.ascending(EVENT_TIMESTAMP, ID)));
        pipeline.add(
                Aggregates.group(
                        "$" + SENDER_ID,
                        accumulation == Accumulation.LATEST
                                ? Accumulators.last(LATEST_FIELD, eventRef)
                                : Accumulators.push(EVENTS_FIELD, eventRef)));
        pipeline.add(
                Aggregates.project(
                        Projections.fields(
                                Projections.computed(SENDER_ID, "$" + ID),
                                Projections.include(outputField()),
                                Projections.excludeId())));
        return pipeline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventQuery other)) {
            return false;
        }
        return senderId.equals(other.senderId)
                && Objects.equals(eventType, other.eventType)
                && Objects.equals(excludedEventType, other.excludedEventType)
                && Objects.equals(fromTimestamp, other.fromTimestamp)
                && accumulation == other.accumulation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(senderId, eventType, excludedEventType, fromTimestamp, accumulation);
    }

    @Override
    public String toString() {
        return "EventQuery{senderId="
                + senderId
                + ", eventType="
                + eventType
                + ", excludedEventType="
                + excludedEventType
                + ", fromTimestamp="
                + fromTimestamp
                + ", accumulation="
                + accumulation
                + '}';
    }

    public static final class Builder {

        private final String senderId;
        private String eventType;
        private String excludedEventType;
        private Double fromTimestamp;
        private Accumulation accumulation = Accumulation.ALL;

        private Builder(String senderId) {
            this.senderId = Objects.requireNonNull(senderId, "senderId");
        }

        public Builder ofType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder excludingType(String eventType) {
            this.excludedEventType = eventType;
            return this;
        }

        public Builder from(Double timestamp) {
            this.fromTimestamp = timestamp;
            return this;
        }

        public Builder latestOnly() {
            this.accumulation = Accumulation.LATEST;
            return this;
        }

        public EventQuery build() {
            return new EventQuery(this);
        }
    }
}
