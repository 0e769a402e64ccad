package io.github.chirino.tracker.api;

import io.github.chirino.tracker.api.dto.SaveEventsResponse;
import io.github.chirino.tracker.api.dto.TrackerDto;
import io.github.chirino.tracker.model.ConversationTracker;
import io.github.chirino.tracker.model.FlattenedTurn;
import io.github.chirino.tracker.model.TrackerEvent;
import io.github.chirino.tracker.store.TrackerStore;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Path("/v1/trackers")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TrackersResource {

    static final int DEFAULT_TURN_LIMIT = 20;
    static final int MAX_TURN_LIMIT = 500;

    @Inject TrackerStore store;

    @GET
    public Response listKeys() {
        return Response.ok(Map.of("data", new ArrayList<>(store.keys()))).build();
    }

    @GET
    @Path("/{senderId}")
    public Response getTracker(
            @PathParam("senderId") String senderId, @QueryParam("scope") String scope) {
        TrackerScope trackerScope = TrackerScope.fromQuery(scope);
        ConversationTracker tracker =
                store.getTracker(senderId, trackerScope == TrackerScope.FULL);
        return Response.ok(TrackerDto.from(tracker)).build();
    }

    /**
     * Accepts the complete event history of a conversation; only events not stored yet are
     * appended.
     */
    @PUT
    @Path("/{senderId}/events")
    public Response saveEvents(
            @PathParam("senderId") String senderId, List<Map<String, Object>> events) {
        if (events == null) {
            throw new IllegalArgumentException("request body must be a list of events");
        }
        List<TrackerEvent> history = events.stream().map(TrackerEvent::of).toList();
        int appended = store.save(senderId, history);
        return Response.ok(new SaveEventsResponse(appended)).build();
    }

    @GET
    @Path("/{senderId}/turns")
    public List<FlattenedTurn> listTurns(
            @PathParam("senderId") String senderId, @QueryParam("limit") Integer limit) {
        int pageSize = limit != null ? limit : DEFAULT_TURN_LIMIT;
        if (pageSize <= 0 || pageSize > MAX_TURN_LIMIT) {
            throw new IllegalArgumentException(
                    "limit must be between 1 and " + MAX_TURN_LIMIT + ", got " + pageSize);
        }
        return store.listFlattenedTurns(senderId, pageSize);
    }
}
