package io.github.chirino.tracker.api;

import static io.github.chirino.tracker.TestEvents.payload;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.chirino.tracker.api.dto.SaveEventsResponse;
import io.github.chirino.tracker.api.dto.TrackerDto;
import io.github.chirino.tracker.model.FlattenedTurn;
import io.github.chirino.tracker.store.InMemoryTrackerEventRepository;
import io.github.chirino.tracker.store.TrackerNotFoundException;
import io.github.chirino.tracker.store.impl.MongoTrackerStore;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrackersResourceTest {

    private TrackersResource resource;

    @BeforeEach
    void setUp() {
        resource = new TrackersResource();
        resource.store = new MongoTrackerStore(new InMemoryTrackerEventRepository());
    }

    @Test
    void saves_and_reads_back_a_conversation() {
        List<Map<String, Object>> history = history();

        Response saved = resource.saveEvents("alice", history);
        Response again = resource.saveEvents("alice", history);

        assertEquals(200, saved.getStatus());
        assertEquals(3, ((SaveEventsResponse) saved.getEntity()).getAppended());
        assertEquals(0, ((SaveEventsResponse) again.getEntity()).getAppended());

        TrackerDto full = (TrackerDto) resource.getTracker("alice", "full").getEntity();
        assertEquals("alice", full.getSenderId());
        assertEquals(history, full.getEvents());

        TrackerDto session = (TrackerDto) resource.getTracker("alice", null).getEntity();
        assertEquals(history.subList(2, 3), session.getEvents());
    }

    @Test
    @SuppressWarnings("unchecked")
    void lists_keys_under_data() {
        resource.saveEvents("bob", history());
        resource.saveEvents("alice", history());

        Map<String, Object> body = (Map<String, Object>) resource.listKeys().getEntity();

        assertEquals(List.of("alice", "bob"), body.get("data"));
    }

    @Test
    void lists_flattened_turns() {
        List<Map<String, Object>> history = new ArrayList<>(history());
        Map<String, Object> user = payload("user", 4.0);
        user.put("text", "hello");
        history.add(user);
        resource.saveEvents("alice", history);

        List<FlattenedTurn> turns = resource.listTurns("alice", null);

        assertEquals(1, turns.size());
        assertEquals("hello", turns.get(0).userInput());
    }

    @Test
    void rejects_invalid_requests() {
        assertThrows(IllegalArgumentException.class, () -> resource.saveEvents("alice", null));
        assertThrows(
                IllegalArgumentException.class,
                () -> resource.saveEvents("alice", List.of(new LinkedHashMap<>())));
        assertThrows(IllegalArgumentException.class, () -> resource.listTurns("alice", 0));
        assertThrows(
                IllegalArgumentException.class,
                () -> resource.listTurns("alice", TrackersResource.MAX_TURN_LIMIT + 1));

        WebApplicationException badScope =
                assertThrows(
                        WebApplicationException.class,
                        () -> resource.getTracker("alice", "everything"));
        assertEquals(400, badScope.getResponse().getStatus());
    }

    @Test
    void missing_tracker_is_not_found() {
        assertThrows(TrackerNotFoundException.class, () -> resource.getTracker("nobody", "full"));
    }

    private static List<Map<String, Object>> history() {
        Map<String, Object> action = payload("action", 1.0);
        action.put("name", "action_session_start");
        Map<String, Object> session = payload("session_started", 2.0);
        Map<String, Object> bot = payload("bot", 3.0);
        bot.put("text", "Welcome");
        return List.of(action, session, bot);
    }
}
