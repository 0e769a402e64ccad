package io.github.chirino.tracker.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.mongodb.MongoException;
import com.mongodb.MongoTimeoutException;
import io.github.chirino.tracker.api.dto.ErrorResponse;
import io.github.chirino.tracker.store.CorruptTrackerRecordException;
import io.github.chirino.tracker.store.TrackerNotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    @Test
    void missing_tracker_maps_to_404() {
        Response response = mapper.handleTrackerNotFound(new TrackerNotFoundException("alice"));

        assertEquals(404, response.getStatus());
        ErrorResponse body = (ErrorResponse) response.getEntity();
        assertEquals("not_found", body.code());
        assertEquals("alice", body.details().get("senderId"));
    }

    @Test
    void invalid_argument_maps_to_400() {
        IllegalArgumentException e = new IllegalArgumentException("limit must be positive");

        Response response = mapper.handleIllegalArgument(e);

        assertEquals(400, response.getStatus());
        ErrorResponse body = (ErrorResponse) response.getEntity();
        assertEquals("invalid_request", body.code());
        assertEquals("limit must be positive", body.details().get("message"));
    }

    @Test
    void unreachable_datastore_maps_to_503() {
        Response response = mapper.handleMongoException(new MongoTimeoutException("no server"));

        assertEquals(503, response.getStatus());
        assertEquals("storage_unavailable", ((ErrorResponse) response.getEntity()).code());
    }

    @Test
    void unreadable_stored_record_maps_to_500() {
        CorruptTrackerRecordException e =
                new CorruptTrackerRecordException(
                        "Stored tracker event cannot be decoded", new IllegalArgumentException());

        Response response = mapper.handleCorruptRecord(e);

        assertEquals(500, response.getStatus());
        assertEquals("corrupt_record", ((ErrorResponse) response.getEntity()).code());
    }

    @Test
    void other_datastore_errors_map_to_500() {
        Response response = mapper.handleMongoException(new MongoException(11000, "duplicate"));

        assertEquals(500, response.getStatus());
        assertEquals("storage_error", ((ErrorResponse) response.getEntity()).code());
    }

    @Test
    void web_application_exceptions_keep_their_response() {
        WebApplicationException e =
                new WebApplicationException("bad", Response.Status.BAD_REQUEST);

        assertSame(e.getResponse(), mapper.handleException(e));
        assertEquals(
                500, mapper.handleException(new IllegalStateException("boom")).getStatus());
    }
}
