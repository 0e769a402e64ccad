package io.github.chirino.tracker.api;

import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import io.github.chirino.tracker.api.dto.ErrorResponse;
import io.github.chirino.tracker.store.CorruptTrackerRecordException;
import io.github.chirino.tracker.store.TrackerNotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Renders store failures as structured JSON error responses. Unhandled exceptions are logged with
 * full stack traces.
 */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @ServerExceptionMapper
    public Response handleTrackerNotFound(TrackerNotFoundException e) {
        return error(
                Response.Status.NOT_FOUND,
                new ErrorResponse(
                        "Tracker not found", "not_found", Map.of("senderId", e.getSenderId())));
    }

    @ServerExceptionMapper
    public Response handleIllegalArgument(IllegalArgumentException e) {
        return error(
                Response.Status.BAD_REQUEST,
                new ErrorResponse(
                        "Invalid request", "invalid_request", Map.of("message", message(e))));
    }

    @ServerExceptionMapper
    public Response handleCorruptRecord(CorruptTrackerRecordException e) {
        LOG.errorf(e, "Tracker datastore holds an unreadable record");
        return error(
                Response.Status.INTERNAL_SERVER_ERROR,
                new ErrorResponse(
                        "Corrupt tracker record", "corrupt_record", Map.of("message", message(e))));
    }

    @ServerExceptionMapper
    public Response handleMongoException(MongoException e) {
        // no retry here, callers own their retry policy
        if (e instanceof MongoTimeoutException || e instanceof MongoSocketException) {
            LOG.warnf(e, "Tracker datastore unavailable");
            return error(
                    Response.Status.SERVICE_UNAVAILABLE,
                    new ErrorResponse(
                            "Datastore unavailable",
                            "storage_unavailable",
                            Map.of("message", message(e))));
        }
        LOG.errorf(e, "Tracker datastore error %d", e.getCode());
        return error(
                Response.Status.INTERNAL_SERVER_ERROR,
                new ErrorResponse(
                        "Datastore error", "storage_error", Map.of("message", message(e))));
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        // JAX-RS exceptions already carry the response the resource chose
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        LOG.errorf(e, "Unhandled exception");
        return error(
                Response.Status.INTERNAL_SERVER_ERROR,
                new ErrorResponse(
                        "Internal server error", "internal_error", Map.of("message", message(e))));
    }

    private static Response error(Response.Status status, ErrorResponse body) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }

    private static String message(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
