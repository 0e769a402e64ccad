package io.github.chirino.tracker.api;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

public enum TrackerScope {
    SESSION("session"),
    FULL("full");

    private final String queryValue;

    TrackerScope(String queryValue) {
        this.queryValue = queryValue;
    }

    public String getQueryValue() {
        return queryValue;
    }

    public static TrackerScope fromQuery(String value) {
        if (value == null || value.isBlank()) {
            return SESSION;
        }
        for (TrackerScope scope : values()) {
            if (scope.queryValue.equals(value)) {
                return scope;
            }
        }
        throw new WebApplicationException(
                "Invalid scope. Expected one of: session, full", Response.Status.BAD_REQUEST);
    }
}
