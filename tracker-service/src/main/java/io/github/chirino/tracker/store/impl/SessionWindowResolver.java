package io.github.chirino.tracker.store.impl;

import io.github.chirino.tracker.model.SessionWindow;
import io.github.chirino.tracker.model.TrackerEvent;
import io.github.chirino.tracker.mongo.EventQuery;
import io.github.chirino.tracker.store.TrackerEventRepository;
import java.util.List;
import org.bson.Document;
import org.jboss.logging.Logger;

public class SessionWindowResolver {

    private static final Logger LOG = Logger.getLogger(SessionWindowResolver.class);

    private final TrackerEventRepository repository;

    public SessionWindowResolver(TrackerEventRepository repository) {
        this.repository = repository;
    }

    /**
     * Computes the window a read should cover. The current session starts at the latest {@code
     * session_started} event; when several share that timestamp any of them may be picked.
     */
    public SessionWindow resolve(String senderId, boolean currentSessionOnly) {
        if (!currentSessionOnly) {
            return SessionWindow.unbounded();
        }
        Double start =
                repository
                        .findEvents(
                                EventQuery.latestOfType(senderId, TrackerEvent.SESSION_STARTED))
                        .map(SessionWindowResolver::timestampOf)
                        .orElse(null);
        LOG.debugf("Current session of '%s' starts at %s", senderId, start);
        return SessionWindow.currentSession(start);
    }

    private static Double timestampOf(List<Document> latest) {
        Object timestamp = latest.get(0).get(TrackerEvent.TIMESTAMP_FIELD);
        return timestamp instanceof Number number ? number.doubleValue() : null;
    }
}
