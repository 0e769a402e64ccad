package io.github.chirino.tracker.store.impl;

import io.github.chirino.tracker.model.SessionWindow;
import io.github.chirino.tracker.model.TrackerEvent;
import io.github.chirino.tracker.mongo.EventQuery;
import io.github.chirino.tracker.mongo.TrackerDocuments;
import io.github.chirino.tracker.store.TrackerEventRepository;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

public class TrackerEventReader {

    private static final Logger LOG = Logger.getLogger(TrackerEventReader.class);

    private final TrackerEventRepository repository;

    public TrackerEventReader(TrackerEventRepository repository) {
        this.repository = repository;
    }

    /**
     * Reads the events of a sender inside {@code window}, oldest first.
     *
     * @return empty when nothing is stored in the window, never an empty list
     */
    public Optional<List<TrackerEvent>> read(String senderId, SessionWindow window) {
        Optional<List<TrackerEvent>> events =
                repository
                        .findEvents(EventQuery.events(senderId, window))
                        .map(
                                documents ->
                                        documents.stream()
                                                .map(TrackerDocuments::toEvent)
                                                .toList());
        if (LOG.isDebugEnabled()) {
            LOG.debugf(
                    "Read %s events of '%s' in %s",
                    events.map(List::size).map(String::valueOf).orElse("no"), senderId, window);
        }
        return events;
    }
}
