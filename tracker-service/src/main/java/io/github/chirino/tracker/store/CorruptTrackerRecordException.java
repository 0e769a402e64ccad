package io.github.chirino.tracker.store;

/** A stored record can no longer be decoded into an event. */
public class CorruptTrackerRecordException extends RuntimeException {

    public CorruptTrackerRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
