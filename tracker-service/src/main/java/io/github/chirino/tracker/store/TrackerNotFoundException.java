package io.github.chirino.tracker.store;

public class TrackerNotFoundException extends RuntimeException {

    private final String senderId;

    public TrackerNotFoundException(String senderId) {
        super("tracker not found: " + senderId);
        this.senderId = senderId;
    }

    public String getSenderId() {
        return senderId;
    }
}
