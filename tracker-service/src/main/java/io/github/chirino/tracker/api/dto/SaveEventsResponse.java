package io.github.chirino.tracker.api.dto;

public class SaveEventsResponse {

    private int appended;

    public SaveEventsResponse() {}

    public SaveEventsResponse(int appended) {
        this.appended = appended;
    }

    public int getAppended() {
        return appended;
    }

    public void setAppended(int appended) {
        this.appended = appended;
    }
}
