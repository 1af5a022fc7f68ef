package dev.jobhunter.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    STARTED("started"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    MATCH_SAVED("match-saved"),
    APPLY_QUERY("apply-query"),
    RELOAD("reload");

    private final String eventName;

    EventType(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String eventName() {
        return eventName;
    }
}
