package com.adaptivelearning.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Urgency {
    OVERDUE,
    URGENT,
    UPCOMING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
