package com.adaptivelearning.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/** Label assigned to a feedback record by the external sentiment classifier. */
public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
