package com.adaptivelearning.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastStatus {
    PENDING,
    COMPLETED,
    /** Still unresolved a grace period after its target date; can be resolved late. */
    EXPIRED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
