package com.adaptivelearning.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReadinessState {
    COLLECTING_DATA("CollectingData"),
    PARTIALLY_ACTIVE("PartiallyActive"),
    FULLY_ACTIVE("FullyActive");

    private final String wireName;

    ReadinessState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
