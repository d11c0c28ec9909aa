package com.adaptivelearning.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisStatus {
    /** Not enough feedback yet; statistics are withheld. */
    COLLECTING,
    READY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
