package com.adaptivelearning.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FeedbackType {
    USER_FEEDBACK,
    AI_ANALYTICS,
    BUG_REPORT,
    FEATURE_REQUEST;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
