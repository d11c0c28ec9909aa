package com.adaptivelearning.exception;

import lombok.Getter;

/** Base for engine failures; {@code errorCode} is stable and safe to expose to callers. */
@Getter
public abstract class LearningEngineException extends RuntimeException {

    private final String errorCode;

    protected LearningEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
