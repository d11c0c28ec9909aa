package com.adaptivelearning.exception;

public class InvalidMeasurementException extends LearningEngineException {
    public InvalidMeasurementException(String field, Double value) {
        super("INVALID_MEASUREMENT",
              "Measurement '" + field + "' must be a finite number but was " + value + ".");
    }
}
