package com.adaptivelearning.exception;

import java.util.UUID;

public class ForecastNotFoundException extends LearningEngineException {
    public ForecastNotFoundException(UUID id) {
        super("FORECAST_NOT_FOUND", "Forecast with id '" + id + "' not found.");
    }
}
