package com.adaptivelearning.exception;

import java.util.UUID;

public class ForecastAlreadyResolvedException extends LearningEngineException {
    public ForecastAlreadyResolvedException(UUID id) {
        super("FORECAST_ALREADY_RESOLVED",
              "Actual value already provided for forecast '" + id + "'.");
    }
}
