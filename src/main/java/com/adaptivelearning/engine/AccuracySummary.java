package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class AccuracySummary {
    long totalForecasts;
    long completedForecasts;
    long pendingForecasts;
    long expiredForecasts;
    Double averageAccuracy;
    /** Keyed by forecast type wire name, in declaration order of the type. */
    Map<String, TypeAccuracy> accuracyByType;
}
