package com.adaptivelearning.engine;

import java.util.Objects;

/**
 * Classifies how far the learning loop has matured from two counts. Nothing
 * is remembered between calls: the state always reflects the counts passed
 * in, so it drops back if the counts do.
 */
public class LearningReadinessEvaluator {

    private final LearningThresholds thresholds;

    public LearningReadinessEvaluator(LearningThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public ReadinessStatus evaluate(long totalFeedback, long completedForecasts) {
        int threshold = thresholds.getReadinessThreshold();
        boolean enoughFeedback = totalFeedback >= threshold;
        boolean enoughForecasts = completedForecasts >= threshold;

        ReadinessState state;
        if (enoughFeedback && enoughForecasts) {
            state = ReadinessState.FULLY_ACTIVE;
        } else if (enoughFeedback || enoughForecasts) {
            state = ReadinessState.PARTIALLY_ACTIVE;
        } else {
            state = ReadinessState.COLLECTING_DATA;
        }

        return ReadinessStatus.builder()
            .state(state)
            .totalFeedback(totalFeedback)
            .completedForecasts(completedForecasts)
            .threshold(threshold)
            .build();
    }
}
