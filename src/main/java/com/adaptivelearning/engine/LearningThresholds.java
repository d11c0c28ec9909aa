package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Policy thresholds shared by the engine components. Defaults match the
 * values the dashboards were built against.
 */
@Value
@Builder
public class LearningThresholds {

    public static final LearningThresholds DEFAULTS = LearningThresholds.builder().build();

    /** Count each of feedback and completed forecasts must reach for learning to be active. */
    @Builder.Default
    int readinessThreshold = 10;

    /** Feedback count below which pattern and sentiment analysis report {@code collecting}. */
    @Builder.Default
    int minFeedbackForPatterns = 10;

    /** Length of each period in the period-over-period trend. */
    @Builder.Default
    int trendWindowDays = 7;

    /** Upper bound (inclusive) of the {@code urgent} band, in days until target. */
    @Builder.Default
    int urgencyWindowDays = 7;

    /** Look-ahead used when selecting pending forecasts that need a reminder. */
    @Builder.Default
    int reminderDaysThreshold = 30;

    /** Days past the target date after which a pending forecast is marked expired. */
    @Builder.Default
    int expiryGraceDays = 7;

    /** Feedback count a single domain needs before its statistics are reported. */
    @Builder.Default
    int domainMinFeedback = 5;
}
