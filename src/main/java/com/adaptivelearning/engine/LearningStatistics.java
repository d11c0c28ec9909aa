package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class LearningStatistics {
    long totalFeedback;
    Double averageRating;
    boolean learningEnabled;
    /** Keyed by domain wire name, in declaration order of {@link FeedbackDomain}. */
    Map<String, DomainLearningStats> byDomain;
}
