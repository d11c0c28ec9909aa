package com.adaptivelearning.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DomainLearningStats {
    long feedbackCount;
    boolean hasLearningData;
    Double averageRating;
    Double positiveFeedbackPercentage;
}
