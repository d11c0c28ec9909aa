package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReadinessStatus {
    ReadinessState state;
    long totalFeedback;
    long completedForecasts;
    int threshold;
}
