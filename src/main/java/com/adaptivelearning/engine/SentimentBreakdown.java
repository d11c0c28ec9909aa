package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

/** Percentages are taken over classified records only. */
@Value
@Builder
public class SentimentBreakdown {
    long positive;
    long neutral;
    long negative;
    long unclassified;
    double positivePercentage;
    double neutralPercentage;
    double negativePercentage;
}
