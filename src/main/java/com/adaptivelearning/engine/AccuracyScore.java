package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Error metrics of a single resolved forecast. {@code mape}, {@code accuracy}
 * and {@code percentageError} are null when the actual value is zero.
 */
@Value
@Builder
public class AccuracyScore {
    double absoluteError;
    Double percentageError;
    Double mape;
    Double accuracy;
    Boolean withinConfidenceBounds;

    public boolean isApplicable() {
        return accuracy != null;
    }
}
