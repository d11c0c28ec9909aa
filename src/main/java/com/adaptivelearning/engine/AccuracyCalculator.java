package com.adaptivelearning.engine;

import com.adaptivelearning.exception.InvalidMeasurementException;

/**
 * Scores a prediction against the value that actually occurred.
 *
 * <p>MAPE is undefined for an actual value of zero; in that case MAPE and
 * accuracy are reported as {@code null} rather than a number, so callers can
 * leave the record out of averages instead of counting it as 0% accurate.
 */
public class AccuracyCalculator {

    public AccuracyScore score(Double predicted, Double actual) {
        return score(predicted, actual, null, null);
    }

    /**
     * @param lower optional lower confidence bound
     * @param upper optional upper confidence bound
     * @throws InvalidMeasurementException if {@code predicted} or {@code actual} is missing or not finite
     */
    public AccuracyScore score(Double predicted, Double actual, Double lower, Double upper) {
        requireFinite("predictedValue", predicted);
        requireFinite("actualValue", actual);

        double absoluteError = Math.abs(actual - predicted);
        Double percentageError = null;
        Double mape = null;
        Double accuracy = null;
        if (actual != 0.0d) {
            percentageError = (predicted - actual) / actual * 100.0;
            mape = absoluteError / Math.abs(actual) * 100.0;
            accuracy = Math.max(0.0, 100.0 - mape);
        }

        Boolean withinBounds = null;
        if (isFinite(lower) && isFinite(upper)) {
            withinBounds = actual >= lower && actual <= upper;
        }

        return AccuracyScore.builder()
            .absoluteError(absoluteError)
            .percentageError(percentageError)
            .mape(mape)
            .accuracy(accuracy)
            .withinConfidenceBounds(withinBounds)
            .build();
    }

    static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }

    private static void requireFinite(String field, Double value) {
        if (!isFinite(value)) {
            throw new InvalidMeasurementException(field, value);
        }
    }
}
