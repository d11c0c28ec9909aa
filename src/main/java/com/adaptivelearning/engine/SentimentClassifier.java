package com.adaptivelearning.engine;

import com.adaptivelearning.entity.FeedbackRecord;
import com.adaptivelearning.entity.Sentiment;

/**
 * Source of the sentiment label of a feedback record. Implementations may
 * return {@code null} when a record has not been classified.
 */
@FunctionalInterface
public interface SentimentClassifier {

    Sentiment classify(FeedbackRecord feedback);
}
