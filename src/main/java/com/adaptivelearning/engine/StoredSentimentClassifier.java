package com.adaptivelearning.engine;

import com.adaptivelearning.entity.FeedbackRecord;
import com.adaptivelearning.entity.Sentiment;

/** Uses the label the external classifier already wrote onto the record. */
public class StoredSentimentClassifier implements SentimentClassifier {

    @Override
    public Sentiment classify(FeedbackRecord feedback) {
        return feedback.getSentiment();
    }
}
