package com.adaptivelearning.engine;

import com.adaptivelearning.entity.Sentiment;

/**
 * How far a feedback record's sentiment disagrees with its star rating. Ratings
 * of 4-5 expect positive text, 1-2 negative and 3 neutral.
 */
public enum MismatchSeverity {
    NONE,
    MINOR,
    /** A 5-star rating with negative text, or a 1-star rating with positive text. */
    MAJOR;

    /** {@link #NONE} when the record has no sentiment label. */
    public static MismatchSeverity of(int rating, Sentiment sentiment) {
        if (sentiment == null || sentiment == expectedSentiment(rating)) {
            return NONE;
        }
        if ((rating == 5 && sentiment == Sentiment.NEGATIVE) || (rating == 1 && sentiment == Sentiment.POSITIVE)) {
            return MAJOR;
        }
        return MINOR;
    }

    static Sentiment expectedSentiment(int rating) {
        if (rating >= 4) {
            return Sentiment.POSITIVE;
        }
        return rating <= 2 ? Sentiment.NEGATIVE : Sentiment.NEUTRAL;
    }
}
