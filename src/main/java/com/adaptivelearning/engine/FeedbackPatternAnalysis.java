package com.adaptivelearning.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedbackPatternAnalysis {
    AnalysisStatus status;
    /** Domain wire name, or {@code all}. */
    String domain;
    long feedbackCount;
    int minRequired;
    List<RatingBucket> ratingDistribution;
    SentimentBreakdown sentiment;
    Double averageRating;
    Double positiveFeedbackPercentage;
    RatedFeedbackPatterns highRated;
    RatedFeedbackPatterns lowRated;
    MismatchSummary mismatches;

    public boolean hasEnoughData() {
        return status == AnalysisStatus.READY;
    }
}
