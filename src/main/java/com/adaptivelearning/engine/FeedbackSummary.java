package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FeedbackSummary {
    long totalFeedback;
    Double averageRating;
    double responseRate;
    double trend;
    long recentCount;
    long previousCount;
    List<RatingBucket> ratingDistribution;
    SubmetricAverages aiSubmetricAverages;
}
