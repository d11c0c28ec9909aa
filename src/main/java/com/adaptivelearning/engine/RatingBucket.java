package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RatingBucket {
    int rating;
    long count;
    double percentage;
}
