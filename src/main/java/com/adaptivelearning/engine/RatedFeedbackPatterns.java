package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RatedFeedbackPatterns {
    long count;
    Double averageRating;
    /** Most frequent first. */
    List<String> commonThemes;
}
