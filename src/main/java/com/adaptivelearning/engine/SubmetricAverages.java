package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

/** Means of each sub-metric over the records that supplied it; null where none did. */
@Value
@Builder
public class SubmetricAverages {
    Double aiQuality;
    Double chartQuality;
    Double forecastAccuracyRating;
    Double insightsHelpfulness;
    long sampleCount;
}
