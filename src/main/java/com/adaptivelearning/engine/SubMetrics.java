package com.adaptivelearning.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/** Optional fine-grained ratings attached to a piece of feedback. Absent values stay null. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubMetrics {

    public static final SubMetrics EMPTY = SubMetrics.builder().build();

    Double aiQuality;
    Integer chartQuality;
    Integer forecastAccuracyRating;
    Integer insightsHelpfulness;
    String datasetName;

    public boolean hasAnyRating() {
        return aiQuality != null || chartQuality != null
            || forecastAccuracyRating != null || insightsHelpfulness != null;
    }
}
