package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExtractedFeedback {
    SubMetrics subMetrics;
    String cleanMessage;
}
