package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrendSnapshot {
    long recentCount;
    long previousCount;
    double trend;
}
