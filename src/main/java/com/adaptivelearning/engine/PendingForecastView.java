package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PendingForecastView {
    List<PendingForecast> forecasts;
    long overdueCount;
    long urgentCount;
    long upcomingCount;
}
