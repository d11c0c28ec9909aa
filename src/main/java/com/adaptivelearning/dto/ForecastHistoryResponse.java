package com.adaptivelearning.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ForecastHistoryResponse {
    long count;
    long completedCount;
    Double averageAccuracy;
    List<ForecastResponse> forecasts;
}
