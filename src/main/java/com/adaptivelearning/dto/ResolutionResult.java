package com.adaptivelearning.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ResolutionResult {
    UUID forecastId;
    double predictedValue;
    double actualValue;
    Double accuracy;
    Double mape;
    double absoluteError;
    Double percentageError;
    Boolean withinConfidenceBounds;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant resolvedAt;
}
