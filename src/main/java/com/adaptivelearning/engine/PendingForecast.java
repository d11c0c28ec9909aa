package com.adaptivelearning.engine;

import com.adaptivelearning.entity.ForecastType;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PendingForecast {
    UUID forecastId;
    ForecastType forecastType;
    String domain;
    String chartTitle;
    double predictedValue;
    Double predictedLower;
    Double predictedUpper;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant forecastDate;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant targetDate;
    long daysUntilTarget;
    long daysSinceForecast;
    Urgency urgency;
}
