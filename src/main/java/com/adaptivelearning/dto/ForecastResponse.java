package com.adaptivelearning.dto;

import com.adaptivelearning.entity.ForecastStatus;
import com.adaptivelearning.entity.ForecastType;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResponse {
    UUID forecastId;
    ForecastType forecastType;
    String domain;
    String chartTitle;
    ForecastStatus status;
    double predictedValue;
    Double predictedLower;
    Double predictedUpper;
    Double actualValue;
    Double accuracy;
    Double mape;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant forecastDate;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant targetDate;
    boolean reminderSent;
}
