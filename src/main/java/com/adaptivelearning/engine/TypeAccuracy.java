package com.adaptivelearning.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TypeAccuracy {
    Double averageAccuracy;
    @JsonProperty("averageMAPE")
    Double averageMape;
    long count;
}
