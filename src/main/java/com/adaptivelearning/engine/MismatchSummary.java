package com.adaptivelearning.engine;

import lombok.Builder;
import lombok.Value;

/** Rating-vs-sentiment conflicts; {@code percentage} is over classified records. */
@Value
@Builder
public class MismatchSummary {
    long count;
    double percentage;
    long major;
    long minor;
}
