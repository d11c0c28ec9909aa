package com.adaptivelearning.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MigrationReport {
    long scanned;
    long migrated;
    long withSubMetrics;
}
