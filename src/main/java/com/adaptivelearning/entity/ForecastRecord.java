package com.adaptivelearning.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "forecast_records",
    indexes = {
        @Index(name = "idx_fc_status",        columnList = "status"),
        @Index(name = "idx_fc_type_domain",   columnList = "forecast_type, domain"),
        @Index(name = "idx_fc_target_status", columnList = "target_date, status"),
        @Index(name = "idx_fc_created",       columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ForecastRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "forecast_type", nullable = false, length = 20)
    private ForecastType forecastType;

    @Column(nullable = false, length = 50)
    private String domain;

    @Column(name = "chart_id", length = 100)
    private String chartId;

    @Column(name = "chart_title")
    private String chartTitle;

    @Column(name = "forecast_date", nullable = false)
    private Instant forecastDate;

    @Column(name = "target_date", nullable = false)
    private Instant targetDate;

    @Builder.Default
    @Column(name = "forecast_period_days")
    private int forecastPeriodDays = 30;

    @Column(name = "predicted_value", nullable = false)
    private double predictedValue;

    @Column(name = "predicted_lower")
    private Double predictedLower;

    @Column(name = "predicted_upper")
    private Double predictedUpper;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ForecastStatus status = ForecastStatus.PENDING;

    @Column(name = "actual_value")
    private Double actualValue;

    @Column(name = "actual_provided_at")
    private Instant actualProvidedAt;

    private Double accuracy;

    private Double mape;

    @Column(name = "absolute_error")
    private Double absoluteError;

    @Column(name = "percentage_error")
    private Double percentageError;

    @Column(name = "within_confidence_bounds")
    private Boolean withinConfidenceBounds;

    @Column(length = 500)
    private String notes;

    @Column(name = "reminder_sent")
    private boolean reminderSent;

    @Column(name = "reminder_sent_at")
    private Instant reminderSentAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    public boolean isCompleted() {
        return status == ForecastStatus.COMPLETED;
    }
}
