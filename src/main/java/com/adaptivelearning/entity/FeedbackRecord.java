package com.adaptivelearning.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "feedback_records",
    indexes = {
        @Index(name = "idx_fb_date", columnList = "feedback_date"),
        @Index(name = "idx_fb_type", columnList = "feedback_type"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeedbackRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "feedback_date", nullable = false)
    private Instant date;

    @Column(nullable = false)
    private int rating;

    @Column(length = 4000)
    private String message;

    @Column(name = "chart_title")
    private String chartTitle;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "feedback_type", nullable = false, length = 30)
    private FeedbackType type = FeedbackType.USER_FEEDBACK;

    // Structured sub-metrics, all on a 0-5 scale.
    @Column(name = "ai_quality")
    private Double aiQuality;

    @Column(name = "chart_quality")
    private Integer chartQuality;

    @Column(name = "forecast_accuracy_rating")
    private Integer forecastAccuracyRating;

    @Column(name = "insights_helpfulness")
    private Integer insightsHelpfulness;

    @Column(name = "dataset_name")
    private String datasetName;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private Sentiment sentiment;

    @Column(name = "legacy_migrated")
    private boolean legacyMigrated;
}
