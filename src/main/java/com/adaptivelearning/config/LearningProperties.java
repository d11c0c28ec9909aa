package com.adaptivelearning.config;

import com.adaptivelearning.engine.LearningThresholds;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "learning")
public class LearningProperties {

    @Min(value = 1, message = "learning.readiness-threshold must be >= 1")
    private int readinessThreshold = 10;

    @Min(value = 1, message = "learning.min-feedback-for-patterns must be >= 1")
    private int minFeedbackForPatterns = 10;

    @Min(value = 1, message = "learning.trend-window-days must be >= 1")
    private int trendWindowDays = 7;

    @Min(value = 0, message = "learning.urgency-window-days must be >= 0")
    private int urgencyWindowDays = 7;

    @Min(value = 0, message = "learning.reminder-days-threshold must be >= 0")
    private int reminderDaysThreshold = 30;

    @Min(value = 0, message = "learning.expiry-grace-days must be >= 0")
    private int expiryGraceDays = 7;

    @Min(value = 1, message = "learning.domain-min-feedback must be >= 1")
    private int domainMinFeedback = 5;

    public LearningThresholds toThresholds() {
        return LearningThresholds.builder()
            .readinessThreshold(readinessThreshold)
            .minFeedbackForPatterns(minFeedbackForPatterns)
            .trendWindowDays(trendWindowDays)
            .urgencyWindowDays(urgencyWindowDays)
            .reminderDaysThreshold(reminderDaysThreshold)
            .expiryGraceDays(expiryGraceDays)
            .domainMinFeedback(domainMinFeedback)
            .build();
    }
}
