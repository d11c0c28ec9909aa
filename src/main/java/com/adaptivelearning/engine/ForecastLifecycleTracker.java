package com.adaptivelearning.engine;

import com.adaptivelearning.entity.ForecastRecord;
import com.adaptivelearning.entity.ForecastStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Derives display-only timing fields for forecasts that are still waiting
 * for their actual value. Never changes a record's status.
 */
@Slf4j
public class ForecastLifecycleTracker {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    /** Most recently created first, ties broken by id. */
    static final Comparator<ForecastRecord> PENDING_ORDER =
        Comparator.comparing(ForecastRecord::getForecastDate,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(ForecastRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    static final Comparator<ForecastRecord> TARGET_ORDER =
        Comparator.comparing(ForecastRecord::getTargetDate)
            .thenComparing(ForecastRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final LearningThresholds thresholds;

    public ForecastLifecycleTracker(LearningThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /** Whole days from {@code now} to {@code targetDate}, rounded down; negative once the target has passed. */
    public long daysUntilTarget(Instant targetDate, Instant now) {
        return floorDays(Duration.between(now, targetDate));
    }

    public long daysSinceForecast(Instant forecastDate, Instant now) {
        return floorDays(Duration.between(forecastDate, now));
    }

    public Urgency classify(long daysUntilTarget) {
        if (daysUntilTarget < 0) {
            return Urgency.OVERDUE;
        }
        return daysUntilTarget <= thresholds.getUrgencyWindowDays() ? Urgency.URGENT : Urgency.UPCOMING;
    }

    public Urgency classify(Instant targetDate, Instant now) {
        return classify(daysUntilTarget(targetDate, now));
    }

    public PendingForecastView pendingView(Collection<ForecastRecord> records, Instant now) {
        List<PendingForecast> forecasts = records.stream()
            .filter(r -> r.getStatus() == ForecastStatus.PENDING)
            .filter(this::hasTimeline)
            .sorted(PENDING_ORDER)
            .map(r -> toPending(r, now))
            .toList();

        return PendingForecastView.builder()
            .forecasts(forecasts)
            .overdueCount(count(forecasts, Urgency.OVERDUE))
            .urgentCount(count(forecasts, Urgency.URGENT))
            .upcomingCount(count(forecasts, Urgency.UPCOMING))
            .build();
    }

    /**
     * Pending forecasts whose target falls within {@code daysThreshold} days of
     * {@code now} (overdue ones included) and that have not been reminded yet,
     * earliest target first.
     */
    public List<ForecastRecord> dueForReminder(Collection<ForecastRecord> records, Instant now, int daysThreshold) {
        Instant horizon = now.plus(Duration.ofDays(daysThreshold));
        return records.stream()
            .filter(r -> r.getStatus() == ForecastStatus.PENDING)
            .filter(r -> !r.isReminderSent())
            .filter(r -> r.getTargetDate() != null && !r.getTargetDate().isAfter(horizon))
            .sorted(TARGET_ORDER)
            .toList();
    }

    /**
     * Pending forecasts whose target passed more than the configured grace
     * period before {@code now}. Selection only; the caller changes the status.
     */
    public List<ForecastRecord> dueForExpiry(Collection<ForecastRecord> records, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(thresholds.getExpiryGraceDays()));
        return records.stream()
            .filter(r -> r.getStatus() == ForecastStatus.PENDING)
            .filter(r -> r.getTargetDate() != null && r.getTargetDate().isBefore(cutoff))
            .sorted(TARGET_ORDER)
            .toList();
    }

    private PendingForecast toPending(ForecastRecord r, Instant now) {
        long days = daysUntilTarget(r.getTargetDate(), now);
        return PendingForecast.builder()
            .forecastId(r.getId())
            .forecastType(r.getForecastType())
            .domain(r.getDomain())
            .chartTitle(r.getChartTitle())
            .predictedValue(r.getPredictedValue())
            .predictedLower(r.getPredictedLower())
            .predictedUpper(r.getPredictedUpper())
            .forecastDate(r.getForecastDate())
            .targetDate(r.getTargetDate())
            .daysUntilTarget(days)
            .daysSinceForecast(daysSinceForecast(r.getForecastDate(), now))
            .urgency(classify(days))
            .build();
    }

    private boolean hasTimeline(ForecastRecord r) {
        if (r.getTargetDate() == null || r.getForecastDate() == null) {
            log.warn("Skipping pending forecast without dates | id={}", r.getId());
            return false;
        }
        return true;
    }

    private static long count(List<PendingForecast> forecasts, Urgency urgency) {
        return forecasts.stream().filter(f -> f.getUrgency() == urgency).count();
    }

    private static long floorDays(Duration duration) {
        return Math.floorDiv(duration.toMillis(), MILLIS_PER_DAY);
    }
}
