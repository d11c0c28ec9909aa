package com.adaptivelearning.service;

import com.adaptivelearning.dto.ForecastHistoryResponse;
import com.adaptivelearning.dto.ForecastResponse;
import com.adaptivelearning.dto.ResolutionResult;
import com.adaptivelearning.engine.AccuracyCalculator;
import com.adaptivelearning.engine.AccuracyScore;
import com.adaptivelearning.engine.AccuracySummary;
import com.adaptivelearning.engine.FeedbackAccuracyAggregator;
import com.adaptivelearning.engine.ForecastLifecycleTracker;
import com.adaptivelearning.engine.LearningThresholds;
import com.adaptivelearning.engine.PendingForecastView;
import com.adaptivelearning.entity.ForecastRecord;
import com.adaptivelearning.entity.ForecastStatus;
import com.adaptivelearning.entity.ForecastType;
import com.adaptivelearning.exception.ForecastAlreadyResolvedException;
import com.adaptivelearning.exception.ForecastNotFoundException;
import com.adaptivelearning.repository.ForecastRecordRepository;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class ForecastAccuracyService {

    private final ForecastRecordRepository   repository;
    private final AccuracyCalculator         calculator;
    private final ForecastLifecycleTracker   tracker;
    private final FeedbackAccuracyAggregator aggregator;
    private final LearningThresholds         thresholds;
    private final Clock                      clock;

    @Transactional
    public ResolutionResult resolve(UUID forecastId, double actualValue) {
        return resolve(forecastId, actualValue, null);
    }

    /**
     * Attaches the observed value to a pending forecast and scores it. A
     * forecast can be resolved once; the stored scores are never rewritten.
     */
    @Transactional
    public ResolutionResult resolve(UUID forecastId, double actualValue, @Size(max = 500) String notes) {
        ForecastRecord record = repository.findById(forecastId)
            .orElseThrow(() -> new ForecastNotFoundException(forecastId));
        if (record.isCompleted()) {
            log.warn("Rejected second resolution | id={} | storedActual={}", forecastId, record.getActualValue());
            throw new ForecastAlreadyResolvedException(forecastId);
        }

        AccuracyScore score = calculator.score(record.getPredictedValue(), actualValue,
            record.getPredictedLower(), record.getPredictedUpper());
        Instant now = clock.instant();

        record.setActualValue(actualValue);
        record.setActualProvidedAt(now);
        record.setAbsoluteError(score.getAbsoluteError());
        record.setPercentageError(score.getPercentageError());
        record.setMape(score.getMape());
        record.setAccuracy(score.getAccuracy());
        record.setWithinConfidenceBounds(score.getWithinConfidenceBounds());
        if (notes != null && !notes.isBlank()) {
            record.setNotes(notes);
        }
        record.setStatus(ForecastStatus.COMPLETED);
        ForecastRecord saved = repository.save(record);

        log.info("Actual value recorded | id={} | predicted={} | actual={} | accuracy={} | mape={}",
                 forecastId, saved.getPredictedValue(), actualValue, score.getAccuracy(), score.getMape());

        return ResolutionResult.builder()
            .forecastId(saved.getId())
            .predictedValue(saved.getPredictedValue())
            .actualValue(actualValue)
            .accuracy(score.getAccuracy())
            .mape(score.getMape())
            .absoluteError(score.getAbsoluteError())
            .percentageError(score.getPercentageError())
            .withinConfidenceBounds(score.getWithinConfidenceBounds())
            .resolvedAt(now)
            .build();
    }

    @Transactional(readOnly = true)
    public PendingForecastView pendingForecasts() {
        return tracker.pendingView(repository.findByStatus(ForecastStatus.PENDING), clock.instant());
    }

    @Transactional(readOnly = true)
    public AccuracySummary accuracySummary() {
        return aggregator.accuracySummary(repository.findAll());
    }

    @Transactional(readOnly = true)
    public ForecastHistoryResponse history(ForecastType forecastType, String domain, ForecastStatus status,
                                           @Min(1) @Max(500) int limit) {
        List<ForecastRecord> records = repository.findHistory(
            forecastType, domain, status, PageRequest.of(0, limit));
        long completed = records.stream().filter(ForecastRecord::isCompleted).count();

        return ForecastHistoryResponse.builder()
            .count(records.size())
            .completedCount(completed)
            .averageAccuracy(aggregator.averageAccuracy(records))
            .forecasts(records.stream().map(this::toResponse).toList())
            .build();
    }

    /** Pending forecasts due within {@code daysThreshold} days (configured default when null) not yet reminded. */
    @Transactional(readOnly = true)
    public List<ForecastResponse> remindersDue(Integer daysThreshold) {
        int days = daysThreshold != null && daysThreshold >= 0
            ? daysThreshold : thresholds.getReminderDaysThreshold();
        return tracker.dueForReminder(repository.findByStatus(ForecastStatus.PENDING), clock.instant(), days)
            .stream()
            .map(this::toResponse)
            .toList();
    }

    @Transactional
    public ForecastResponse markReminderSent(UUID forecastId) {
        ForecastRecord record = repository.findById(forecastId)
            .orElseThrow(() -> new ForecastNotFoundException(forecastId));
        record.setReminderSent(true);
        record.setReminderSentAt(clock.instant());
        ForecastRecord saved = repository.save(record);
        log.info("Reminder marked as sent | id={}", forecastId);
        return toResponse(saved);
    }

    /** Marks pending forecasts left unresolved past the grace period as expired; returns how many. */
    @Transactional
    public int expireStaleForecasts() {
        List<ForecastRecord> stale = tracker.dueForExpiry(
            repository.findByStatus(ForecastStatus.PENDING), clock.instant());
        if (stale.isEmpty()) {
            return 0;
        }
        stale.forEach(r -> r.setStatus(ForecastStatus.EXPIRED));
        repository.saveAll(stale);
        log.info("Stale forecasts expired | count={} | graceDays={}", stale.size(), thresholds.getExpiryGraceDays());
        return stale.size();
    }

    private ForecastResponse toResponse(ForecastRecord r) {
        return ForecastResponse.builder()
            .forecastId(r.getId()).forecastType(r.getForecastType()).domain(r.getDomain())
            .chartTitle(r.getChartTitle()).status(r.getStatus())
            .predictedValue(r.getPredictedValue())
            .predictedLower(r.getPredictedLower()).predictedUpper(r.getPredictedUpper())
            .actualValue(r.getActualValue()).accuracy(r.getAccuracy()).mape(r.getMape())
            .forecastDate(r.getForecastDate()).targetDate(r.getTargetDate())
            .reminderSent(r.isReminderSent())
            .build();
    }
}
