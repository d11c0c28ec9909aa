package com.adaptivelearning.service;

import com.adaptivelearning.dto.ForecastHistoryResponse;
import com.adaptivelearning.dto.ForecastResponse;
import com.adaptivelearning.dto.ResolutionResult;
import com.adaptivelearning.engine.AccuracyCalculator;
import com.adaptivelearning.engine.AccuracySummary;
import com.adaptivelearning.engine.FeedbackAccuracyAggregator;
import com.adaptivelearning.engine.FeedbackPatternExtractor;
import com.adaptivelearning.engine.ForecastLifecycleTracker;
import com.adaptivelearning.engine.LearningThresholds;
import com.adaptivelearning.engine.PendingForecastView;
import com.adaptivelearning.engine.StoredSentimentClassifier;
import com.adaptivelearning.engine.Urgency;
import com.adaptivelearning.entity.ForecastRecord;
import com.adaptivelearning.entity.ForecastStatus;
import com.adaptivelearning.entity.ForecastType;
import com.adaptivelearning.exception.ForecastAlreadyResolvedException;
import com.adaptivelearning.exception.ForecastNotFoundException;
import com.adaptivelearning.exception.InvalidMeasurementException;
import com.adaptivelearning.repository.ForecastRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ForecastAccuracyServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @Mock ForecastRecordRepository repository;

    private ForecastAccuracyService service;

    @BeforeEach
    void setUp() {
        LearningThresholds thresholds = LearningThresholds.DEFAULTS;
        AccuracyCalculator calculator = new AccuracyCalculator();
        service = new ForecastAccuracyService(
            repository, calculator,
            new ForecastLifecycleTracker(thresholds),
            new FeedbackAccuracyAggregator(thresholds, calculator, new FeedbackPatternExtractor(),
                new StoredSentimentClassifier()),
            thresholds,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ForecastRecord pendingRecord(double predicted) {
        return ForecastRecord.builder().id(UUID.randomUUID())
            .forecastType(ForecastType.SALES).domain("sales").chartTitle("Sales Forecast")
            .predictedValue(predicted).predictedLower(predicted - 10).predictedUpper(predicted + 10)
            .forecastDate(NOW.minus(Duration.ofDays(30))).targetDate(NOW.minus(Duration.ofDays(1)))
            .build();
    }

    @Test
    void resolve_scoresAndPersistsCompletedRecord() {
        ForecastRecord record = pendingRecord(110.0);
        when(repository.findById(record.getId())).thenReturn(Optional.of(record));
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        ResolutionResult result = service.resolve(record.getId(), 100.0, "Promo ran a week late");

        assertThat(result.getAccuracy()).isCloseTo(90.0, within(1e-9));
        assertThat(result.getMape()).isCloseTo(10.0, within(1e-9));
        assertThat(result.getAbsoluteError()).isEqualTo(10.0);
        assertThat(result.getWithinConfidenceBounds()).isTrue();
        assertThat(result.getResolvedAt()).isEqualTo(NOW);

        assertThat(record.getStatus()).isEqualTo(ForecastStatus.COMPLETED);
        assertThat(record.getActualValue()).isEqualTo(100.0);
        assertThat(record.getAccuracy()).isEqualTo(result.getAccuracy());
        assertThat(record.getActualProvidedAt()).isEqualTo(NOW);
        assertThat(record.getNotes()).isEqualTo("Promo ran a week late");
        verify(repository).save(record);
    }

    @Test
    void resolve_zeroActual_completesWithNotApplicableScores() {
        ForecastRecord record = pendingRecord(20.0);
        when(repository.findById(record.getId())).thenReturn(Optional.of(record));
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        ResolutionResult result = service.resolve(record.getId(), 0.0);

        assertThat(result.getAccuracy()).isNull();
        assertThat(result.getMape()).isNull();
        assertThat(record.getStatus()).isEqualTo(ForecastStatus.COMPLETED);
        assertThat(record.getActualValue()).isZero();
    }

    @Test
    void resolve_alreadyCompleted_throwsAndLeavesScoresUnchanged() {
        ForecastRecord record = pendingRecord(110.0);
        record.setStatus(ForecastStatus.COMPLETED);
        record.setActualValue(100.0);
        record.setAccuracy(90.0);
        record.setMape(10.0);
        when(repository.findById(record.getId())).thenReturn(Optional.of(record));

        assertThatThrownBy(() -> service.resolve(record.getId(), 50.0))
            .isInstanceOf(ForecastAlreadyResolvedException.class)
            .hasMessageContaining(record.getId().toString())
            .extracting("errorCode").isEqualTo("FORECAST_ALREADY_RESOLVED");

        assertThat(record.getActualValue()).isEqualTo(100.0);
        assertThat(record.getAccuracy()).isEqualTo(90.0);
        assertThat(record.getMape()).isEqualTo(10.0);
        verify(repository, never()).save(any());
    }

    @Test
    void resolve_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resolve(id, 10.0))
            .isInstanceOf(ForecastNotFoundException.class)
            .hasMessageContaining(id.toString());
    }

    @Test
    void resolve_nonFiniteActual_surfacesInvalidMeasurementWithoutSaving() {
        ForecastRecord record = pendingRecord(110.0);
        when(repository.findById(record.getId())).thenReturn(Optional.of(record));

        assertThatThrownBy(() -> service.resolve(record.getId(), Double.NaN))
            .isInstanceOf(InvalidMeasurementException.class);

        assertThat(record.getStatus()).isEqualTo(ForecastStatus.PENDING);
        assertThat(record.getActualValue()).isNull();
        verify(repository, never()).save(any());
    }

    @Test
    void pendingForecasts_attachesUrgency() {
        ForecastRecord overdue = pendingRecord(10.0);
        when(repository.findByStatus(ForecastStatus.PENDING)).thenReturn(List.of(overdue));

        PendingForecastView view = service.pendingForecasts();

        assertThat(view.getForecasts()).singleElement()
            .satisfies(f -> {
                assertThat(f.getUrgency()).isEqualTo(Urgency.OVERDUE);
                assertThat(f.getDaysUntilTarget()).isEqualTo(-1);
            });
        assertThat(view.getOverdueCount()).isEqualTo(1);
    }

    @Test
    void accuracySummary_delegatesToAggregator() {
        ForecastRecord done = pendingRecord(110.0);
        done.setStatus(ForecastStatus.COMPLETED);
        done.setActualValue(100.0);
        done.setAccuracy(90.0);
        done.setMape(10.0);
        when(repository.findAll()).thenReturn(List.of(done, pendingRecord(5.0)));

        AccuracySummary summary = service.accuracySummary();

        assertThat(summary.getCompletedForecasts()).isEqualTo(1);
        assertThat(summary.getPendingForecasts()).isEqualTo(1);
        assertThat(summary.getAccuracyByType().get("sales").getAverageAccuracy()).isEqualTo(90.0);
    }

    @Test
    void history_reportsCompletedCountAndAverage() {
        ForecastRecord done = pendingRecord(110.0);
        done.setStatus(ForecastStatus.COMPLETED);
        done.setActualValue(100.0);
        done.setAccuracy(90.0);
        done.setMape(10.0);
        when(repository.findHistory(eq(ForecastType.SALES), isNull(), isNull(), any()))
            .thenReturn(List.of(done, pendingRecord(5.0)));

        ForecastHistoryResponse history = service.history(ForecastType.SALES, null, null, 50);

        assertThat(history.getCount()).isEqualTo(2);
        assertThat(history.getCompletedCount()).isEqualTo(1);
        assertThat(history.getAverageAccuracy()).isEqualTo(90.0);
        assertThat(history.getForecasts()).extracting(ForecastResponse::getStatus)
            .containsExactly(ForecastStatus.COMPLETED, ForecastStatus.PENDING);
    }

    @Test
    void remindersDue_usesConfiguredThresholdWhenNotGiven() {
        ForecastRecord soon = pendingRecord(1.0);
        soon.setTargetDate(NOW.plus(Duration.ofDays(20)));
        ForecastRecord far = pendingRecord(1.0);
        far.setTargetDate(NOW.plus(Duration.ofDays(40)));
        when(repository.findByStatus(ForecastStatus.PENDING)).thenReturn(List.of(far, soon));

        assertThat(service.remindersDue(null)).extracting(ForecastResponse::getForecastId)
            .containsExactly(soon.getId());
        assertThat(service.remindersDue(10)).isEmpty();
    }

    @Test
    void markReminderSent_updatesRecord() {
        ForecastRecord record = pendingRecord(1.0);
        when(repository.findById(record.getId())).thenReturn(Optional.of(record));
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        ForecastResponse response = service.markReminderSent(record.getId());

        assertThat(response.isReminderSent()).isTrue();
        assertThat(record.getReminderSentAt()).isEqualTo(NOW);
    }

    @Test
    void expireStaleForecasts_marksAndSavesOnlyStaleRecords() {
        ForecastRecord stale = pendingRecord(10.0);
        stale.setTargetDate(NOW.minus(Duration.ofDays(9)));
        ForecastRecord recent = pendingRecord(10.0);
        when(repository.findByStatus(ForecastStatus.PENDING)).thenReturn(List.of(stale, recent));

        int expired = service.expireStaleForecasts();

        assertThat(expired).isEqualTo(1);
        assertThat(stale.getStatus()).isEqualTo(ForecastStatus.EXPIRED);
        assertThat(recent.getStatus()).isEqualTo(ForecastStatus.PENDING);
        verify(repository).saveAll(List.of(stale));
    }

    @Test
    void expireStaleForecasts_nothingStale_savesNothing() {
        when(repository.findByStatus(ForecastStatus.PENDING)).thenReturn(List.of(pendingRecord(10.0)));

        assertThat(service.expireStaleForecasts()).isZero();
        verify(repository, never()).saveAll(any());
    }

    @Test
    void resolve_expiredForecast_canStillBeResolved() {
        ForecastRecord record = pendingRecord(100.0);
        record.setStatus(ForecastStatus.EXPIRED);
        when(repository.findById(record.getId())).thenReturn(Optional.of(record));
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        service.resolve(record.getId(), 100.0);

        assertThat(record.getStatus()).isEqualTo(ForecastStatus.COMPLETED);
        assertThat(record.getAccuracy()).isEqualTo(100.0);
    }
}
