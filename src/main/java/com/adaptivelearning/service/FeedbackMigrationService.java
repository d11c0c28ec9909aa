package com.adaptivelearning.service;

import com.adaptivelearning.dto.MigrationReport;
import com.adaptivelearning.engine.ExtractedFeedback;
import com.adaptivelearning.engine.FeedbackPatternExtractor;
import com.adaptivelearning.engine.SubMetrics;
import com.adaptivelearning.entity.FeedbackRecord;
import com.adaptivelearning.repository.FeedbackRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;

/**
 * Moves the bracketed sub-rating tags of legacy feedback into the structured
 * fields and strips them from the message. Fields that already hold a value
 * are left alone, and each record is migrated at most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackMigrationService {

    private final FeedbackRecordRepository repository;
    private final FeedbackPatternExtractor extractor;

    @Transactional
    public MigrationReport migrateLegacyFeedback() {
        List<FeedbackRecord> pending = repository.findByLegacyMigratedFalse();
        long withSubMetrics = 0;
        long changed = 0;

        for (FeedbackRecord record : pending) {
            ExtractedFeedback extracted = extractor.extract(record.getMessage());
            SubMetrics parsed = extracted.getSubMetrics();
            if (parsed.hasAnyRating()) {
                withSubMetrics++;
            }
            if (apply(record, parsed, extracted.getCleanMessage())) {
                changed++;
            }
            record.setLegacyMigrated(true);
        }
        repository.saveAll(pending);

        log.info("Legacy feedback migrated | scanned={} | changed={} | withSubMetrics={}",
                 pending.size(), changed, withSubMetrics);
        return MigrationReport.builder()
            .scanned(pending.size())
            .migrated(changed)
            .withSubMetrics(withSubMetrics)
            .build();
    }

    private boolean apply(FeedbackRecord record, SubMetrics parsed, String cleanMessage) {
        boolean changed = false;
        if (record.getAiQuality() == null && parsed.getAiQuality() != null) {
            record.setAiQuality(parsed.getAiQuality());
            changed = true;
        }
        if (record.getChartQuality() == null && parsed.getChartQuality() != null) {
            record.setChartQuality(parsed.getChartQuality());
            changed = true;
        }
        if (record.getForecastAccuracyRating() == null && parsed.getForecastAccuracyRating() != null) {
            record.setForecastAccuracyRating(parsed.getForecastAccuracyRating());
            changed = true;
        }
        if (record.getInsightsHelpfulness() == null && parsed.getInsightsHelpfulness() != null) {
            record.setInsightsHelpfulness(parsed.getInsightsHelpfulness());
            changed = true;
        }
        if (record.getDatasetName() == null && parsed.getDatasetName() != null) {
            record.setDatasetName(parsed.getDatasetName());
            changed = true;
        }
        if (record.getMessage() != null && !Objects.equals(record.getMessage().trim(), cleanMessage)) {
            record.setMessage(cleanMessage);
            changed = true;
        }
        return changed;
    }
}
