package com.adaptivelearning.service;

import com.adaptivelearning.engine.FeedbackAccuracyAggregator;
import com.adaptivelearning.engine.FeedbackDomain;
import com.adaptivelearning.engine.FeedbackPatternAnalysis;
import com.adaptivelearning.engine.FeedbackPatternExtractor;
import com.adaptivelearning.engine.FeedbackSummary;
import com.adaptivelearning.engine.LearningStatistics;
import com.adaptivelearning.entity.FeedbackRecord;
import com.adaptivelearning.repository.FeedbackRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackInsightsService {

    private final FeedbackRecordRepository   repository;
    private final FeedbackAccuracyAggregator aggregator;
    private final FeedbackPatternExtractor   extractor;
    private final Clock                      clock;

    @Transactional(readOnly = true)
    public FeedbackSummary feedbackSummary(long registeredUsers) {
        List<FeedbackRecord> feedback = repository.findAll();
        FeedbackSummary summary = aggregator.feedbackSummary(feedback, registeredUsers, clock.instant());
        log.debug("Feedback summary | total={} | trend={} | recent={} | previous={}",
                  summary.getTotalFeedback(), summary.getTrend(),
                  summary.getRecentCount(), summary.getPreviousCount());
        return summary;
    }

    @Transactional(readOnly = true)
    public FeedbackPatternAnalysis patternAnalysis() {
        return patternAnalysis(null);
    }

    /** @param domain restricts the analysis to one domain; null analyses all feedback */
    @Transactional(readOnly = true)
    public FeedbackPatternAnalysis patternAnalysis(FeedbackDomain domain) {
        FeedbackPatternAnalysis analysis = aggregator.patternAnalysis(repository.findAll(), domain);
        if (!analysis.hasEnoughData()) {
            log.info("Insufficient feedback for pattern analysis | domain={} | found={} | required={}",
                     analysis.getDomain(), analysis.getFeedbackCount(), analysis.getMinRequired());
        }
        return analysis;
    }

    @Transactional(readOnly = true)
    public LearningStatistics learningStatistics() {
        LearningStatistics statistics = aggregator.learningStatistics(repository.findAll());
        log.info("Learning statistics | total={} | learningEnabled={}",
                 statistics.getTotalFeedback(), statistics.isLearningEnabled());
        return statistics;
    }

    /** Text to show for a record; records not yet migrated still carry their rating tags inline. */
    public String displayMessage(FeedbackRecord feedback) {
        if (feedback.isLegacyMigrated()) {
            return feedback.getMessage() != null ? feedback.getMessage().trim() : "";
        }
        return extractor.clean(feedback.getMessage());
    }
}
