package com.adaptivelearning.service;

import com.adaptivelearning.engine.LearningReadinessEvaluator;
import com.adaptivelearning.engine.ReadinessStatus;
import com.adaptivelearning.entity.ForecastStatus;
import com.adaptivelearning.repository.FeedbackRecordRepository;
import com.adaptivelearning.repository.ForecastRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class LearningStatusService {

    private final FeedbackRecordRepository   feedbackRepository;
    private final ForecastRecordRepository   forecastRepository;
    private final LearningReadinessEvaluator evaluator;

    @Transactional(readOnly = true)
    public ReadinessStatus readiness() {
        long totalFeedback = feedbackRepository.count();
        long completedForecasts = forecastRepository.countByStatus(ForecastStatus.COMPLETED);
        ReadinessStatus status = evaluator.evaluate(totalFeedback, completedForecasts);
        log.info("Learning readiness | state={} | feedback={} | completedForecasts={}",
                 status.getState(), totalFeedback, completedForecasts);
        return status;
    }
}
