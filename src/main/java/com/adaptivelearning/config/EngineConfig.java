package com.adaptivelearning.config;

import com.adaptivelearning.engine.AccuracyCalculator;
import com.adaptivelearning.engine.FeedbackAccuracyAggregator;
import com.adaptivelearning.engine.FeedbackPatternExtractor;
import com.adaptivelearning.engine.ForecastLifecycleTracker;
import com.adaptivelearning.engine.LearningReadinessEvaluator;
import com.adaptivelearning.engine.LearningThresholds;
import com.adaptivelearning.engine.SentimentClassifier;
import com.adaptivelearning.engine.StoredSentimentClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(LearningProperties.class)
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LearningThresholds learningThresholds(LearningProperties properties) {
        LearningThresholds thresholds = properties.toThresholds();
        log.info("Learning thresholds | readiness={} | minFeedback={} | trendWindowDays={} | urgencyWindowDays={}",
                 thresholds.getReadinessThreshold(), thresholds.getMinFeedbackForPatterns(),
                 thresholds.getTrendWindowDays(), thresholds.getUrgencyWindowDays());
        return thresholds;
    }

    @Bean
    public AccuracyCalculator accuracyCalculator() {
        return new AccuracyCalculator();
    }

    @Bean
    public ForecastLifecycleTracker forecastLifecycleTracker(LearningThresholds thresholds) {
        return new ForecastLifecycleTracker(thresholds);
    }

    @Bean
    public FeedbackPatternExtractor feedbackPatternExtractor() {
        return new FeedbackPatternExtractor();
    }

    @Bean
    @ConditionalOnMissingBean
    public SentimentClassifier sentimentClassifier() {
        return new StoredSentimentClassifier();
    }

    @Bean
    public FeedbackAccuracyAggregator feedbackAccuracyAggregator(LearningThresholds thresholds,
                                                                 AccuracyCalculator calculator,
                                                                 FeedbackPatternExtractor extractor,
                                                                 SentimentClassifier sentimentClassifier) {
        return new FeedbackAccuracyAggregator(thresholds, calculator, extractor, sentimentClassifier);
    }

    @Bean
    public LearningReadinessEvaluator learningReadinessEvaluator(LearningThresholds thresholds) {
        return new LearningReadinessEvaluator(thresholds);
    }
}
