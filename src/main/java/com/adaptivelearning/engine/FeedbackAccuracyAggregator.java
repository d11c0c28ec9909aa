package com.adaptivelearning.engine;

import com.adaptivelearning.entity.FeedbackRecord;
import com.adaptivelearning.entity.ForecastRecord;
import com.adaptivelearning.entity.ForecastStatus;
import com.adaptivelearning.entity.ForecastType;
import com.adaptivelearning.entity.Sentiment;
import com.adaptivelearning.exception.InvalidMeasurementException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.IntStream;

/**
 * Rolls forecast and feedback records up into dashboard statistics.
 *
 * <p>Every method is a pure function of its arguments: the reference instant
 * is always passed in, and sums are taken over sorted values so the result
 * does not depend on the order of the input collection. Values that are
 * undefined (no samples, actual value of zero) are reported as {@code null}
 * and left out of averages.
 */
@Slf4j
public class FeedbackAccuracyAggregator {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;
    private static final int POSITIVE_RATING = 4;
    private static final int NEGATIVE_RATING = 2;
    private static final String ALL_DOMAINS = "all";

    private final LearningThresholds thresholds;
    private final AccuracyCalculator calculator;
    private final FeedbackPatternExtractor extractor;
    private final SentimentClassifier sentimentClassifier;

    public FeedbackAccuracyAggregator(LearningThresholds thresholds,
                                      AccuracyCalculator calculator,
                                      FeedbackPatternExtractor extractor,
                                      SentimentClassifier sentimentClassifier) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sentimentClassifier = Objects.requireNonNull(sentimentClassifier, "sentimentClassifier");
    }


    public AccuracySummary accuracySummary(Collection<ForecastRecord> forecasts) {
        List<ForecastRecord> completed = forecasts.stream()
            .filter(ForecastRecord::isCompleted)
            .toList();
        long pending = countStatus(forecasts, ForecastStatus.PENDING);
        long expired = countStatus(forecasts, ForecastStatus.EXPIRED);

        Map<String, TypeAccuracy> byType = new LinkedHashMap<>();
        for (ForecastType type : ForecastType.values()) {
            List<ForecastRecord> group = completed.stream()
                .filter(f -> f.getForecastType() == type)
                .toList();
            if (group.isEmpty()) {
                continue;
            }
            List<AccuracyScore> scores = scores(group);
            byType.put(type.wireName(), TypeAccuracy.builder()
                .averageAccuracy(mean(values(scores, AccuracyScore::getAccuracy)))
                .averageMape(mean(values(scores, AccuracyScore::getMape)))
                .count(group.size())
                .build());
        }

        return AccuracySummary.builder()
            .totalForecasts(forecasts.size())
            .completedForecasts(completed.size())
            .pendingForecasts(pending)
            .expiredForecasts(expired)
            .averageAccuracy(averageAccuracy(completed))
            .accuracyByType(byType)
            .build();
    }

    /** Mean accuracy of the completed records in {@code forecasts}; null if none has one. */
    public Double averageAccuracy(Collection<ForecastRecord> forecasts) {
        List<ForecastRecord> completed = forecasts.stream()
            .filter(ForecastRecord::isCompleted)
            .toList();
        return mean(values(scores(completed), AccuracyScore::getAccuracy));
    }

    /**
     * Uses the metrics stored at resolution time; a completed record without
     * them is scored again from its values. Records that cannot be scored are
     * skipped.
     */
    private List<AccuracyScore> scores(List<ForecastRecord> completed) {
        List<AccuracyScore> scores = new ArrayList<>(completed.size());
        for (ForecastRecord f : completed) {
            if (AccuracyCalculator.isFinite(f.getAccuracy()) && AccuracyCalculator.isFinite(f.getMape())) {
                scores.add(AccuracyScore.builder()
                    .absoluteError(f.getAbsoluteError() != null ? f.getAbsoluteError() : 0.0)
                    .accuracy(f.getAccuracy())
                    .mape(f.getMape())
                    .build());
                continue;
            }
            try {
                scores.add(calculator.score(f.getPredictedValue(), f.getActualValue()));
            } catch (InvalidMeasurementException ex) {
                log.warn("Skipping forecast in accuracy aggregate | id={} | reason={}", f.getId(), ex.getMessage());
            }
        }
        return scores;
    }


    /**
     * @param registeredUsers number of users who could have left feedback; the
     *                        response rate is 0 when it is not positive
     */
    public FeedbackSummary feedbackSummary(Collection<FeedbackRecord> feedback, long registeredUsers, Instant now) {
        TrendSnapshot trend = periodTrend(feedback.stream().map(FeedbackRecord::getDate).toList(), now);
        double responseRate = registeredUsers > 0
            ? (double) feedback.size() / registeredUsers * 100.0
            : 0.0;

        return FeedbackSummary.builder()
            .totalFeedback(feedback.size())
            .averageRating(averageRating(feedback))
            .responseRate(responseRate)
            .trend(trend.getTrend())
            .recentCount(trend.getRecentCount())
            .previousCount(trend.getPreviousCount())
            .ratingDistribution(ratingDistribution(feedback))
            .aiSubmetricAverages(submetricAverages(feedback))
            .build();
    }

    public List<RatingBucket> ratingDistribution(Collection<FeedbackRecord> feedback) {
        long total = feedback.size();
        return IntStream.rangeClosed(MIN_RATING, MAX_RATING)
            .mapToObj(rating -> {
                long count = feedback.stream().filter(f -> f.getRating() == rating).count();
                return RatingBucket.builder()
                    .rating(rating)
                    .count(count)
                    .percentage(percentage(count, total))
                    .build();
            })
            .toList();
    }

    /**
     * Averages over the records that supply each sub-metric. Structured fields
     * win; records not yet migrated fall back to the rating tags still inline
     * in their message.
     */
    public SubmetricAverages submetricAverages(Collection<FeedbackRecord> feedback) {
        List<SubMetrics> metrics = feedback.stream().map(this::subMetrics).toList();
        return SubmetricAverages.builder()
            .aiQuality(mean(metrics.stream().map(SubMetrics::getAiQuality).toList()))
            .chartQuality(mean(asDoubles(metrics, SubMetrics::getChartQuality)))
            .forecastAccuracyRating(mean(asDoubles(metrics, SubMetrics::getForecastAccuracyRating)))
            .insightsHelpfulness(mean(asDoubles(metrics, SubMetrics::getInsightsHelpfulness)))
            .sampleCount(metrics.stream().filter(SubMetrics::hasAnyRating).count())
            .build();
    }

    SubMetrics subMetrics(FeedbackRecord f) {
        SubMetrics stored = SubMetrics.builder()
            .aiQuality(f.getAiQuality())
            .chartQuality(f.getChartQuality())
            .forecastAccuracyRating(f.getForecastAccuracyRating())
            .insightsHelpfulness(f.getInsightsHelpfulness())
            .datasetName(f.getDatasetName())
            .build();
        if (f.isLegacyMigrated()) {
            return stored;
        }
        SubMetrics tagged = extractor.extract(f.getMessage()).getSubMetrics();
        return SubMetrics.builder()
            .aiQuality(firstNonNull(stored.getAiQuality(), tagged.getAiQuality()))
            .chartQuality(firstNonNull(stored.getChartQuality(), tagged.getChartQuality()))
            .forecastAccuracyRating(firstNonNull(stored.getForecastAccuracyRating(), tagged.getForecastAccuracyRating()))
            .insightsHelpfulness(firstNonNull(stored.getInsightsHelpfulness(), tagged.getInsightsHelpfulness()))
            .datasetName(firstNonNull(stored.getDatasetName(), tagged.getDatasetName()))
            .build();
    }

    public FeedbackPatternAnalysis patternAnalysis(Collection<FeedbackRecord> feedback) {
        return patternAnalysis(feedback, null);
    }

    /**
     * Rating and sentiment patterns of the feedback in {@code domain} (every
     * record when null). Withheld, with status {@code collecting}, until at
     * least the configured minimum number of records exists.
     */
    public FeedbackPatternAnalysis patternAnalysis(Collection<FeedbackRecord> feedback, FeedbackDomain domain) {
        List<FeedbackRecord> scoped = inDomain(feedback, domain);
        String domainName = domain == null ? ALL_DOMAINS : domain.wireName();
        int minRequired = thresholds.getMinFeedbackForPatterns();
        if (scoped.size() < minRequired) {
            return FeedbackPatternAnalysis.builder()
                .status(AnalysisStatus.COLLECTING)
                .domain(domainName)
                .feedbackCount(scoped.size())
                .minRequired(minRequired)
                .build();
        }

        return FeedbackPatternAnalysis.builder()
            .status(AnalysisStatus.READY)
            .domain(domainName)
            .feedbackCount(scoped.size())
            .minRequired(minRequired)
            .ratingDistribution(ratingDistribution(scoped))
            .sentiment(sentimentBreakdown(scoped))
            .averageRating(averageRating(scoped))
            .positiveFeedbackPercentage(positivePercentage(scoped))
            .highRated(ratedPatterns(scoped, f -> f.getRating() >= POSITIVE_RATING, FeedbackThemes.HIGH_RATED))
            .lowRated(ratedPatterns(scoped, f -> f.getRating() <= NEGATIVE_RATING, FeedbackThemes.LOW_RATED))
            .mismatches(mismatchSummary(scoped))
            .build();
    }

    /**
     * Overall and per-domain readiness of the feedback used for learning. A
     * domain reports its ratings once it holds the configured per-domain minimum.
     */
    public LearningStatistics learningStatistics(Collection<FeedbackRecord> feedback) {
        Map<String, DomainLearningStats> byDomain = new LinkedHashMap<>();
        for (FeedbackDomain domain : FeedbackDomain.values()) {
            List<FeedbackRecord> scoped = inDomain(feedback, domain);
            boolean enough = scoped.size() >= thresholds.getDomainMinFeedback();
            byDomain.put(domain.wireName(), DomainLearningStats.builder()
                .feedbackCount(scoped.size())
                .hasLearningData(enough)
                .averageRating(enough ? averageRating(scoped) : null)
                .positiveFeedbackPercentage(enough ? positivePercentage(scoped) : null)
                .build());
        }

        return LearningStatistics.builder()
            .totalFeedback(feedback.size())
            .averageRating(averageRating(feedback))
            .learningEnabled(feedback.size() >= thresholds.getMinFeedbackForPatterns())
            .byDomain(byDomain)
            .build();
    }

    MismatchSummary mismatchSummary(Collection<FeedbackRecord> feedback) {
        long classified = 0;
        long major = 0;
        long minor = 0;
        for (FeedbackRecord f : feedback) {
            Sentiment label = sentimentClassifier.classify(f);
            if (label == null) {
                continue;
            }
            classified++;
            MismatchSeverity severity = MismatchSeverity.of(f.getRating(), label);
            if (severity == MismatchSeverity.MAJOR) {
                major++;
            } else if (severity == MismatchSeverity.MINOR) {
                minor++;
            }
        }
        return MismatchSummary.builder()
            .count(major + minor)
            .percentage(percentage(major + minor, classified))
            .major(major)
            .minor(minor)
            .build();
    }

    private RatedFeedbackPatterns ratedPatterns(List<FeedbackRecord> feedback, Predicate<FeedbackRecord> band,
                                                Map<String, List<String>> themes) {
        List<FeedbackRecord> inBand = feedback.stream().filter(band).toList();
        return RatedFeedbackPatterns.builder()
            .count(inBand.size())
            .averageRating(averageRating(inBand))
            .commonThemes(FeedbackThemes.commonThemes(inBand.stream().map(this::commentText).toList(), themes))
            .build();
    }

    private String commentText(FeedbackRecord f) {
        return f.isLegacyMigrated() ? f.getMessage() : extractor.clean(f.getMessage());
    }

    SentimentBreakdown sentimentBreakdown(Collection<FeedbackRecord> feedback) {
        Map<Sentiment, Long> counts = new LinkedHashMap<>();
        for (Sentiment s : Sentiment.values()) {
            counts.put(s, 0L);
        }
        long unclassified = 0;
        for (FeedbackRecord f : feedback) {
            Sentiment label = sentimentClassifier.classify(f);
            if (label == null) {
                unclassified++;
            } else {
                counts.merge(label, 1L, Long::sum);
            }
        }
        long classified = feedback.size() - unclassified;
        return SentimentBreakdown.builder()
            .positive(counts.get(Sentiment.POSITIVE))
            .neutral(counts.get(Sentiment.NEUTRAL))
            .negative(counts.get(Sentiment.NEGATIVE))
            .unclassified(unclassified)
            .positivePercentage(percentage(counts.get(Sentiment.POSITIVE), classified))
            .neutralPercentage(percentage(counts.get(Sentiment.NEUTRAL), classified))
            .negativePercentage(percentage(counts.get(Sentiment.NEGATIVE), classified))
            .build();
    }


    /**
     * Compares the last window ({@code [now - w, now]}) against the window
     * before it ({@code [now - 2w, now - w)}). Null dates and dates after
     * {@code now} fall in neither window.
     */
    public TrendSnapshot periodTrend(Collection<Instant> dates, Instant now) {
        Duration window = Duration.ofDays(thresholds.getTrendWindowDays());
        Instant recentStart = now.minus(window);
        Instant previousStart = recentStart.minus(window);

        long recent = dates.stream()
            .filter(Objects::nonNull)
            .filter(d -> !d.isBefore(recentStart) && !d.isAfter(now))
            .count();
        long previous = dates.stream()
            .filter(Objects::nonNull)
            .filter(d -> !d.isBefore(previousStart) && d.isBefore(recentStart))
            .count();

        return TrendSnapshot.builder()
            .recentCount(recent)
            .previousCount(previous)
            .trend(trend(recent, previous))
            .build();
    }

    /** Percentage change from {@code previous} to {@code recent}; +100 for new activity, 0 when both are zero. */
    public static double trend(long recent, long previous) {
        if (previous == 0) {
            return recent > 0 ? 100.0 : 0.0;
        }
        return (double) (recent - previous) / previous * 100.0;
    }


    private static Double averageRating(Collection<FeedbackRecord> feedback) {
        return mean(feedback.stream().map(f -> (double) f.getRating()).toList());
    }

    private static double positivePercentage(Collection<FeedbackRecord> feedback) {
        long positive = feedback.stream().filter(f -> f.getRating() >= POSITIVE_RATING).count();
        return percentage(positive, feedback.size());
    }

    private static List<FeedbackRecord> inDomain(Collection<FeedbackRecord> feedback, FeedbackDomain domain) {
        if (domain == null) {
            return List.copyOf(feedback);
        }
        return feedback.stream().filter(f -> domain.matches(f.getChartTitle())).toList();
    }

    private static long countStatus(Collection<ForecastRecord> forecasts, ForecastStatus status) {
        return forecasts.stream().filter(f -> f.getStatus() == status).count();
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }

    private static List<Double> asDoubles(List<SubMetrics> metrics, Function<SubMetrics, Integer> getter) {
        return metrics.stream()
            .map(getter)
            .map(v -> v == null ? null : v.doubleValue())
            .toList();
    }

    private static List<Double> values(List<AccuracyScore> scores, Function<AccuracyScore, Double> extractor) {
        return scores.stream().map(extractor).toList();
    }

    /** Mean of the finite values, or null when there are none. */
    static Double mean(List<Double> values) {
        double[] finite = values.stream()
            .filter(AccuracyCalculator::isFinite)
            .mapToDouble(Double::doubleValue)
            .sorted()
            .toArray();
        if (finite.length == 0) {
            return null;
        }
        double sum = 0.0;
        for (double v : finite) {
            sum += v;
        }
        return sum / finite.length;
    }

    static double percentage(long count, long total) {
        return total > 0 ? (double) count / total * 100.0 : 0.0;
    }
}
