package com.adaptivelearning.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the bracketed sub-rating tags that older clients appended to the
 * feedback text, e.g. {@code "Nice [AI Quality: 4.5/5][Charts: 5/5]"}.
 *
 * <p>Only the closed set {@code AI Quality}, {@code Charts}, {@code Forecasts},
 * {@code Insights} and {@code Dataset} is recognised. A tag whose number does
 * not parse, or lies outside 0-5, counts as absent but is still removed from
 * the clean message. Arbitrary input never causes an exception.
 */
@Slf4j
public class FeedbackPatternExtractor {

    private static final double MAX_RATING = 5.0;

    private static final String RATED_TAG = "\\[%s:\\s*([^\\]/]*?)\\s*/\\s*5\\s*\\]";

    private static final Pattern AI_QUALITY = tag(RATED_TAG, "AI Quality");
    private static final Pattern CHARTS     = tag(RATED_TAG, "Charts");
    private static final Pattern FORECASTS  = tag(RATED_TAG, "Forecasts");
    private static final Pattern INSIGHTS   = tag(RATED_TAG, "Insights");
    private static final Pattern DATASET    = Pattern.compile("\\[Dataset:\\s*([^\\]]*)\\]");

    // ASCII digits with an optional fraction; anything else the JDK parsers accept is malformed here.
    private static final Pattern DECIMAL_PAYLOAD = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern INTEGER_PAYLOAD = Pattern.compile("\\d+");

    // A run of adjacent tags together with the whitespace around it.
    private static final Pattern TAG_RUN = Pattern.compile(
        "\\s*(?:(?:" + String.join("|",
            AI_QUALITY.pattern(), CHARTS.pattern(), FORECASTS.pattern(),
            INSIGHTS.pattern(), DATASET.pattern()) + ")\\s*)+");

    public ExtractedFeedback extract(String message) {
        if (message == null || message.isBlank()) {
            return ExtractedFeedback.builder().subMetrics(SubMetrics.EMPTY).cleanMessage("").build();
        }

        SubMetrics subMetrics = SubMetrics.builder()
            .aiQuality(decimal(AI_QUALITY, message))
            .chartQuality(integer(CHARTS, message))
            .forecastAccuracyRating(integer(FORECASTS, message))
            .insightsHelpfulness(integer(INSIGHTS, message))
            .datasetName(text(DATASET, message))
            .build();

        return ExtractedFeedback.builder()
            .subMetrics(subMetrics)
            .cleanMessage(clean(message))
            .build();
    }

    /** The message with every recognised tag removed and the whitespace around tags collapsed. */
    public String clean(String message) {
        if (message == null) {
            return "";
        }
        return TAG_RUN.matcher(message).replaceAll(" ").trim();
    }

    private static Double decimal(Pattern pattern, String message) {
        String payload = firstPayload(pattern, message);
        if (payload == null) {
            return null;
        }
        if (!DECIMAL_PAYLOAD.matcher(payload).matches()) {
            log.debug("Ignoring malformed sub-rating | tag={} | payload={}", pattern.pattern(), payload);
            return null;
        }
        try {
            double value = Double.parseDouble(payload);
            return inRange(value) ? value : null;
        } catch (NumberFormatException ex) {
            log.debug("Ignoring malformed sub-rating | tag={} | payload={}", pattern.pattern(), payload);
            return null;
        }
    }

    private static Integer integer(Pattern pattern, String message) {
        String payload = firstPayload(pattern, message);
        if (payload == null) {
            return null;
        }
        if (!INTEGER_PAYLOAD.matcher(payload).matches()) {
            log.debug("Ignoring malformed sub-rating | tag={} | payload={}", pattern.pattern(), payload);
            return null;
        }
        try {
            int value = Integer.parseInt(payload);
            return inRange(value) ? value : null;
        } catch (NumberFormatException ex) {
            log.debug("Ignoring malformed sub-rating | tag={} | payload={}", pattern.pattern(), payload);
            return null;
        }
    }

    private static String text(Pattern pattern, String message) {
        String payload = firstPayload(pattern, message);
        return payload == null || payload.isBlank() ? null : payload.trim();
    }

    private static String firstPayload(Pattern pattern, String message) {
        Matcher m = pattern.matcher(message);
        return m.find() ? m.group(1) : null;
    }

    private static boolean inRange(double value) {
        return Double.isFinite(value) && value >= 0.0 && value <= MAX_RATING;
    }

    private static Pattern tag(String template, String label) {
        return Pattern.compile(String.format(template, Pattern.quote(label)));
    }
}
