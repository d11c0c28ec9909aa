package com.adaptivelearning.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class FeedbackPatternExtractorTest {

    private final FeedbackPatternExtractor extractor = new FeedbackPatternExtractor();

    @Test
    void extract_readsTagsAndCleansMessage() {
        ExtractedFeedback result = extractor.extract("Great dashboard [AI Quality: 4.5/5][Charts: 5/5]");

        SubMetrics metrics = result.getSubMetrics();
        assertThat(metrics.getAiQuality()).isEqualTo(4.5);
        assertThat(metrics.getChartQuality()).isEqualTo(5);
        assertThat(metrics.getForecastAccuracyRating()).isNull();
        assertThat(metrics.getInsightsHelpfulness()).isNull();
        assertThat(metrics.getDatasetName()).isNull();
        assertThat(result.getCleanMessage()).isEqualTo("Great dashboard");
    }

    @Test
    void extract_allTags() {
        ExtractedFeedback result = extractor.extract(
            "[Dataset: sales_q1.csv] Forecasts looked off [Forecasts: 2/5] [Insights: 4/5] [AI Quality: 3/5]");

        SubMetrics metrics = result.getSubMetrics();
        assertThat(metrics.getDatasetName()).isEqualTo("sales_q1.csv");
        assertThat(metrics.getForecastAccuracyRating()).isEqualTo(2);
        assertThat(metrics.getInsightsHelpfulness()).isEqualTo(4);
        assertThat(metrics.getAiQuality()).isEqualTo(3.0);
        assertThat(metrics.hasAnyRating()).isTrue();
        assertThat(result.getCleanMessage()).isEqualTo("Forecasts looked off");
    }

    @Test
    void extract_noTags_returnsTrimmedOriginal() {
        ExtractedFeedback result = extractor.extract("   Works fine,  thanks!  ");

        assertThat(result.getSubMetrics()).isEqualTo(SubMetrics.EMPTY);
        assertThat(result.getSubMetrics().hasAnyRating()).isFalse();
        assertThat(result.getCleanMessage()).isEqualTo("Works fine,  thanks!");
    }

    @Test
    void extract_tagInMiddle_collapsesSurroundingWhitespace() {
        ExtractedFeedback result = extractor.extract("Charts were  [Charts: 4/5]   clear");

        assertThat(result.getSubMetrics().getChartQuality()).isEqualTo(4);
        assertThat(result.getCleanMessage()).isEqualTo("Charts were clear");
    }

    @Test
    void extract_unparseableNumber_treatedAsAbsent() {
        ExtractedFeedback result = extractor.extract("Hmm [Charts: four/5] [AI Quality: 4..5/5]");

        assertThat(result.getSubMetrics().getChartQuality()).isNull();
        assertThat(result.getSubMetrics().getAiQuality()).isNull();
        assertThat(result.getCleanMessage()).isEqualTo("Hmm");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "[AI Quality: 4f/5] [Charts: 4d/5]",
        "[AI Quality: 0x1p2/5] [Charts: 0x3/5]",
        "[AI Quality: +4.5/5] [Charts: +3/5]",
        "[AI Quality: 4e0/5] [Charts: -0/5]"
    })
    void extract_nonDecimalNumberForms_treatedAsAbsent(String tags) {
        ExtractedFeedback result = extractor.extract("Fine " + tags);

        assertThat(result.getSubMetrics().getAiQuality()).isNull();
        assertThat(result.getSubMetrics().getChartQuality()).isNull();
        assertThat(result.getSubMetrics().hasAnyRating()).isFalse();
        assertThat(result.getCleanMessage()).isEqualTo("Fine");
    }

    @Test
    void extract_outOfRangeRating_treatedAsAbsent() {
        ExtractedFeedback result = extractor.extract("[Insights: 9/5] ok");

        assertThat(result.getSubMetrics().getInsightsHelpfulness()).isNull();
        assertThat(result.getCleanMessage()).isEqualTo("ok");
    }

    @Test
    void extract_decimalInIntegerTag_treatedAsAbsent() {
        assertThat(extractor.extract("[Charts: 4.5/5]").getSubMetrics().getChartQuality()).isNull();
    }

    @Test
    void extract_unknownOrUnclosedTags_leftInText() {
        ExtractedFeedback result = extractor.extract("[Speed: 5/5] fast [Charts: 3/5");

        assertThat(result.getSubMetrics().hasAnyRating()).isFalse();
        assertThat(result.getCleanMessage()).isEqualTo("[Speed: 5/5] fast [Charts: 3/5");
    }

    @Test
    void extract_repeatedTag_usesFirstAndStripsAll() {
        ExtractedFeedback result = extractor.extract("[Charts: 2/5] then [Charts: 5/5]");

        assertThat(result.getSubMetrics().getChartQuality()).isEqualTo(2);
        assertThat(result.getCleanMessage()).isEqualTo("then");
    }

    @Test
    void extract_nullOrBlank_returnsEmpty() {
        assertThat(extractor.extract(null).getCleanMessage()).isEmpty();
        assertThat(extractor.extract("   ").getSubMetrics()).isEqualTo(SubMetrics.EMPTY);
    }

    @Test
    void extract_arbitraryText_neverThrows() {
        String[] inputs = {"[", "]]][[[", "[AI Quality: /5]", "[Dataset: ]", "[Charts: 99999999999999/5]",
                           "\u0000[Insights:\n3/5]\u0000", "[AI Quality: NaN/5]", "[AI Quality: Infinity/5]"};
        for (String input : inputs) {
            ExtractedFeedback result = extractor.extract(input);
            assertThat(result.getCleanMessage()).isNotNull();
        }
        assertThat(extractor.extract("[AI Quality: NaN/5]").getSubMetrics().getAiQuality()).isNull();
        assertThat(extractor.extract("[Insights:\n3/5]").getSubMetrics().getInsightsHelpfulness()).isEqualTo(3);
    }
}
