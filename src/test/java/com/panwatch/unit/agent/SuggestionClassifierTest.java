package com.panwatch.unit.agent;

import static org.assertj.core.api.Assertions.assertThat;

import com.panwatch.agent.SuggestionClassifier;
import com.panwatch.domain.enums.Market;
import com.panwatch.domain.enums.SuggestionAction;
import com.panwatch.domain.model.Instrument;
import com.panwatch.domain.model.Suggestion;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SuggestionClassifierTest {

    private final SuggestionClassifier classifier = new SuggestionClassifier();

    private static Instrument instrument(long id, String symbol, String name) {
        return Instrument.builder().id(id).symbol(symbol).name(name).market(Market.CN).enabled(true).build();
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @ParameterizedTest
        @CsvSource({
            "'建议：卖出，跌破支撑位', SELL, true",
            "'建议: 减仓', REDUCE, true",
            "'Action: buy on the dip', BUY, true",
            "'继续持有，趋势未变', HOLD, false",
            "'观望为主', WATCH, false",
            "'We suggest to ADD a small position', ADD, true"
        })
        void keywordsMapToTaxonomy(String raw, SuggestionAction expected, boolean alert) {
            Suggestion suggestion = classifier.classify(raw);

            assertThat(suggestion.getAction()).isEqualTo(expected);
            assertThat(suggestion.isShouldAlert()).isEqualTo(alert);
        }

        @Test
        void jsonActionWins() {
            Suggestion suggestion = classifier.classify(
                    "分析如下：\n{\"action\": \"sell\", \"reason\": \"放量跌破 20 日均线\"}");

            assertThat(suggestion.getAction()).isEqualTo(SuggestionAction.SELL);
            assertThat(suggestion.isShouldAlert()).isTrue();
            assertThat(suggestion.getReason()).isEqualTo("放量跌破 20 日均线");
        }

        @Test
        void jsonShouldAlertFlagIsHonoured() {
            Suggestion suggestion = classifier.classify("{\"action\": \"减仓\", \"should_alert\": false}");

            assertThat(suggestion.getAction()).isEqualTo(SuggestionAction.REDUCE);
            assertThat(suggestion.isShouldAlert()).isFalse();
        }

        @Test
        @DisplayName("Labelled line beats an earlier keyword in the narrative")
        void labelledLineBeatsNarrative() {
            Suggestion suggestion = classifier.classify("昨日买入信号失效。\n操作建议：观望");

            assertThat(suggestion.getAction()).isEqualTo(SuggestionAction.WATCH);
            assertThat(suggestion.isShouldAlert()).isFalse();
        }

        @Test
        void noAlertMarkerSuppressesActionableAlert() {
            Suggestion suggestion = classifier.classify("建议：减仓 [无需提醒]");

            assertThat(suggestion.getAction()).isEqualTo(SuggestionAction.REDUCE);
            assertThat(suggestion.isShouldAlert()).isFalse();
        }

        @Test
        void alertMarkerForcesAlert() {
            Suggestion suggestion = classifier.classify("[提醒] 建议持有，但成交量异常放大");

            assertThat(suggestion.getAction()).isEqualTo(SuggestionAction.HOLD);
            assertThat(suggestion.isShouldAlert()).isTrue();
        }

        @Test
        void unrecognisedTextIsWatchWithoutAlert() {
            Suggestion suggestion = classifier.classify("今日大盘震荡，成交量萎缩。");

            assertThat(suggestion.getAction()).isEqualTo(SuggestionAction.WATCH);
            assertThat(suggestion.isShouldAlert()).isFalse();
            assertThat(suggestion.getRaw()).isEqualTo("今日大盘震荡，成交量萎缩。");
        }

        @Test
        void blankIsWatch() {
            assertThat(classifier.classify("   ").getAction()).isEqualTo(SuggestionAction.WATCH);
            assertThat(classifier.classify(null).isShouldAlert()).isFalse();
        }

        @Test
        void reasonIsFirstLineTruncated() {
            String longLine = "卖出".repeat(150);

            Suggestion suggestion = classifier.classify(longLine + "\n第二行");

            assertThat(suggestion.getReason()).hasSize(203).endsWith("...");
        }
    }

    @Nested
    @DisplayName("classifyBatch")
    class ClassifyBatch {

        private final Instrument moutai = instrument(1L, "600519", "贵州茅台");
        private final Instrument tencent = instrument(2L, "00700", "腾讯控股");
        private final Instrument apple = instrument(3L, "AAPL", "Apple");

        @Test
        void jsonArrayIsMatchedBySymbol() {
            String raw = "[{\"symbol\": \"600519\", \"action\": \"卖出\"},"
                    + " {\"symbol\": \"aapl\", \"action\": \"hold\"}]";

            Map<Long, Suggestion> result = classifier.classifyBatch(raw, List.of(moutai, tencent, apple));

            assertThat(result.get(1L).getAction()).isEqualTo(SuggestionAction.SELL);
            assertThat(result.get(1L).isShouldAlert()).isTrue();
            assertThat(result.get(2L).getAction()).isEqualTo(SuggestionAction.WATCH);
            assertThat(result.get(3L).getAction()).isEqualTo(SuggestionAction.HOLD);
        }

        @Test
        void plainTextIsSplitAtFirstMention() {
            String raw = "贵州茅台（600519）：放量下跌，建议减仓。\n腾讯控股（00700）：维持持有。";

            Map<Long, Suggestion> result = classifier.classifyBatch(raw, List.of(moutai, tencent, apple));

            assertThat(result.get(1L).getAction()).isEqualTo(SuggestionAction.REDUCE);
            assertThat(result.get(2L).getAction()).isEqualTo(SuggestionAction.HOLD);
            assertThat(result.get(3L).getAction()).isEqualTo(SuggestionAction.WATCH);
            assertThat(result.get(3L).isShouldAlert()).isFalse();
        }

        @Test
        void everyInstrumentGetsAnEntry() {
            Map<Long, Suggestion> result = classifier.classifyBatch("", List.of(moutai, tencent));

            assertThat(result).containsOnlyKeys(1L, 2L);
        }
    }
}
