package com.marketscan.unit.indicator;

import static com.marketscan.unit.support.CandleFixtures.candle;
import static org.assertj.core.api.Assertions.assertThat;

import com.marketscan.indicator.CandlestickPattern;
import com.marketscan.indicator.CandlestickPatterns;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CandlestickPatternsTest {

    @Test
    @DisplayName("Tiny body against the range is a doji")
    void doji() {
        assertThat(CandlestickPatterns.detect(List.of(candle(0, 100, 102, 98, 100.1, 1000))))
                .containsExactly(CandlestickPattern.DOJI);
    }

    @Test
    @DisplayName("Small body near the high with a long lower shadow is a hammer")
    void hammer() {
        assertThat(CandlestickPatterns.detect(List.of(candle(0, 100, 101.2, 95, 101, 1000))))
                .containsExactly(CandlestickPattern.HAMMER);
    }

    @Test
    @DisplayName("Bullish body covering the previous bearish body is a bullish engulfing")
    void bullishEngulfing() {
        var patterns = CandlestickPatterns.detect(List.of(
                candle(0, 102, 102.5, 99.8, 100, 1000),
                candle(1, 99.5, 103.2, 99.4, 103, 1000)));

        assertThat(patterns).contains(CandlestickPattern.BULLISH_ENGULFING);
        assertThat(patterns).doesNotContain(CandlestickPattern.BEARISH_ENGULFING);
    }

    @Test
    @DisplayName("Three rising bullish bars each opening inside the prior body")
    void threeWhiteSoldiers() {
        var patterns = CandlestickPatterns.detect(List.of(
                candle(0, 100, 102.2, 99.9, 102, 1000),
                candle(1, 101, 104.3, 100.8, 104, 1000),
                candle(2, 103, 106.1, 102.9, 106, 1000)));

        assertThat(patterns).contains(CandlestickPattern.THREE_WHITE_SOLDIERS);
        assertThat(patterns).doesNotContain(CandlestickPattern.THREE_BLACK_CROWS, CandlestickPattern.MORNING_STAR);
    }

    @Test
    @DisplayName("Long bearish bar, small star, strong bullish close is a morning star")
    void morningStar() {
        var patterns = CandlestickPatterns.detect(List.of(
                candle(0, 110, 110.5, 99.5, 100, 1000),
                candle(1, 99, 99.8, 98.2, 99.3, 1000),
                candle(2, 100, 108.5, 99.8, 108, 1000)));

        assertThat(patterns).contains(CandlestickPattern.MORNING_STAR);
    }
}
