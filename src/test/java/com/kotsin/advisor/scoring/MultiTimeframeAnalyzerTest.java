package com.kotsin.advisor.scoring;

import com.kotsin.advisor.model.DirectionPrediction;
import com.kotsin.advisor.model.MarketTrend;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.SignalDirection;
import com.kotsin.advisor.model.Timeframe;
import com.kotsin.advisor.model.TimeframeAlignment;
import com.kotsin.advisor.model.TimeframeData;
import com.kotsin.advisor.model.VenueKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MultiTimeframeAnalyzerTest {

    private final MultiTimeframeAnalyzer analyzer = new MultiTimeframeAnalyzer();

    private static PriceSeries rising(int bars) {
        double[] prices = new double[bars];
        for (int i = 0; i < bars; i++) {
            prices[i] = 100 + i;
        }
        return new PriceSeries("BTC/USDT", VenueKind.CRYPTO, prices, null, null);
    }

    private static TimeframeData data(Timeframe timeframe, MarketTrend trend, int strength, double rsi) {
        return new TimeframeData(timeframe, trend, strength, rsi, DirectionPrediction.Bias.NEUTRAL);
    }

    @Test
    @DisplayName("Sampling keeps every k-th close counted back from the latest")
    void sampleFromLatest() {
        double[] prices = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};
        assertArrayEquals(new double[]{0, 3, 6, 9}, MultiTimeframeAnalyzer.sample(prices, 3));
        assertArrayEquals(new double[]{1, 5, 9}, MultiTimeframeAnalyzer.sample(prices, 4));
        assertEquals(100, MultiTimeframeAnalyzer.sample(rising(150).prices(), 1).length);
    }

    @Test
    @DisplayName("A steady uptrend aligns every derivable timeframe")
    void steadyUptrendAligns() {
        TimeframeAlignment alignment = analyzer.analyze(rising(2000), Timeframe.H1);

        assertTrue(alignment.aligned());
        assertEquals(MarketTrend.BULLISH, alignment.dominantTrend());
        assertEquals(List.of(Timeframe.H1, Timeframe.H4, Timeframe.D1), alignment.alignedTimeframes());
        assertTrue(alignment.conflictingTimeframes().isEmpty());
        assertTrue(alignment.strength() > 0);
        assertEquals(List.of("3 timeframes show RSI overbought (>70)"), alignment.divergences());
        assertTrue(alignment.confirmedByHigherTimeframe(SignalDirection.LONG));
        assertFalse(alignment.confirmedByHigherTimeframe(SignalDirection.SHORT));
    }

    @Test
    @DisplayName("Timeframes finer than the base or too short after sampling are skipped")
    void skipsUnderivableTimeframes() {
        TimeframeAlignment alignment = analyzer.analyze(rising(100), Timeframe.H1);

        assertEquals(List.of(Timeframe.H1),
                alignment.timeframeData().stream().map(TimeframeData::timeframe).toList());
    }

    @Test
    @DisplayName("Too little history reports insufficient data")
    void shortSeriesIsInsufficient() {
        TimeframeAlignment alignment = analyzer.analyze(rising(20), Timeframe.M5);

        assertFalse(alignment.aligned());
        assertEquals(MarketTrend.NEUTRAL, alignment.dominantTrend());
        assertEquals(List.of("Insufficient timeframe data"), alignment.divergences());
        assertFalse(alignment.confirmedByHigherTimeframe(SignalDirection.LONG));
    }

    @Test
    @DisplayName("Mixed reads below the 70% share are not aligned and list their divergences")
    void mixedTimeframes() {
        TimeframeAlignment alignment = MultiTimeframeAnalyzer.align(List.of(
                data(Timeframe.M5, MarketTrend.BEARISH, 10, 25),
                data(Timeframe.M15, MarketTrend.BULLISH, 30, 75),
                data(Timeframe.H1, MarketTrend.BULLISH, 20, 75),
                data(Timeframe.H4, MarketTrend.BULLISH, 40, 50),
                data(Timeframe.D1, MarketTrend.BEARISH, 60, 25)));

        assertFalse(alignment.aligned());
        assertEquals(MarketTrend.BULLISH, alignment.dominantTrend());
        assertEquals(List.of(Timeframe.M15, Timeframe.H1, Timeframe.H4), alignment.alignedTimeframes());
        assertEquals(List.of(Timeframe.M5, Timeframe.D1), alignment.conflictingTimeframes());
        assertEquals(18, alignment.strength());
        assertEquals(List.of(
                "1d shows BEARISH trend (conflicts with BULLISH)",
                "Lower timeframes show mixed signals",
                "2 timeframes show RSI overbought (>70)",
                "2 timeframes show RSI oversold (<30)"), alignment.divergences());
        assertTrue(alignment.confirmedByHigherTimeframe(SignalDirection.LONG));
        assertTrue(alignment.confirmedByHigherTimeframe(SignalDirection.SHORT));
    }

    @Test
    @DisplayName("A tie between bulls and bears leaves the dominant trend neutral")
    void tieIsNeutral() {
        TimeframeAlignment alignment = MultiTimeframeAnalyzer.align(List.of(
                data(Timeframe.H1, MarketTrend.BULLISH, 20, 50),
                data(Timeframe.H4, MarketTrend.BEARISH, 20, 50)));

        assertEquals(MarketTrend.NEUTRAL, alignment.dominantTrend());
        assertTrue(alignment.alignedTimeframes().isEmpty());
        assertEquals(List.of(Timeframe.H1, Timeframe.H4), alignment.conflictingTimeframes());
        assertEquals(0, alignment.strength());
    }
}
