package com.kotsin.advisor.model;

import java.util.List;

/**
 * How far the timeframes derivable from a series agree on one trend.
 *
 * {@code aligned} holds when at least 70% of the analysed timeframes share the dominant trend.
 * {@code strength} is that share times the mean strength of the agreeing timeframes.
 */
public record TimeframeAlignment(boolean aligned,
                                 List<Timeframe> alignedTimeframes,
                                 List<Timeframe> conflictingTimeframes,
                                 int strength,
                                 MarketTrend dominantTrend,
                                 List<String> divergences,
                                 List<TimeframeData> timeframeData) {

    public static TimeframeAlignment insufficient() {
        return new TimeframeAlignment(false, List.of(), List.of(), 0, MarketTrend.NEUTRAL,
                List.of("Insufficient timeframe data"), List.of());
    }

    /**
     * True when the 4h or 1d read points the same way as the given direction.
     */
    public boolean confirmedByHigherTimeframe(SignalDirection direction) {
        MarketTrend wanted = direction.isLong() ? MarketTrend.BULLISH : MarketTrend.BEARISH;
        for (TimeframeData data : timeframeData) {
            if ((data.timeframe() == Timeframe.H4 || data.timeframe() == Timeframe.D1) && data.trend() == wanted) {
                return true;
            }
        }
        return false;
    }
}
