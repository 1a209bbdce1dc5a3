package com.kotsin.advisor.model;

/**
 * Trend read of one timeframe. {@code strength} is the EMA9/EMA50 spread in tenths of a percent, capped at 100.
 */
public record TimeframeData(Timeframe timeframe, MarketTrend trend, int strength, double rsi,
                            DirectionPrediction.Bias macdSignal) {
}
