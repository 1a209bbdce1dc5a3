package com.kotsin.advisor.model;

public enum MarketTrend {
    STRONG_BULLISH,
    BULLISH,
    NEUTRAL,
    BEARISH,
    STRONG_BEARISH;

    public boolean isBullish() {
        return this == STRONG_BULLISH || this == BULLISH;
    }

    public boolean isBearish() {
        return this == STRONG_BEARISH || this == BEARISH;
    }
}
