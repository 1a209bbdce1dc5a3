package com.kotsin.advisor.model;

/**
 * BUY/SELL are used on spot markets, LONG/SHORT on futures.
 */
public enum SignalDirection {
    BUY,
    SELL,
    LONG,
    SHORT;

    public boolean isLong() {
        return this == BUY || this == LONG;
    }

    public static SignalDirection of(boolean bullish, MarketKind kind) {
        if (kind == MarketKind.SPOT) {
            return bullish ? BUY : SELL;
        }
        return bullish ? LONG : SHORT;
    }
}
