package com.kotsin.advisor.lifecycle;

import com.kotsin.advisor.model.Signal;

/**
 * Signed percentage P/L helpers. Positive means the move went the signal's way.
 */
public final class ProfitLossCalculator {

    private ProfitLossCalculator() {}

    public static double percent(boolean isLong, double entry, double exit) {
        if (entry == 0) return 0.0;
        double raw = (exit - entry) / entry * 100.0;
        return isLong ? raw : -raw;
    }

    /**
     * The price a closed signal is booked at: TP3 if hit, else TP2 if hit, else the last observed price.
     */
    public static double realizedExitPrice(Signal signal) {
        if (signal.isTp3Hit() && signal.getTakeProfit3() != null) return signal.getTakeProfit3();
        if (signal.isTp2Hit() && signal.getTakeProfit2() != null) return signal.getTakeProfit2();
        return signal.getCurrentPrice();
    }

    public static double realizedPercent(Signal signal) {
        return percent(signal.isLong(), signal.getEntryPrice(), realizedExitPrice(signal));
    }

    public static double livePercent(Signal signal) {
        return percent(signal.isLong(), signal.getEntryPrice(), signal.getCurrentPrice());
    }
}
