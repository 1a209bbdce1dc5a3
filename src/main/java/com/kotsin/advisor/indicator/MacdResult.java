package com.kotsin.advisor.indicator;

public record MacdResult(double macd, double signal, double histogram) {

    public static final MacdResult ZERO = new MacdResult(0.0, 0.0, 0.0);

    public boolean isBullish() {
        return histogram > 0 && macd > signal;
    }

    public boolean isBearish() {
        return histogram < 0 && macd < signal;
    }
}
