package com.kotsin.advisor.model;

import java.time.Duration;

public enum MarketCondition {
    NEWS_DRIVEN(Duration.ofHours(2)),
    HIGH_VOLATILITY(Duration.ofHours(4)),
    TRENDING(Duration.ofHours(12)),
    RANGING(Duration.ofHours(12));

    private final Duration validity;

    MarketCondition(Duration validity) {
        this.validity = validity;
    }

    public Duration validity() {
        return validity;
    }
}
