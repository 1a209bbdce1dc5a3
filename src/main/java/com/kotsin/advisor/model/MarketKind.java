package com.kotsin.advisor.model;

public enum MarketKind {
    SPOT,
    FUTURE
}
