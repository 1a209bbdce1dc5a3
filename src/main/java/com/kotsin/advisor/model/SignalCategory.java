package com.kotsin.advisor.model;

import java.util.Arrays;

/**
 * Signal families. Each category owns its own active partition and generation cadence.
 */
public enum SignalCategory {
    STANDARD("standard"),
    FAST("fast"),
    FLOW("flow");

    private final String key;

    SignalCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static SignalCategory fromKey(String value) {
        return Arrays.stream(values())
                .filter(c -> c.key.equalsIgnoreCase(value) || c.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown signal category: " + value));
    }
}
