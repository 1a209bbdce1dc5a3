package com.kotsin.advisor.model;

public enum SignalStatus {
    ACTIVE,
    COMPLETED,
    STOPPED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
