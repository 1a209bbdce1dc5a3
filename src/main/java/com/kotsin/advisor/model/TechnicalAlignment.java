package com.kotsin.advisor.model;

public enum TechnicalAlignment {
    STRONG,
    MODERATE,
    WEAK
}
