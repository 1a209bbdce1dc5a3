package com.kotsin.advisor.model;

public enum VenueKind {
    CRYPTO,
    FOREX
}
