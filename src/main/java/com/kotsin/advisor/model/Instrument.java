package com.kotsin.advisor.model;

public record Instrument(String pair, VenueKind venue) {
}
