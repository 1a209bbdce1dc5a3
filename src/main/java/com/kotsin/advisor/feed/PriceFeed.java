package com.kotsin.advisor.feed;

import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.VenueKind;

import java.util.Optional;
import java.util.OptionalDouble;

public interface PriceFeed {

    /**
     * @return the latest traded price, or empty when the feed cannot supply one
     */
    OptionalDouble currentPrice(String pair);

    Optional<PriceSeries> history(String pair, VenueKind venue, MarketKind marketKind, int points);
}
