package com.kotsin.advisor.scoring;

import com.kotsin.advisor.model.DirectionPrediction;

import java.time.Instant;
import java.util.Optional;

/**
 * Everything a strategy needs besides the price series, gathered before scoring starts.
 *
 * @param sentiment  -100..100, 0 when the source was unavailable
 * @param prediction empty when no predictor answered in time
 */
public record MarketInputs(double sentiment, Optional<DirectionPrediction> prediction, Instant now) {

    public static MarketInputs neutral(Instant now) {
        return new MarketInputs(0.0, Optional.empty(), now);
    }
}
