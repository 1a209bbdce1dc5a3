package com.kotsin.advisor.scoring;

import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Scoring rules for one signal category. Implementations do no I/O: the same inputs give the same signal
 * apart from its id.
 */
public interface SignalStrategy {

    SignalCategory category();

    /**
     * @return the signal, or empty when the candidate fails a quality gate
     */
    Optional<Signal> evaluate(PriceSeries series, MarketKind marketKind, MarketInputs inputs);

    static String newId(String pair, Instant now) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(2_176_782_336L), 36);
        return pair.replace("/", "") + "-" + now.toEpochMilli() + "-" + suffix;
    }
}
