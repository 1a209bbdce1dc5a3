package com.kotsin.advisor.store;

import com.kotsin.advisor.model.AutoGenPreferences;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence for active signals (one partition per category), the completed archive and
 * auto-generation preferences.
 *
 * Every write to a category is a whole-partition read-modify-write that is atomic with respect to
 * that category and never touches sibling categories.
 */
public interface SignalStore {

    List<Signal> getActive(SignalCategory category);

    List<Signal> getAllActive();

    void replaceActive(SignalCategory category, List<Signal> signals);

    /**
     * Replaces the signal with the same id, or appends it when the partition does not hold it.
     */
    void upsert(Signal signal, SignalCategory category);

    /**
     * Atomically transforms one partition and returns what was written.
     */
    List<Signal> updateActive(SignalCategory category, UnaryOperator<List<Signal>> mutation);

    /**
     * Moves one signal from the active partition to the completed archive with its realized P/L.
     *
     * @return the archived record, or empty when the id is no longer active
     */
    Optional<Signal> archive(String id, SignalCategory category, Instant completedAt);

    /**
     * Completed archive in append order, deduplicated by id (first occurrence wins).
     */
    List<Signal> getCompleted();

    /**
     * Drops terminal signals older than {@code maxAge} from all active partitions.
     *
     * @return number of removed signals
     */
    int clearExpired(Duration maxAge, Instant now);

    AutoGenPreferences getPreferences();

    void setPreferences(AutoGenPreferences preferences);

    void markGenerated(SignalCategory category, Instant at);

    void clearAll();
}
