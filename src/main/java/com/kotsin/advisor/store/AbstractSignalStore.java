package com.kotsin.advisor.store;

import com.kotsin.advisor.lifecycle.ProfitLossCalculator;
import com.kotsin.advisor.model.AutoGenPreferences;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.SignalStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Derives the composite store operations from one primitive, an atomic partition update that can
 * carry an archive append, so each backend only has to provide that.
 */
@Slf4j
public abstract class AbstractSignalStore implements SignalStore {

    /**
     * Applies {@code mutation} to one partition. When {@code completedEntry} yields a record after the
     * mutation ran, it is appended to the completed archive in the same atomic write: either both
     * changes land or neither does. The supplier is consulted again on every retry.
     */
    protected abstract List<Signal> updateActive(SignalCategory category,
                                                 UnaryOperator<List<Signal>> mutation,
                                                 Supplier<Signal> completedEntry);

    protected abstract void updatePreferences(UnaryOperator<AutoGenPreferences> mutation);

    @Override
    public List<Signal> updateActive(SignalCategory category, UnaryOperator<List<Signal>> mutation) {
        return updateActive(category, mutation, () -> null);
    }

    @Override
    public List<Signal> getAllActive() {
        List<Signal> all = new ArrayList<>();
        for (SignalCategory category : SignalCategory.values()) {
            all.addAll(getActive(category));
        }
        return all;
    }

    @Override
    public void upsert(Signal signal, SignalCategory category) {
        updateActive(category, current -> {
            List<Signal> next = new ArrayList<>(current.size() + 1);
            boolean replaced = false;
            for (Signal s : current) {
                if (s.getId().equals(signal.getId())) {
                    next.add(signal);
                    replaced = true;
                } else {
                    next.add(s);
                }
            }
            if (!replaced) {
                next.add(signal);
            }
            return next;
        });
    }

    @Override
    public Optional<Signal> archive(String id, SignalCategory category, Instant completedAt) {
        AtomicReference<Signal> removed = new AtomicReference<>();
        updateActive(category, current -> {
            removed.set(null);
            List<Signal> next = new ArrayList<>(current.size());
            for (Signal s : current) {
                if (removed.get() == null && s.getId().equals(id)) {
                    removed.set(s);
                } else {
                    next.add(s);
                }
            }
            return next;
        }, () -> removed.get() == null ? null : toArchived(removed.get(), category, completedAt));

        Signal signal = removed.get();
        if (signal == null) {
            log.debug("signal_archive_miss id={} category={}", id, category);
            return Optional.empty();
        }

        Signal archived = toArchived(signal, category, completedAt);
        log.info("signal_archived id={} pair={} category={} status={} pnl={}",
                archived.getId(), archived.getPair(), category, archived.getStatus(),
                String.format("%.2f", archived.getProfitLossPercentage()));
        return Optional.of(archived);
    }

    private static Signal toArchived(Signal signal, SignalCategory category, Instant completedAt) {
        Signal archived = signal.toBuilder()
                .status(signal.isTerminal() ? signal.getStatus() : SignalStatus.COMPLETED)
                .completedAt(completedAt)
                .archivedCategory(category)
                .build();
        archived.setProfitLossPercentage(ProfitLossCalculator.realizedPercent(archived));
        return archived;
    }

    @Override
    public int clearExpired(Duration maxAge, Instant now) {
        Instant cutoff = now.minus(maxAge);
        AtomicInteger removed = new AtomicInteger();
        for (SignalCategory category : SignalCategory.values()) {
            AtomicInteger droppedHere = new AtomicInteger();
            updateActive(category, current -> {
                List<Signal> kept = new ArrayList<>(current.size());
                int dropped = 0;
                for (Signal s : current) {
                    boolean old = s.getCreatedAt() != null && s.getCreatedAt().isBefore(cutoff);
                    if (old && s.isTerminal()) {
                        dropped++;
                    } else {
                        kept.add(s);
                    }
                }
                droppedHere.set(dropped);
                return kept;
            });
            removed.addAndGet(droppedHere.get());
        }
        if (removed.get() > 0) {
            log.info("signals_cleared count={} olderThan={}", removed.get(), maxAge);
        }
        return removed.get();
    }

    @Override
    public void markGenerated(SignalCategory category, Instant at) {
        updatePreferences(prefs -> {
            prefs.get(category).setLastGeneratedAt(at.toEpochMilli());
            return prefs;
        });
    }
}
