package com.kotsin.advisor.store;

import com.kotsin.advisor.model.AutoGenPreferences;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Process-local store, used when Redis is not available and in tests.
 */
@Component
@ConditionalOnProperty(prefix = "signals.store", name = "type", havingValue = "memory")
public class InMemorySignalStore extends AbstractSignalStore {

    private final Map<SignalCategory, List<Signal>> active = new EnumMap<>(SignalCategory.class);
    private final Map<SignalCategory, ReentrantLock> locks = new EnumMap<>(SignalCategory.class);
    private final List<Signal> completed = Collections.synchronizedList(new ArrayList<>());
    private final SignalRecordNormalizer normalizer;
    private AutoGenPreferences preferences = new AutoGenPreferences();

    public InMemorySignalStore(SignalRecordNormalizer normalizer) {
        this.normalizer = normalizer;
        for (SignalCategory c : SignalCategory.values()) {
            active.put(c, List.of());
            locks.put(c, new ReentrantLock());
        }
    }

    @Override
    public List<Signal> getActive(SignalCategory category) {
        ReentrantLock lock = locks.get(category);
        lock.lock();
        try {
            return new ArrayList<>(active.get(category));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void replaceActive(SignalCategory category, List<Signal> signals) {
        updateActive(category, current -> signals);
    }

    @Override
    protected List<Signal> updateActive(SignalCategory category,
                                        UnaryOperator<List<Signal>> mutation,
                                        Supplier<Signal> completedEntry) {
        ReentrantLock lock = locks.get(category);
        lock.lock();
        try {
            List<Signal> next = mutation.apply(new ArrayList<>(active.get(category)));
            List<Signal> stored = List.copyOf(normalizer.dedupe(next));
            Signal archived = completedEntry.get();
            if (archived != null) {
                appendCompleted(archived);
            }
            active.put(category, stored);
            return new ArrayList<>(stored);
        } finally {
            lock.unlock();
        }
    }

    protected void appendCompleted(Signal signal) {
        completed.add(signal);
    }

    @Override
    public List<Signal> getCompleted() {
        synchronized (completed) {
            return normalizer.dedupe(new ArrayList<>(completed));
        }
    }

    @Override
    public synchronized AutoGenPreferences getPreferences() {
        return copy(preferences);
    }

    @Override
    public synchronized void setPreferences(AutoGenPreferences preferences) {
        this.preferences = copy(preferences);
    }

    @Override
    protected synchronized void updatePreferences(UnaryOperator<AutoGenPreferences> mutation) {
        this.preferences = copy(mutation.apply(copy(preferences)));
    }

    @Override
    public void clearAll() {
        for (SignalCategory c : SignalCategory.values()) {
            replaceActive(c, List.of());
        }
        completed.clear();
        setPreferences(new AutoGenPreferences());
    }

    private AutoGenPreferences copy(AutoGenPreferences source) {
        AutoGenPreferences out = new AutoGenPreferences();
        source.getCategories().forEach((category, pref) -> out.getCategories().put(category,
                AutoGenPreferences.CategoryPreference.builder()
                        .enabled(pref.isEnabled())
                        .lastGeneratedAt(pref.getLastGeneratedAt())
                        .config(pref.getConfig())
                        .build()));
        return out;
    }
}
