package com.kotsin.advisor.autogen;

import com.kotsin.advisor.config.SignalProps;
import com.kotsin.advisor.feed.BoundedCallExecutor;
import com.kotsin.advisor.feed.PriceFeed;
import com.kotsin.advisor.model.AutoGenPreferences;
import com.kotsin.advisor.model.GenerationConfig;
import com.kotsin.advisor.model.Instrument;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.SignalEvent;
import com.kotsin.advisor.notification.SignalNotifier;
import com.kotsin.advisor.scoring.SignalScoringEngine;
import com.kotsin.advisor.service.ErrorMonitoringService;
import com.kotsin.advisor.store.SignalStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs periodic signal generation per category and remembers which categories are switched on,
 * so a restart resumes them.
 */
@Service
@Slf4j
public class AutoGenerator {

    private final SignalScoringEngine engine;
    private final SignalStore store;
    private final PriceFeed priceFeed;
    private final InstrumentUniverse universe;
    private final BoundedCallExecutor boundedCalls;
    private final SignalNotifier notifier;
    private final ErrorMonitoringService errorMonitoringService;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final SignalProps props;

    private final Map<SignalCategory, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();
    private final Map<SignalCategory, GenerationConfig> configs = new ConcurrentHashMap<>();

    // A scheduled run may only publish its batch while the epoch it was started under is current.
    // start/stop bump the epoch under the commit lock, so nothing from an older run lands afterwards.
    private final Map<SignalCategory, AtomicLong> epochs = new EnumMap<>(SignalCategory.class);
    private final Map<SignalCategory, ReentrantLock> commitLocks = new EnumMap<>(SignalCategory.class);

    public AutoGenerator(SignalScoringEngine engine,
                         SignalStore store,
                         PriceFeed priceFeed,
                         InstrumentUniverse universe,
                         BoundedCallExecutor boundedCalls,
                         SignalNotifier notifier,
                         ErrorMonitoringService errorMonitoringService,
                         @Qualifier("signalTaskScheduler") TaskScheduler scheduler,
                         Clock clock,
                         SignalProps props) {
        this.engine = engine;
        this.store = store;
        this.priceFeed = priceFeed;
        this.universe = universe;
        this.boundedCalls = boundedCalls;
        this.notifier = notifier;
        this.errorMonitoringService = errorMonitoringService;
        this.scheduler = scheduler;
        this.clock = clock;
        this.props = props;
        for (SignalCategory category : SignalCategory.values()) {
            epochs.put(category, new AtomicLong());
            commitLocks.put(category, new ReentrantLock());
        }
    }

    public Duration interval(SignalCategory category) {
        SignalProps.Autogen autogen = props.autogen();
        return switch (category) {
            case STANDARD -> autogen.standardInterval();
            case FAST -> autogen.fastInterval();
            case FLOW -> autogen.flowInterval();
        };
    }

    public GenerationConfig defaultConfig() {
        return GenerationConfig.builder()
                .venue(props.autogen().defaultVenue())
                .marketKind(props.autogen().defaultMarketKind())
                .build();
    }

    /**
     * Replaces any running schedule for the category, generates once right away and then every
     * interval. At most one schedule per category exists at any time.
     */
    public synchronized List<Signal> start(SignalCategory category, GenerationConfig config) {
        GenerationConfig effective = config != null ? config : defaultConfig();
        cancel(category);
        long epoch = epochs.get(category).get();
        configs.put(category, effective);
        persistEnabled(category, true, effective);

        store.markGenerated(category, clock.instant());
        List<Signal> first = generate(category, effective, epoch);

        Duration interval = interval(category);
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> runScheduled(category, epoch),
                clock.instant().plus(interval), interval);
        schedules.put(category, future);
        log.info("autogen_started category={} venue={} marketKind={} interval={} firstBatch={}",
                category, effective.getVenue(), effective.getMarketKind(), interval, first.size());
        return first;
    }

    public synchronized void stop(SignalCategory category) {
        boolean cancelled = cancel(category);
        configs.remove(category);
        persistEnabled(category, false, null);
        log.info("autogen_stopped category={} wasRunning={}", category, cancelled);
    }

    public synchronized void stopAll() {
        for (SignalCategory category : SignalCategory.values()) {
            stop(category);
        }
    }

    public boolean isScheduled(SignalCategory category) {
        ScheduledFuture<?> future = schedules.get(category);
        return future != null && !future.isCancelled();
    }

    public boolean isEnabled(SignalCategory category) {
        return store.getPreferences().get(category).isEnabled();
    }

    /**
     * @return seconds until the next scheduled run, 0 when overdue or not scheduled
     */
    public long secondsUntilNext(SignalCategory category, Instant now) {
        if (!isScheduled(category)) {
            return 0;
        }
        Long last = store.getPreferences().get(category).getLastGeneratedAt();
        if (last == null) {
            return 0;
        }
        Instant next = Instant.ofEpochMilli(last).plus(interval(category));
        return Math.max(0, Duration.between(now, next).getSeconds());
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(3)
    public void onReady() {
        if (props.autogen().resumeOnStartup()) {
            resumeFromPreferences();
        }
    }

    public void resumeFromPreferences() {
        AutoGenPreferences preferences = store.getPreferences();
        for (SignalCategory category : SignalCategory.values()) {
            AutoGenPreferences.CategoryPreference pref = preferences.get(category);
            if (!pref.isEnabled()) continue;
            GenerationConfig config = pref.getConfig() != null ? pref.getConfig() : defaultConfig();
            log.info("autogen_resume category={} venue={} marketKind={}", category, config.getVenue(), config.getMarketKind());
            try {
                start(category, config);
            } catch (Exception e) {
                errorMonitoringService.recordError("autogen", "resume failed category=" + category, e);
            }
        }
    }

    /**
     * One generation pass without touching the schedule.
     */
    public List<Signal> generateNow(SignalCategory category, GenerationConfig config) {
        return generate(category, config != null ? config : defaultConfig(), epochs.get(category).get());
    }

    @PreDestroy
    public void shutdown() {
        // preferences stay as they are so the next start resumes
        for (SignalCategory category : SignalCategory.values()) {
            cancel(category);
        }
    }

    void runScheduled(SignalCategory category, long epoch) {
        GenerationConfig config = configs.get(category);
        if (config == null || !isCurrent(category, epoch)) return;
        try {
            store.markGenerated(category, clock.instant());
            generate(category, config, epoch);
        } catch (Exception e) {
            errorMonitoringService.recordError("autogen", "scheduled run failed category=" + category, e);
        }
    }

    List<Signal> generate(SignalCategory category, GenerationConfig config, long epoch) {
        List<Instrument> instruments = universe.instruments(category, config.getVenue());
        int points = props.feed().historyPoints();
        Duration timeout = props.feed().timeout();

        List<Signal> batch = new ArrayList<>();
        for (Instrument instrument : instruments) {
            try {
                Optional<PriceSeries> series = boundedCalls.call("history:" + instrument.pair(),
                        () -> priceFeed.history(instrument.pair(), instrument.venue(), config.getMarketKind(), points),
                        timeout, Optional.empty());
                if (series.isEmpty()) {
                    log.debug("autogen_no_history pair={} category={}", instrument.pair(), category);
                    continue;
                }
                engine.evaluate(series.get(), category, config.getMarketKind()).ifPresent(batch::add);
            } catch (Exception e) {
                errorMonitoringService.recordError("autogen", "pair " + instrument.pair() + " category=" + category, e);
            }
        }

        if (batch.isEmpty()) {
            log.info("autogen_batch_empty category={} scanned={}", category, instruments.size());
            return List.of();
        }

        ReentrantLock commitLock = commitLocks.get(category);
        commitLock.lock();
        try {
            if (!isCurrent(category, epoch)) {
                log.info("autogen_batch_discarded category={} generated={} reason=schedule_changed", category, batch.size());
                return List.of();
            }
            store.replaceActive(category, batch);
        } finally {
            commitLock.unlock();
        }
        notifier.notify(SignalEvent.batch(category, batch.size(), clock.instant()));
        log.info("autogen_batch category={} scanned={} generated={}", category, instruments.size(), batch.size());
        return List.copyOf(batch);
    }

    private boolean isCurrent(SignalCategory category, long epoch) {
        return epochs.get(category).get() == epoch;
    }

    /**
     * Cancels the category's schedule. Once this returns, no run started before it can write the partition.
     */
    private boolean cancel(SignalCategory category) {
        ScheduledFuture<?> existing = schedules.remove(category);
        if (existing != null) {
            existing.cancel(false);
        }
        ReentrantLock commitLock = commitLocks.get(category);
        commitLock.lock();
        try {
            epochs.get(category).incrementAndGet();
        } finally {
            commitLock.unlock();
        }
        return existing != null;
    }

    private void persistEnabled(SignalCategory category, boolean enabled, GenerationConfig config) {
        AutoGenPreferences preferences = store.getPreferences();
        AutoGenPreferences.CategoryPreference pref = preferences.get(category);
        pref.setEnabled(enabled);
        if (config != null) {
            pref.setConfig(config);
        }
        store.setPreferences(preferences);
    }
}
