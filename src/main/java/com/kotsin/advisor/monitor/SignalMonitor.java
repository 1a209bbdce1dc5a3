package com.kotsin.advisor.monitor;

import com.kotsin.advisor.config.SignalProps;
import com.kotsin.advisor.feed.BoundedCallExecutor;
import com.kotsin.advisor.feed.PriceFeed;
import com.kotsin.advisor.lifecycle.SignalLifecycle;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.SignalEvent;
import com.kotsin.advisor.model.SignalStatus;
import com.kotsin.advisor.notification.SignalNotifier;
import com.kotsin.advisor.service.ErrorMonitoringService;
import com.kotsin.advisor.store.SignalStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically advances every active signal against the latest price and archives the ones that
 * reach a terminal status.
 *
 * Ticks never overlap. Once {@link #stop()} returns no tick is running and none will write again.
 */
@Service
@Slf4j
public class SignalMonitor {

    private final SignalStore store;
    private final SignalLifecycle lifecycle;
    private final PriceFeed priceFeed;
    private final PriceWalkSimulator simulator;
    private final SignalNotifier notifier;
    private final ErrorMonitoringService errorMonitoringService;
    private final BoundedCallExecutor boundedCalls;
    private final TaskScheduler scheduler;
    private final ExecutorService evaluationExecutor;
    private final SignalCatchUpService catchUpService;
    private final Clock clock;
    private final SignalProps props;

    private final Counter tickCounter;
    private final Counter completedCounter;
    private final Counter stoppedCounter;
    private final Counter errorCounter;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stoppedOnce = new AtomicBoolean(false);
    private final AtomicLong ticks = new AtomicLong();
    private final ReentrantLock tickLock = new ReentrantLock();
    private final Object lifecycleMonitor = new Object();

    private volatile ScheduledFuture<?> schedule;
    private volatile Instant lastTickAt;

    public SignalMonitor(SignalStore store,
                         SignalLifecycle lifecycle,
                         PriceFeed priceFeed,
                         PriceWalkSimulator simulator,
                         SignalNotifier notifier,
                         ErrorMonitoringService errorMonitoringService,
                         BoundedCallExecutor boundedCalls,
                         @Qualifier("signalTaskScheduler") TaskScheduler scheduler,
                         @Qualifier("signalEvaluationExecutor") ExecutorService evaluationExecutor,
                         SignalCatchUpService catchUpService,
                         Clock clock,
                         SignalProps props,
                         MeterRegistry meterRegistry) {
        this.store = store;
        this.lifecycle = lifecycle;
        this.priceFeed = priceFeed;
        this.simulator = simulator;
        this.notifier = notifier;
        this.errorMonitoringService = errorMonitoringService;
        this.boundedCalls = boundedCalls;
        this.scheduler = scheduler;
        this.evaluationExecutor = evaluationExecutor;
        this.catchUpService = catchUpService;
        this.clock = clock;
        this.props = props;
        this.tickCounter = meterRegistry.counter("signals.monitor.ticks");
        this.completedCounter = meterRegistry.counter("signals.completed");
        this.stoppedCounter = meterRegistry.counter("signals.stopped");
        this.errorCounter = meterRegistry.counter("signals.monitor.errors");
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(2)
    public void onReady() {
        if (props.monitor().autoStart()) {
            start();
        }
    }

    /**
     * Starts ticking. Calling it while already running is a no-op. A restart after {@link #stop()}
     * reconciles the gap before the first tick.
     */
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running.get()) {
                log.debug("monitor_start_ignored reason=already_running");
                return;
            }
            if (stoppedOnce.get()) {
                CatchUpReport report = catchUpService.reconcileAll();
                log.info("monitor_restart_catchup checked={} completed={} stopped={}",
                        report.checked(), report.completed(), report.stopped());
            }
            running.set(true);
            Duration interval = props.monitor().interval();
            schedule = scheduler.scheduleAtFixedRate(this::tick, interval);
            log.info("monitor_started interval={}", interval);
        }
    }

    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running.getAndSet(false)) {
                return;
            }
            stoppedOnce.set(true);
            ScheduledFuture<?> current = schedule;
            if (current != null) {
                current.cancel(false);
            }
            schedule = null;
        }
        // wait out an in-flight tick
        tickLock.lock();
        tickLock.unlock();
        log.info("monitor_stopped ticks={}", ticks.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    public MonitorStats stats() {
        return new MonitorStats(running.get(), ticks.get(), store.getAllActive().size(), lastTickAt);
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    void tick() {
        if (!running.get() || !tickLock.tryLock()) {
            return;
        }
        try {
            long n = ticks.incrementAndGet();
            tickCounter.increment();
            for (SignalCategory category : SignalCategory.values()) {
                if (!running.get()) return;
                try {
                    tickCategory(category);
                } catch (Exception e) {
                    errorCounter.increment();
                    errorMonitoringService.recordError("monitor", "tick failed category=" + category, e);
                }
            }
            lastTickAt = clock.instant();
            int every = props.monitor().cleanupEveryTicks();
            if (every > 0 && n % every == 0 && running.get()) {
                int removed = store.clearExpired(props.store().maxAge(), clock.instant());
                log.info("monitor_cleanup tick={} removed={}", n, removed);
            }
        } finally {
            tickLock.unlock();
        }
    }

    private void tickCategory(SignalCategory category) {
        List<Signal> active = store.getActive(category);
        if (active.isEmpty()) return;

        List<CompletableFuture<Signal>> futures = new ArrayList<>(active.size());
        for (Signal signal : active) {
            if (signal.getStatus() != SignalStatus.ACTIVE) continue;
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(signal), evaluationExecutor)
                    .exceptionally(t -> {
                        errorCounter.increment();
                        errorMonitoringService.recordError("monitor",
                                "evaluation failed id=" + signal.getId() + " pair=" + signal.getPair(), t);
                        return null;
                    }));
        }

        Map<String, Signal> evaluated = new HashMap<>();
        futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .forEach(s -> evaluated.put(s.getId(), s));
        if (evaluated.isEmpty() || !running.get()) return;

        store.updateActive(category, current -> {
            List<Signal> merged = new ArrayList<>(current.size());
            for (Signal stored : current) {
                Signal next = evaluated.get(stored.getId());
                merged.add(next != null && stored.getStatus() == SignalStatus.ACTIVE ? next : stored);
            }
            return merged;
        });

        Instant now = clock.instant();
        for (Signal s : evaluated.values()) {
            if (!s.isTerminal()) continue;
            Optional<Signal> archived = store.archive(s.getId(), category, now);
            archived.ifPresent(a -> {
                if (a.getStatus() == SignalStatus.STOPPED) stoppedCounter.increment();
                else completedCounter.increment();
                notifier.notify(SignalEvent.closed(a, category, now));
            });
        }
    }

    private Signal evaluate(Signal signal) {
        OptionalDouble live = boundedCalls.call("price:" + signal.getPair(),
                () -> priceFeed.currentPrice(signal.getPair()), props.feed().timeout(), OptionalDouble.empty());
        double price = live.isPresent() ? live.getAsDouble() : simulator.next(signal);
        return lifecycle.advance(signal, price, clock.instant());
    }
}
