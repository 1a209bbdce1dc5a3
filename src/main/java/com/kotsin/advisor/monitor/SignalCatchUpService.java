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
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Re-checks every active signal against the current price after a gap in monitoring, so targets
 * crossed while nothing was watching are still credited.
 */
@Service
@Slf4j
public class SignalCatchUpService {

    private final SignalStore store;
    private final SignalLifecycle lifecycle;
    private final PriceFeed priceFeed;
    private final BoundedCallExecutor boundedCalls;
    private final SignalNotifier notifier;
    private final ErrorMonitoringService errorMonitoringService;
    private final Clock clock;
    private final Duration timeout;
    private final boolean onStartup;

    public SignalCatchUpService(SignalStore store,
                                SignalLifecycle lifecycle,
                                PriceFeed priceFeed,
                                BoundedCallExecutor boundedCalls,
                                SignalNotifier notifier,
                                ErrorMonitoringService errorMonitoringService,
                                Clock clock,
                                SignalProps props) {
        this.store = store;
        this.lifecycle = lifecycle;
        this.priceFeed = priceFeed;
        this.boundedCalls = boundedCalls;
        this.notifier = notifier;
        this.errorMonitoringService = errorMonitoringService;
        this.clock = clock;
        this.timeout = props.feed().timeout();
        this.onStartup = props.catchup().onStartup();
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void onReady() {
        if (onStartup) {
            reconcileAll();
        }
    }

    public CatchUpReport reconcileAll() {
        int checked = 0;
        int completed = 0;
        int stopped = 0;
        int updated = 0;
        int skipped = 0;
        int failed = 0;

        for (SignalCategory category : SignalCategory.values()) {
            List<Signal> active = store.getActive(category);
            if (active.isEmpty()) continue;
            log.info("catchup_start category={} signals={}", category, active.size());

            for (Signal signal : active) {
                if (signal.getStatus() != SignalStatus.ACTIVE) continue;
                checked++;
                try {
                    Signal next = reconcileOne(signal, category).orElse(null);
                    if (next == null) skipped++;
                    else if (next.getStatus() == SignalStatus.COMPLETED) completed++;
                    else if (next.getStatus() == SignalStatus.STOPPED) stopped++;
                    else updated++;
                } catch (Exception e) {
                    failed++;
                    errorMonitoringService.recordError("catchup", "signal " + signal.getId() + " pair=" + signal.getPair(), e);
                }
            }
        }

        CatchUpReport report = new CatchUpReport(checked, completed, stopped, updated, skipped, failed);
        log.info("catchup_done checked={} completed={} stopped={} updated={} skipped={} failed={}",
                checked, completed, stopped, updated, skipped, failed);
        return report;
    }

    /**
     * The transition is applied to the partition's current copy of the signal, not the snapshot the
     * pass started from, so progress written by the monitor in the meantime is kept. A signal that is
     * no longer active there (archived or closed by another writer) is left alone.
     */
    private Optional<Signal> reconcileOne(Signal signal, SignalCategory category) {
        OptionalDouble live = boundedCalls.call("price:" + signal.getPair(),
                () -> priceFeed.currentPrice(signal.getPair()), timeout, OptionalDouble.empty());
        double price = live.orElse(signal.getCurrentPrice() > 0 ? signal.getCurrentPrice() : signal.getEntryPrice());

        Instant now = clock.instant();
        AtomicReference<Signal> applied = new AtomicReference<>();
        store.updateActive(category, current -> {
            applied.set(null);
            List<Signal> next = new ArrayList<>(current.size());
            for (Signal stored : current) {
                if (applied.get() == null && stored.getId().equals(signal.getId())
                        && stored.getStatus() == SignalStatus.ACTIVE) {
                    Signal reconciled = lifecycle.reconcile(stored, price, now);
                    applied.set(reconciled);
                    next.add(reconciled);
                } else {
                    next.add(stored);
                }
            }
            return next;
        });

        Signal next = applied.get();
        if (next == null) {
            log.debug("catchup_skip id={} category={} reason=no_longer_active", signal.getId(), category);
            return Optional.empty();
        }
        if (next.isTerminal()) {
            Optional<Signal> archived = store.archive(next.getId(), category, now);
            archived.ifPresent(a -> notifier.notify(SignalEvent.closed(a, category, now)));
        }
        return Optional.of(next);
    }
}
