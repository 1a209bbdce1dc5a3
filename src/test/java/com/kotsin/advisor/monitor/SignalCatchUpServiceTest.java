package com.kotsin.advisor.monitor;

import com.kotsin.advisor.TestSignalProps;
import com.kotsin.advisor.feed.BoundedCallExecutor;
import com.kotsin.advisor.feed.PriceFeed;
import com.kotsin.advisor.lifecycle.SignalLifecycle;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.SignalDirection;
import com.kotsin.advisor.model.SignalEvent;
import com.kotsin.advisor.model.SignalStatus;
import com.kotsin.advisor.notification.SignalNotifier;
import com.kotsin.advisor.service.ErrorMonitoringService;
import com.kotsin.advisor.store.InMemorySignalStore;
import com.kotsin.advisor.store.SignalRecordNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SignalCatchUpServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private PriceFeed priceFeed;
    @Mock
    private SignalNotifier notifier;

    private ExecutorService callPool;
    private InMemorySignalStore store;
    private ErrorMonitoringService errorMonitoringService;
    private SignalCatchUpService service;

    @BeforeEach
    void setUp() {
        callPool = Executors.newCachedThreadPool();
        errorMonitoringService = new ErrorMonitoringService(new SimpleMeterRegistry());
        store = new InMemorySignalStore(new SignalRecordNormalizer());
        service = serviceOver(store);
    }

    private SignalCatchUpService serviceOver(InMemorySignalStore target) {
        return new SignalCatchUpService(target, new SignalLifecycle(), priceFeed, new BoundedCallExecutor(callPool),
                notifier, errorMonitoringService, Clock.fixed(NOW, ZoneOffset.UTC), TestSignalProps.defaults());
    }

    /**
     * Store that lets another writer run once, right after the first non-empty partition read.
     */
    private static InMemorySignalStore storeWithWriterAfterRead(Consumer<InMemorySignalStore> writer) {
        return new InMemorySignalStore(new SignalRecordNormalizer()) {
            private boolean fired;

            @Override
            public List<Signal> getActive(SignalCategory category) {
                List<Signal> snapshot = super.getActive(category);
                if (!fired && !snapshot.isEmpty()) {
                    fired = true;
                    writer.accept(this);
                }
                return snapshot;
            }
        };
    }

    @AfterEach
    void tearDown() {
        callPool.shutdownNow();
    }

    private static Signal signal(String id, String pair, double currentPrice) {
        return Signal.builder()
                .id(id)
                .pair(pair)
                .direction(SignalDirection.LONG)
                .entryPrice(100)
                .stopLoss(97)
                .takeProfit(110)
                .takeProfit1(102.5)
                .takeProfit2(106.5)
                .takeProfit3(108.5)
                .currentPrice(currentPrice)
                .createdAt(NOW.minus(Duration.ofHours(3)))
                .expiresAt(NOW.plus(Duration.ofHours(20)))
                .build();
    }

    @Test
    @DisplayName("A price past TP3 after a gap completes the signal with every target credited")
    void completesBeyondTp3() {
        store.replaceActive(SignalCategory.STANDARD, List.of(signal("a", "BTC/USDT", 100)));
        when(priceFeed.currentPrice("BTC/USDT")).thenReturn(OptionalDouble.of(112));

        CatchUpReport report = service.reconcileAll();

        assertEquals(new CatchUpReport(1, 1, 0, 0, 0, 0), report);
        assertTrue(store.getActive(SignalCategory.STANDARD).isEmpty());
        Signal archived = store.getCompleted().get(0);
        assertTrue(archived.isTp1Hit() && archived.isTp2Hit() && archived.isTp3Hit());
        assertEquals(8.5, archived.getProfitLossPercentage(), 1e-9);
        verify(notifier).notify(argThat((SignalEvent e) -> e.getType() == SignalEvent.Type.SIGNAL_COMPLETED));
    }

    @Test
    @DisplayName("Signals that are still open are updated in place across categories")
    void updatesOpenSignals() {
        store.replaceActive(SignalCategory.FAST, List.of(signal("f", "ETH/USDT", 100)));
        store.replaceActive(SignalCategory.FLOW, List.of(signal("s", "SOL/USDT", 100)));
        when(priceFeed.currentPrice("ETH/USDT")).thenReturn(OptionalDouble.of(103));
        when(priceFeed.currentPrice("SOL/USDT")).thenReturn(OptionalDouble.of(95));

        CatchUpReport report = service.reconcileAll();

        assertEquals(2, report.checked());
        assertEquals(1, report.updated());
        assertEquals(1, report.stopped());
        Signal open = store.getActive(SignalCategory.FAST).get(0);
        assertTrue(open.isTp1Hit());
        assertEquals(SignalStatus.ACTIVE, open.getStatus());
        assertEquals(SignalStatus.STOPPED, store.getCompleted().get(0).getStatus());
    }

    @Test
    @DisplayName("Without a live price the last known price is used")
    void usesLastKnownPrice() {
        store.replaceActive(SignalCategory.STANDARD, List.of(signal("a", "EUR/USD", 107)));
        when(priceFeed.currentPrice("EUR/USD")).thenReturn(OptionalDouble.empty());

        CatchUpReport report = service.reconcileAll();

        assertEquals(1, report.completed());
        assertEquals(6.5, store.getCompleted().get(0).getProfitLossPercentage(), 1e-9);
    }

    @Test
    @DisplayName("Empty store reconciles nothing")
    void emptyStore() {
        assertEquals(new CatchUpReport(0, 0, 0, 0, 0, 0), service.reconcileAll());
        verifyNoInteractions(priceFeed);
        verify(notifier, never()).notify(any(SignalEvent.class));
    }

    @Test
    @DisplayName("A signal archived by the monitor while catch-up runs stays archived")
    void archivedMeanwhileIsNotResurrected() {
        InMemorySignalStore racing = storeWithWriterAfterRead(st -> {
            st.updateActive(SignalCategory.STANDARD, current -> {
                current.set(0, current.get(0).toBuilder().status(SignalStatus.STOPPED).build());
                return current;
            });
            st.archive("x", SignalCategory.STANDARD, NOW);
        });
        racing.replaceActive(SignalCategory.STANDARD, List.of(signal("x", "BTC/USDT", 100)));
        when(priceFeed.currentPrice("BTC/USDT")).thenReturn(OptionalDouble.of(112));

        CatchUpReport report = serviceOver(racing).reconcileAll();

        assertEquals(new CatchUpReport(1, 0, 0, 0, 1, 0), report);
        assertTrue(racing.getActive(SignalCategory.STANDARD).isEmpty());
        List<Signal> completed = racing.getCompleted();
        assertEquals(1, completed.size());
        assertEquals(SignalStatus.STOPPED, completed.get(0).getStatus());
        verify(notifier, never()).notify(any(SignalEvent.class));
    }

    @Test
    @DisplayName("Targets credited by the monitor while catch-up runs are not rolled back")
    void keepsProgressWrittenMeanwhile() {
        InMemorySignalStore racing = storeWithWriterAfterRead(st ->
                st.updateActive(SignalCategory.STANDARD, current -> {
                    current.set(0, current.get(0).toBuilder()
                            .tp1Hit(true)
                            .tp1HitTime(NOW.minus(Duration.ofMinutes(1)))
                            .build());
                    return current;
                }));
        racing.replaceActive(SignalCategory.STANDARD, List.of(signal("x", "BTC/USDT", 100)));
        when(priceFeed.currentPrice("BTC/USDT")).thenReturn(OptionalDouble.of(101));

        CatchUpReport report = serviceOver(racing).reconcileAll();

        assertEquals(1, report.updated());
        Signal stored = racing.getActive(SignalCategory.STANDARD).get(0);
        assertTrue(stored.isTp1Hit());
        assertEquals(101, stored.getCurrentPrice(), 1e-9);
        assertEquals(SignalStatus.ACTIVE, stored.getStatus());
    }
}
