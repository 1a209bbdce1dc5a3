package com.kotsin.advisor.autogen;

import com.kotsin.advisor.TestSignalProps;
import com.kotsin.advisor.config.SignalProps;
import com.kotsin.advisor.feed.BoundedCallExecutor;
import com.kotsin.advisor.feed.PriceFeed;
import com.kotsin.advisor.model.AutoGenPreferences;
import com.kotsin.advisor.model.GenerationConfig;
import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.SignalDirection;
import com.kotsin.advisor.model.SignalEvent;
import com.kotsin.advisor.model.VenueKind;
import com.kotsin.advisor.notification.SignalNotifier;
import com.kotsin.advisor.scoring.SignalScoringEngine;
import com.kotsin.advisor.service.ErrorMonitoringService;
import com.kotsin.advisor.store.InMemorySignalStore;
import com.kotsin.advisor.store.SignalRecordNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutoGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private SignalScoringEngine engine;
    @Mock
    private PriceFeed priceFeed;
    @Mock
    private SignalNotifier notifier;
    @Mock
    private TaskScheduler scheduler;
    @Mock
    private ScheduledFuture<Object> firstFuture;
    @Mock
    private ScheduledFuture<Object> secondFuture;

    private ExecutorService callPool;
    private InMemorySignalStore store;
    private ErrorMonitoringService errorMonitoringService;
    private AutoGenerator generator;

    @BeforeEach
    void setUp() {
        callPool = Executors.newCachedThreadPool();
        store = new InMemorySignalStore(new SignalRecordNormalizer());
        errorMonitoringService = new ErrorMonitoringService(new SimpleMeterRegistry());
        SignalProps props = TestSignalProps.defaults();
        generator = new AutoGenerator(engine, store, priceFeed, new InstrumentUniverse(props, new Random(1)),
                new BoundedCallExecutor(callPool), notifier, errorMonitoringService, scheduler,
                Clock.fixed(NOW, ZoneOffset.UTC), props);

        lenient().when(priceFeed.history(anyString(), any(VenueKind.class), any(MarketKind.class), anyInt()))
                .thenAnswer(inv -> Optional.of(new PriceSeries(inv.getArgument(0), inv.getArgument(1),
                        new double[]{100, 101, 102}, new double[]{1, 1, 1}, null)));
    }

    @AfterEach
    void tearDown() {
        callPool.shutdownNow();
    }

    private static Signal signalFor(String pair) {
        return Signal.builder()
                .id(pair.replace("/", "") + "-1")
                .pair(pair)
                .direction(SignalDirection.LONG)
                .entryPrice(100)
                .stopLoss(97)
                .takeProfit1(102.5)
                .takeProfit2(106.5)
                .takeProfit3(108.5)
                .createdAt(NOW)
                .build();
    }

    private void engineAnswersEveryPair() {
        when(engine.evaluate(any(PriceSeries.class), any(SignalCategory.class), any(MarketKind.class)))
                .thenAnswer(inv -> Optional.of(signalFor(((PriceSeries) inv.getArgument(0)).pair())));
    }

    private static GenerationConfig cryptoFutures() {
        return GenerationConfig.builder().venue(VenueKind.CRYPTO).marketKind(MarketKind.FUTURE).build();
    }

    @Test
    @DisplayName("Starting twice leaves exactly one schedule for the category")
    void startTwiceKeepsOneTimer() {
        engineAnswersEveryPair();
        doReturn(firstFuture, secondFuture).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        generator.start(SignalCategory.STANDARD, cryptoFutures());
        generator.start(SignalCategory.STANDARD, cryptoFutures());

        verify(firstFuture).cancel(false);
        verify(secondFuture, never()).cancel(anyBoolean());
        verify(scheduler, times(2)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofMinutes(10)));
        assertTrue(generator.isScheduled(SignalCategory.STANDARD));
    }

    @Test
    @DisplayName("Start generates immediately, replaces the partition and persists the switch")
    void startGeneratesAndPersists() {
        engineAnswersEveryPair();
        doReturn(firstFuture).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        store.replaceActive(SignalCategory.STANDARD, List.of(signalFor("OLD/USDT")));

        List<Signal> batch = generator.start(SignalCategory.STANDARD, cryptoFutures());

        assertEquals(3, batch.size());
        assertEquals(List.of("BTC/USDT", "ETH/USDT", "SOL/USDT"),
                store.getActive(SignalCategory.STANDARD).stream().map(Signal::getPair).toList());
        assertTrue(store.getCompleted().isEmpty());

        AutoGenPreferences.CategoryPreference pref = store.getPreferences().get(SignalCategory.STANDARD);
        assertTrue(pref.isEnabled());
        assertEquals(NOW.toEpochMilli(), pref.getLastGeneratedAt());
        assertEquals(MarketKind.FUTURE, pref.getConfig().getMarketKind());

        verify(notifier).notify(argThat((SignalEvent e) ->
                e.getType() == SignalEvent.Type.BATCH_GENERATED && e.getCount() == 3));
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(NOW.plus(Duration.ofMinutes(10))), eq(Duration.ofMinutes(10)));
    }

    @Test
    @DisplayName("An empty batch leaves the active partition untouched")
    void emptyBatchKeepsPartition() {
        when(engine.evaluate(any(PriceSeries.class), any(SignalCategory.class), any(MarketKind.class)))
                .thenReturn(Optional.empty());
        store.replaceActive(SignalCategory.STANDARD, List.of(signalFor("OLD/USDT")));

        List<Signal> batch = generator.generateNow(SignalCategory.STANDARD, cryptoFutures());

        assertTrue(batch.isEmpty());
        assertEquals("OLD/USDT", store.getActive(SignalCategory.STANDARD).get(0).getPair());
        verifyNoInteractions(notifier);
        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("A failing pair is skipped and the rest of the batch is kept")
    void perPairIsolation() {
        when(engine.evaluate(any(PriceSeries.class), any(SignalCategory.class), any(MarketKind.class)))
                .thenAnswer(inv -> {
                    String pair = ((PriceSeries) inv.getArgument(0)).pair();
                    if (pair.equals("ETH/USDT")) {
                        throw new IllegalStateException("bad series");
                    }
                    return Optional.of(signalFor(pair));
                });

        List<Signal> batch = generator.generateNow(SignalCategory.STANDARD, cryptoFutures());

        assertEquals(List.of("BTC/USDT", "SOL/USDT"), batch.stream().map(Signal::getPair).toList());
        assertEquals(1, errorMonitoringService.errorCount("autogen"));
    }

    @Test
    @DisplayName("Fast runs scan a sample of the universe")
    void fastSamplesUniverse() {
        engineAnswersEveryPair();

        List<Signal> batch = generator.generateNow(SignalCategory.FAST, cryptoFutures());

        assertEquals(2, batch.size());
        verify(priceFeed, times(2)).history(anyString(), eq(VenueKind.CRYPTO), eq(MarketKind.FUTURE), eq(100));
    }

    @Test
    @DisplayName("Stop cancels the schedule and persists the switch")
    void stopCancels() {
        engineAnswersEveryPair();
        doReturn(firstFuture).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        generator.start(SignalCategory.FLOW, cryptoFutures());

        generator.stop(SignalCategory.FLOW);

        verify(firstFuture).cancel(false);
        assertFalse(generator.isScheduled(SignalCategory.FLOW));
        assertFalse(generator.isEnabled(SignalCategory.FLOW));
        assertEquals(0, generator.secondsUntilNext(SignalCategory.FLOW, NOW));
    }

    @Test
    @DisplayName("Stopping a category that never started is a no-op")
    void stopWithoutStart() {
        generator.stop(SignalCategory.FAST);
        assertFalse(generator.isScheduled(SignalCategory.FAST));
        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("The scheduled run marks the category and generates a fresh batch")
    void scheduledRun() {
        engineAnswersEveryPair();
        doReturn(firstFuture).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        generator.start(SignalCategory.STANDARD, cryptoFutures());
        when(firstFuture.isCancelled()).thenReturn(false);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(task.capture(), any(Instant.class), any(Duration.class));
        store.replaceActive(SignalCategory.STANDARD, List.of());

        task.getValue().run();

        assertEquals(3, store.getActive(SignalCategory.STANDARD).size());
        verify(notifier, times(2)).notify(any(SignalEvent.class));
        assertEquals(600, generator.secondsUntilNext(SignalCategory.STANDARD, NOW));
    }

    @Test
    @DisplayName("Enabled categories resume with their stored configuration")
    void resumesFromPreferences() {
        engineAnswersEveryPair();
        doReturn(firstFuture).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        AutoGenPreferences prefs = store.getPreferences();
        prefs.get(SignalCategory.STANDARD).setEnabled(true);
        prefs.get(SignalCategory.STANDARD).setConfig(GenerationConfig.builder()
                .venue(VenueKind.FOREX).marketKind(MarketKind.SPOT).build());
        store.setPreferences(prefs);

        generator.resumeFromPreferences();

        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        verify(priceFeed).history(eq("EUR/USD"), eq(VenueKind.FOREX), eq(MarketKind.SPOT), anyInt());
        verify(engine, times(2)).evaluate(any(PriceSeries.class), eq(SignalCategory.STANDARD), eq(MarketKind.SPOT));
        assertFalse(generator.isScheduled(SignalCategory.FAST));
    }

    @Test
    @DisplayName("A scheduled run still in flight when stop() returns does not touch the partition")
    void stopDiscardsInFlightRun() throws Exception {
        AtomicBoolean holdRuns = new AtomicBoolean(false);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(engine.evaluate(any(PriceSeries.class), any(SignalCategory.class), any(MarketKind.class)))
                .thenAnswer(inv -> {
                    if (holdRuns.get()) {
                        entered.countDown();
                        release.await(5, TimeUnit.SECONDS);
                    }
                    return Optional.of(signalFor(((PriceSeries) inv.getArgument(0)).pair()));
                });
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        doReturn(firstFuture).when(scheduler)
                .scheduleAtFixedRate(task.capture(), any(Instant.class), any(Duration.class));

        generator.start(SignalCategory.STANDARD, cryptoFutures());
        holdRuns.set(true);
        Thread run = new Thread(task.getValue());
        run.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        generator.stop(SignalCategory.STANDARD);
        store.replaceActive(SignalCategory.STANDARD, List.of(signalFor("KEEP/USDT")));
        release.countDown();
        run.join(5000);

        assertFalse(run.isAlive());
        assertEquals(List.of("KEEPUSDT-1"),
                store.getActive(SignalCategory.STANDARD).stream().map(Signal::getId).toList());
        verify(notifier, times(1)).notify(argThat((SignalEvent e) -> e.getType() == SignalEvent.Type.BATCH_GENERATED));
    }

    @Test
    @DisplayName("A run from the replaced schedule cannot overwrite the new schedule's batch")
    void restartDiscardsRunFromOldSchedule() {
        engineAnswersEveryPair();
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        doReturn(firstFuture, secondFuture).when(scheduler)
                .scheduleAtFixedRate(task.capture(), any(Instant.class), any(Duration.class));

        generator.start(SignalCategory.STANDARD, cryptoFutures());
        generator.start(SignalCategory.STANDARD, cryptoFutures());
        store.replaceActive(SignalCategory.STANDARD, List.of(signalFor("KEEP/USDT")));

        task.getAllValues().get(0).run();
        assertEquals(List.of("KEEPUSDT-1"),
                store.getActive(SignalCategory.STANDARD).stream().map(Signal::getId).toList());

        task.getAllValues().get(1).run();
        assertEquals(3, store.getActive(SignalCategory.STANDARD).size());
    }
}
