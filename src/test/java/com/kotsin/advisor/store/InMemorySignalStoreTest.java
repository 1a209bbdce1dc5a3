package com.kotsin.advisor.store;

import com.kotsin.advisor.model.AutoGenPreferences;
import com.kotsin.advisor.model.GenerationConfig;
import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.SignalDirection;
import com.kotsin.advisor.model.SignalStatus;
import com.kotsin.advisor.model.VenueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySignalStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private InMemorySignalStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySignalStore(new SignalRecordNormalizer());
    }

    private static Signal signal(String id) {
        return Signal.builder()
                .id(id)
                .pair("BTC/USDT")
                .direction(SignalDirection.LONG)
                .entryPrice(100)
                .stopLoss(97)
                .takeProfit(110)
                .takeProfit1(102.5)
                .takeProfit2(106.5)
                .takeProfit3(108.5)
                .currentPrice(100)
                .createdAt(NOW.minus(Duration.ofHours(2)))
                .build();
    }

    @Test
    @DisplayName("Archiving a signal that hit TP3 books TP3 and leaves the active partition")
    void archiveAtTp3() {
        Signal s = signal("a").toBuilder()
                .tp1Hit(true).tp2Hit(true).tp3Hit(true)
                .status(SignalStatus.COMPLETED)
                .currentPrice(109)
                .build();
        store.replaceActive(SignalCategory.STANDARD, List.of(s, signal("b")));

        Optional<Signal> archived = store.archive("a", SignalCategory.STANDARD, NOW);

        assertTrue(archived.isPresent());
        assertEquals(8.5, archived.get().getProfitLossPercentage(), 1e-9);
        assertEquals(SignalStatus.COMPLETED, archived.get().getStatus());
        assertEquals(NOW, archived.get().getCompletedAt());
        assertEquals(SignalCategory.STANDARD, archived.get().getArchivedCategory());

        assertEquals(List.of("b"), store.getActive(SignalCategory.STANDARD).stream().map(Signal::getId).toList());
        assertEquals(1, store.getCompleted().size());
        assertEquals("a", store.getCompleted().get(0).getId());
    }

    @Test
    @DisplayName("Archiving a signal that only hit TP2 books TP2")
    void archiveAtTp2() {
        Signal s = signal("a").toBuilder().tp1Hit(true).tp2Hit(true).currentPrice(107).build();
        store.replaceActive(SignalCategory.FAST, List.of(s));

        Signal archived = store.archive("a", SignalCategory.FAST, NOW).orElseThrow();

        assertEquals(6.5, archived.getProfitLossPercentage(), 1e-9);
        assertEquals(SignalStatus.COMPLETED, archived.getStatus());
    }

    @Test
    @DisplayName("A stopped signal keeps its status when archived")
    void archiveKeepsStopped() {
        Signal s = signal("a").toBuilder().status(SignalStatus.STOPPED).currentPrice(96).build();
        store.replaceActive(SignalCategory.STANDARD, List.of(s));

        Signal archived = store.archive("a", SignalCategory.STANDARD, NOW).orElseThrow();

        assertEquals(SignalStatus.STOPPED, archived.getStatus());
        assertEquals(-4.0, archived.getProfitLossPercentage(), 1e-9);
    }

    @Test
    @DisplayName("Archiving an unknown id is a no-op")
    void archiveMiss() {
        store.replaceActive(SignalCategory.STANDARD, List.of(signal("a")));
        assertTrue(store.archive("missing", SignalCategory.STANDARD, NOW).isEmpty());
        assertEquals(1, store.getActive(SignalCategory.STANDARD).size());
        assertTrue(store.getCompleted().isEmpty());
    }

    @Test
    @DisplayName("A failed archive append leaves the signal in its active partition")
    void failedAppendKeepsSignalActive() {
        InMemorySignalStore failing = new InMemorySignalStore(new SignalRecordNormalizer()) {
            @Override
            protected void appendCompleted(Signal signal) {
                throw new IllegalStateException("archive unavailable");
            }
        };
        failing.replaceActive(SignalCategory.STANDARD, List.of(signal("a"), signal("b")));

        assertThrows(IllegalStateException.class, () -> failing.archive("a", SignalCategory.STANDARD, NOW));

        assertEquals(List.of("a", "b"),
                failing.getActive(SignalCategory.STANDARD).stream().map(Signal::getId).toList());
        assertTrue(failing.getCompleted().isEmpty());
    }

    @Test
    @DisplayName("Duplicate ids collapse to the first occurrence")
    void dedupe() {
        Signal first = signal("dup");
        Signal second = signal("dup").toBuilder().entryPrice(200).build();
        store.replaceActive(SignalCategory.STANDARD, List.of(first, second, signal("other")));

        List<Signal> active = store.getActive(SignalCategory.STANDARD);
        assertEquals(2, active.size());
        assertEquals(100, active.get(0).getEntryPrice(), 1e-9);
    }

    @Test
    @DisplayName("Writing one category never touches its siblings")
    void siblingIsolation() {
        store.replaceActive(SignalCategory.STANDARD, List.of(signal("s1")));
        store.replaceActive(SignalCategory.FAST, List.of(signal("f1"), signal("f2")));

        store.replaceActive(SignalCategory.FAST, List.of(signal("f3")));
        store.upsert(signal("s2"), SignalCategory.STANDARD);

        assertEquals(2, store.getActive(SignalCategory.STANDARD).size());
        assertEquals(1, store.getActive(SignalCategory.FAST).size());
        assertTrue(store.getActive(SignalCategory.FLOW).isEmpty());
        assertEquals(3, store.getAllActive().size());
    }

    @Test
    @DisplayName("Upsert replaces by id in place")
    void upsertReplaces() {
        store.replaceActive(SignalCategory.STANDARD, List.of(signal("a"), signal("b")));
        store.upsert(signal("a").toBuilder().currentPrice(104).build(), SignalCategory.STANDARD);

        List<Signal> active = store.getActive(SignalCategory.STANDARD);
        assertEquals(List.of("a", "b"), active.stream().map(Signal::getId).toList());
        assertEquals(104, active.get(0).getCurrentPrice(), 1e-9);
    }

    @Test
    @DisplayName("Returned lists are copies")
    void defensiveCopies() {
        store.replaceActive(SignalCategory.STANDARD, List.of(signal("a")));
        List<Signal> active = store.getActive(SignalCategory.STANDARD);
        active.clear();
        assertEquals(1, store.getActive(SignalCategory.STANDARD).size());
    }

    @Test
    @DisplayName("Only old terminal signals are cleared")
    void clearExpired() {
        Instant old = NOW.minus(Duration.ofHours(30));
        List<Signal> signals = new ArrayList<>();
        signals.add(signal("old-stopped").toBuilder().createdAt(old).status(SignalStatus.STOPPED).build());
        signals.add(signal("old-active").toBuilder().createdAt(old).build());
        signals.add(signal("new-completed").toBuilder().status(SignalStatus.COMPLETED).build());
        store.replaceActive(SignalCategory.STANDARD, signals);
        store.replaceActive(SignalCategory.FLOW, List.of(
                signal("flow-old").toBuilder().createdAt(old).status(SignalStatus.COMPLETED).build()));

        int removed = store.clearExpired(Duration.ofHours(24), NOW);

        assertEquals(2, removed);
        assertEquals(List.of("old-active", "new-completed"),
                store.getActive(SignalCategory.STANDARD).stream().map(Signal::getId).toList());
        assertTrue(store.getActive(SignalCategory.FLOW).isEmpty());
    }

    @Test
    @DisplayName("Preferences round-trip and markGenerated stamps the category")
    void preferences() {
        AutoGenPreferences prefs = store.getPreferences();
        prefs.get(SignalCategory.FAST).setEnabled(true);
        prefs.get(SignalCategory.FAST).setConfig(GenerationConfig.builder()
                .venue(VenueKind.FOREX).marketKind(MarketKind.SPOT).build());
        store.setPreferences(prefs);

        store.markGenerated(SignalCategory.FAST, NOW);

        AutoGenPreferences read = store.getPreferences();
        assertTrue(read.get(SignalCategory.FAST).isEnabled());
        assertEquals(NOW.toEpochMilli(), read.get(SignalCategory.FAST).getLastGeneratedAt());
        assertEquals(VenueKind.FOREX, read.get(SignalCategory.FAST).getConfig().getVenue());
        assertFalse(read.get(SignalCategory.STANDARD).isEnabled());
    }

    @Test
    void clearAll() {
        store.replaceActive(SignalCategory.STANDARD, List.of(signal("a")));
        store.archive("a", SignalCategory.STANDARD, NOW);
        store.replaceActive(SignalCategory.FAST, List.of(signal("b")));

        store.clearAll();

        assertTrue(store.getAllActive().isEmpty());
        assertTrue(store.getCompleted().isEmpty());
    }
}
