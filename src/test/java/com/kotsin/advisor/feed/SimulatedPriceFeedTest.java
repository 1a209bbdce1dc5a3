package com.kotsin.advisor.feed;

import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.VenueKind;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedPriceFeedTest {

    private final SimulatedPriceFeed feed = new SimulatedPriceFeed(new Random(5));

    @Test
    void historyHasTheRequestedShape() {
        PriceSeries series = feed.history("ETH/USDT", VenueKind.CRYPTO, MarketKind.FUTURE, 100).orElseThrow();
        assertEquals(100, series.prices().length);
        assertEquals(100, series.volumes().length);
        assertEquals(100, series.timestamps().length);
        for (double p : series.prices()) {
            assertTrue(p > 0);
        }
        assertTrue(series.timestamps()[0] < series.timestamps()[99]);
    }

    @Test
    void neverSuppliesALivePrice() {
        assertTrue(feed.currentPrice("BTC/USDT").isEmpty());
    }

    @Test
    void unknownPairsFallBackToVenueDefaults() {
        assertEquals(100.0, SimulatedPriceFeed.basePrice("ZZZ/USDT", VenueKind.CRYPTO));
        assertEquals(1.1, SimulatedPriceFeed.basePrice("ZZZ/QQQ", VenueKind.FOREX));
    }
}
