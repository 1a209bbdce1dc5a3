package com.kotsin.advisor.feed;

import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.VenueKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * Synthetic hourly history for instruments without a live source. It never reports a live price,
 * so the monitor falls back to its own price walk for these pairs.
 */
@Component
@Slf4j
public class SimulatedPriceFeed implements PriceFeed {

    private static final Map<String, Double> BASE_PRICES = new LinkedHashMap<>();

    static {
        BASE_PRICES.put("BTC", 97500.0);
        BASE_PRICES.put("ETH", 3350.0);
        BASE_PRICES.put("BNB", 620.0);
        BASE_PRICES.put("XRP", 1.42);
        BASE_PRICES.put("ADA", 0.98);
        BASE_PRICES.put("SOL", 131.0);
        BASE_PRICES.put("DOGE", 0.38);
        BASE_PRICES.put("DOT", 6.85);
        BASE_PRICES.put("AVAX", 38.5);
        BASE_PRICES.put("LINK", 20.5);
        BASE_PRICES.put("LTC", 95.0);
        BASE_PRICES.put("SHIB", 0.000025);
        BASE_PRICES.put("EUR", 1.08);
        BASE_PRICES.put("GBP", 1.27);
        BASE_PRICES.put("JPY", 150.0);
        BASE_PRICES.put("CHF", 0.88);
        BASE_PRICES.put("AUD", 0.65);
        BASE_PRICES.put("CAD", 1.39);
        BASE_PRICES.put("NZD", 0.59);
        BASE_PRICES.put("XAU", 2050.0);
    }

    private final Random random;

    public SimulatedPriceFeed() {
        this(new Random());
    }

    SimulatedPriceFeed(Random random) {
        this.random = random;
    }

    @Override
    public OptionalDouble currentPrice(String pair) {
        return OptionalDouble.empty();
    }

    @Override
    public Optional<PriceSeries> history(String pair, VenueKind venue, MarketKind marketKind, int points) {
        double price = basePrice(pair, venue);
        double trendDirection = random.nextBoolean() ? 1 : -1;
        double trendStrength = 0.0005 + random.nextDouble() * 0.001;
        double baseVolume = venue == VenueKind.FOREX ? 1_000_000 : 100;
        long now = System.currentTimeMillis();

        double[] prices = new double[points];
        double[] volumes = new double[points];
        long[] timestamps = new long[points];
        for (int i = 0; i < points; i++) {
            double change = trendDirection * trendStrength
                    + (random.nextDouble() - 0.5) * 0.018
                    + (random.nextDouble() - 0.5) * 0.004;
            price = price * (1 + change);
            prices[i] = price;
            volumes[i] = baseVolume * (0.5 + random.nextDouble());
            timestamps[i] = now - (long) (points - i) * 3_600_000L;
        }
        log.debug("simulated_history pair={} points={} last={}", pair, points, price);
        return Optional.of(new PriceSeries(pair, venue, prices, volumes, timestamps));
    }

    static double basePrice(String pair, VenueKind venue) {
        String upper = pair.toUpperCase();
        for (Map.Entry<String, Double> e : BASE_PRICES.entrySet()) {
            if (upper.startsWith(e.getKey()) || upper.contains("/" + e.getKey()) && venue == VenueKind.FOREX) {
                return e.getValue();
            }
        }
        return venue == VenueKind.FOREX ? 1.1 : 100.0;
    }
}
