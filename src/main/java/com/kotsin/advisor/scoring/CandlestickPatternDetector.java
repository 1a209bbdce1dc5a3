package com.kotsin.advisor.scoring;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Classic reversal and continuation patterns over candles synthesised from close prices.
 *
 * Each candle aggregates {@link #CLOSES_PER_CANDLE} consecutive closes: open is the first, close the
 * last, high and low the extremes of the window.
 */
@Component
public class CandlestickPatternDetector {

    static final int CLOSES_PER_CANDLE = 4;

    public record Candle(double open, double high, double low, double close) {
        double body() {
            return Math.abs(close - open);
        }

        double range() {
            return high - low;
        }

        double upperShadow() {
            return high - Math.max(open, close);
        }

        double lowerShadow() {
            return Math.min(open, close) - low;
        }

        boolean bullish() {
            return close > open;
        }

        boolean bearish() {
            return close < open;
        }
    }

    public enum Bias {
        BULLISH,
        BEARISH,
        NEUTRAL
    }

    public record Pattern(String name, Bias bias, double strength) {
    }

    public List<Candle> buildCandles(double[] prices) {
        List<Candle> candles = new ArrayList<>();
        int start = prices.length % CLOSES_PER_CANDLE;
        for (int i = start; i + CLOSES_PER_CANDLE <= prices.length; i += CLOSES_PER_CANDLE) {
            double high = Double.NEGATIVE_INFINITY;
            double low = Double.POSITIVE_INFINITY;
            for (int j = i; j < i + CLOSES_PER_CANDLE; j++) {
                high = Math.max(high, prices[j]);
                low = Math.min(low, prices[j]);
            }
            candles.add(new Candle(prices[i], high, low, prices[i + CLOSES_PER_CANDLE - 1]));
        }
        return candles;
    }

    public List<Pattern> detect(double[] prices) {
        List<Pattern> patterns = new ArrayList<>();
        List<Candle> candles = buildCandles(prices);
        if (candles.size() < 3) return patterns;

        Candle c3 = candles.get(candles.size() - 1);
        Candle c2 = candles.get(candles.size() - 2);
        Candle c1 = candles.get(candles.size() - 3);

        // Engulfing
        if (c2.bearish() && c3.bullish() && c3.open() <= c2.close() && c3.close() >= c2.open()) {
            patterns.add(new Pattern("Bullish Engulfing", Bias.BULLISH, engulfingStrength(c2, c3)));
        }
        if (c2.bullish() && c3.bearish() && c3.open() >= c2.close() && c3.close() <= c2.open()) {
            patterns.add(new Pattern("Bearish Engulfing", Bias.BEARISH, engulfingStrength(c2, c3)));
        }

        // Single-candle shapes
        double body = c3.body();
        double range = c3.range();
        if (range > 0 && body > 0) {
            if (c3.lowerShadow() >= body * 2 && c3.upperShadow() < body * 0.3 && body / range < 0.3) {
                patterns.add(new Pattern("Hammer", Bias.BULLISH, Math.min(100, c3.lowerShadow() / body * 20)));
            }
            if (c3.upperShadow() >= body * 2 && c3.lowerShadow() < body * 0.3 && body / range < 0.3) {
                patterns.add(new Pattern("Shooting Star", Bias.BEARISH, Math.min(100, c3.upperShadow() / body * 20)));
            }
        }
        if (range > 0 && body / range < 0.1) {
            patterns.add(new Pattern("Doji", Bias.NEUTRAL, 65));
        }

        // Three-candle formations
        if (c1.bullish() && c2.bullish() && c3.bullish()
                && c2.close() > c1.close() && c3.close() > c2.close()
                && c2.open() > c1.open() && c2.open() < c1.close()
                && c3.open() > c2.open() && c3.open() < c2.close()) {
            patterns.add(new Pattern("Three White Soldiers", Bias.BULLISH, 85));
        }
        if (c1.bearish() && c2.bearish() && c3.bearish()
                && c2.close() < c1.close() && c3.close() < c2.close()
                && c2.open() < c1.open() && c2.open() > c1.close()
                && c3.open() < c2.open() && c3.open() > c2.close()) {
            patterns.add(new Pattern("Three Black Crows", Bias.BEARISH, 85));
        }
        return patterns;
    }

    private double engulfingStrength(Candle prev, Candle current) {
        double prevBody = prev.body();
        if (prevBody == 0) return 70;
        return Math.min(100, 50 + (current.body() / prevBody) * 20);
    }
}
