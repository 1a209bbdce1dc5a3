package com.kotsin.advisor.indicator;

import com.kotsin.advisor.model.MarketTrend;

import java.util.Arrays;

/**
 * Pure calculation utilities for technical indicators.
 * Input series are oldest-first (last index = most recent close).
 *
 * Every function has a neutral fallback when the series is too short, so callers never see NaN.
 */
public final class TechnicalIndicators {

    public static final int RSI_PERIOD = 14;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int BOLLINGER_PERIOD = 20;
    public static final int ATR_PERIOD = 14;
    public static final int VOLUME_PERIOD = 20;
    public static final int MOMENTUM_PERIOD = 10;

    private static final int MACD_HISTORY = 35;

    private TechnicalIndicators() {}

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * Simple-average RSI over the last {@code period} price changes.
     * @return 0–100; 50 when fewer than period+1 prices; 100 when there were no losses
     */
    public static double rsi(double[] prices, int period) {
        if (prices == null || prices.length < period + 1) return 50.0;

        double gains = 0;
        double losses = 0;
        for (int i = prices.length - period; i < prices.length; i++) {
            double change = prices[i] - prices[i - 1];
            if (change > 0) gains += change;
            else losses -= change;
        }
        double avgGain = gains / period;
        double avgLoss = losses / period;

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    public static double rsi(double[] prices) {
        return rsi(prices, RSI_PERIOD);
    }

    // ── Moving averages ─────────────────────────────────────────────────────

    /**
     * EMA seeded with the SMA of the first {@code period} values.
     * @return most-recent EMA, or the last price when the series is shorter than the period
     */
    public static double ema(double[] prices, int period) {
        if (prices == null || prices.length == 0) return 0.0;
        if (prices.length < period) return last(prices);

        double multiplier = 2.0 / (period + 1);
        double ema = 0;
        for (int i = 0; i < period; i++) ema += prices[i];
        ema /= period;

        for (int i = period; i < prices.length; i++) {
            ema = (prices[i] - ema) * multiplier + ema;
        }
        return ema;
    }

    /**
     * @return mean of the last {@code period} values, or the last price when too short
     */
    public static double sma(double[] prices, int period) {
        if (prices == null || prices.length == 0) return 0.0;
        if (prices.length < period) return last(prices);

        double sum = 0;
        for (int i = prices.length - period; i < prices.length; i++) sum += prices[i];
        return sum / period;
    }

    // ── MACD ────────────────────────────────────────────────────────────────

    public static MacdResult macd(double[] prices) {
        return macd(prices, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
    }

    /**
     * MACD with a true signal line: the signal EMA runs over MACD values of the trailing prefixes that
     * are at least {@code slow} long. With fewer than {@code signalPeriod} such values the signal is the
     * latest MACD and the histogram is 0.
     * @return (0,0,0) when fewer than {@code slow} prices
     */
    public static MacdResult macd(double[] prices, int fast, int slow, int signalPeriod) {
        if (prices == null || prices.length < slow) return MacdResult.ZERO;

        double macd = ema(prices, fast) - ema(prices, slow);

        int start = Math.max(slow - 1, prices.length - (slow + signalPeriod));
        double[] macdValues = new double[prices.length - start];
        for (int i = start; i < prices.length; i++) {
            double[] prefix = Arrays.copyOfRange(prices, 0, i + 1);
            macdValues[i - start] = ema(prefix, fast) - ema(prefix, slow);
        }

        double signal = ema(macdValues, signalPeriod);

        return new MacdResult(macd, signal, macd - signal);
    }

    // ── Bands / volatility ──────────────────────────────────────────────────

    /**
     * SMA ± multiplier × population standard deviation of the last {@code period} prices, or of all of
     * them when the series is shorter.
     */
    public static BollingerBands bollinger(double[] prices, int period, double multiplier) {
        if (prices == null || prices.length == 0) return new BollingerBands(0, 0, 0);

        int from = Math.max(0, prices.length - period);
        int count = prices.length - from;
        double middle = 0;
        for (int i = from; i < prices.length; i++) middle += prices[i];
        middle /= count;

        double variance = 0;
        for (int i = from; i < prices.length; i++) {
            variance += Math.pow(prices[i] - middle, 2);
        }
        variance /= count;
        double sd = Math.sqrt(variance);

        return new BollingerBands(middle + sd * multiplier, middle, middle - sd * multiplier);
    }

    public static BollingerBands bollinger(double[] prices) {
        return bollinger(prices, BOLLINGER_PERIOD, 2.0);
    }

    /**
     * Average true range of consecutive closes.
     * @return 2% of the last price when fewer than period+1 prices
     */
    public static double atr(double[] prices, int period) {
        if (prices == null || prices.length == 0) return 0.0;
        if (prices.length < period + 1) return last(prices) * 0.02;

        double sum = 0;
        for (int i = prices.length - period; i < prices.length; i++) {
            sum += Math.abs(prices[i] - prices[i - 1]);
        }
        return sum / period;
    }

    public static double atr(double[] prices) {
        return atr(prices, ATR_PERIOD);
    }

    /**
     * Standard deviation of simple returns.
     */
    public static double volatility(double[] prices) {
        if (prices == null || prices.length < 2) return 0.0;

        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = prices[i - 1] == 0 ? 0 : (prices[i] - prices[i - 1]) / prices[i - 1];
        }
        double mean = Arrays.stream(returns).average().orElse(0);
        double variance = Arrays.stream(returns).map(r -> Math.pow(r - mean, 2)).average().orElse(0);
        return Math.sqrt(variance);
    }

    // ── Volume ──────────────────────────────────────────────────────────────

    /**
     * @return mean of the last {@code period} volumes, or the last volume when too short
     */
    public static double volumeAverage(double[] volumes, int period) {
        return sma(volumes, period);
    }

    public static double volumeAverage(double[] volumes) {
        return volumeAverage(volumes, VOLUME_PERIOD);
    }

    // ── Momentum ────────────────────────────────────────────────────────────

    /**
     * Average per-bar change over the last {@code period} bars as a percentage of price, scaled ×50
     * and clamped to [-5, 5].
     */
    public static double momentum(double[] prices, int period) {
        if (prices == null || prices.length < period + 1) return 0.0;

        double current = last(prices);
        if (current == 0) return 0.0;
        double totalChange = current - prices[prices.length - 1 - period];
        double scaled = (totalChange / period) / current * 100.0 * 50.0;
        return clamp(scaled, -5.0, 5.0);
    }

    public static double momentum(double[] prices) {
        return momentum(prices, MOMENTUM_PERIOD);
    }

    /**
     * Percent change of the last price against the price {@code period} bars ago.
     */
    public static double rateOfChange(double[] prices, int period) {
        if (prices == null || prices.length < period + 1) return 0.0;

        double past = prices[prices.length - 1 - period];
        if (past == 0) return 0.0;
        return (last(prices) - past) / past * 100.0;
    }

    public static double rateOfChange(double[] prices) {
        return rateOfChange(prices, MOMENTUM_PERIOD);
    }

    // ── Structure ───────────────────────────────────────────────────────────

    /**
     * EMA9 / EMA21 / EMA50 stacking.
     */
    public static MarketTrend trend(double[] prices) {
        double ema9 = ema(prices, 9);
        double ema21 = ema(prices, 21);
        double ema50 = ema(prices, 50);

        if (ema9 > ema21 && ema21 > ema50) return MarketTrend.BULLISH;
        if (ema9 < ema21 && ema21 < ema50) return MarketTrend.BEARISH;
        return MarketTrend.NEUTRAL;
    }

    /**
     * Percent the last price sits below the high of the last {@code lookback} prices.
     */
    public static double pullbackPercent(double[] prices, int lookback) {
        if (prices == null || prices.length == 0) return 0.0;

        int from = Math.max(0, prices.length - lookback);
        double high = Arrays.stream(prices, from, prices.length).max().orElse(last(prices));
        if (high == 0) return 0.0;
        return (high - last(prices)) / high * 100.0;
    }

    /**
     * @return {support, resistance} as min/max of the last 50 prices
     */
    public static double[] supportResistance(double[] prices) {
        if (prices == null || prices.length == 0) return new double[]{0.0, 0.0};

        int from = Math.max(0, prices.length - 50);
        double support = Arrays.stream(prices, from, prices.length).min().orElse(0);
        double resistance = Arrays.stream(prices, from, prices.length).max().orElse(0);
        return new double[]{support, resistance};
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double last(double[] values) {
        return values[values.length - 1];
    }
}
