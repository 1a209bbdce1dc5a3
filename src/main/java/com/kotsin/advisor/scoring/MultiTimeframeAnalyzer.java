package com.kotsin.advisor.scoring;

import com.kotsin.advisor.indicator.MacdResult;
import com.kotsin.advisor.indicator.TechnicalIndicators;
import com.kotsin.advisor.model.DirectionPrediction;
import com.kotsin.advisor.model.MarketTrend;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.Timeframe;
import com.kotsin.advisor.model.TimeframeAlignment;
import com.kotsin.advisor.model.TimeframeData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the trend on every timeframe that can be derived from a series and scores their agreement.
 *
 * A coarser timeframe is taken from the base series by keeping every k-th close counted back from the
 * latest, where k is the ratio of the two bar lengths. Timeframes finer than the base, or with fewer
 * than {@value #MIN_POINTS} closes after sampling, are left out.
 */
@Component
@Slf4j
public class MultiTimeframeAnalyzer {

    static final int MIN_POINTS = 30;
    static final int MAX_POINTS = 100;
    static final double ALIGNED_RATIO = 0.7;
    static final double RSI_OVERBOUGHT = 70;
    static final double RSI_OVERSOLD = 30;

    public TimeframeAlignment analyze(PriceSeries series, Timeframe base) {
        Timeframe effectiveBase = base == null ? Timeframe.H1 : base;
        List<TimeframeData> data = new ArrayList<>();
        for (Timeframe timeframe : Timeframe.values()) {
            if (timeframe.minutes() < effectiveBase.minutes()) {
                continue;
            }
            double[] closes = sample(series.prices(), timeframe.minutes() / effectiveBase.minutes());
            if (closes.length >= MIN_POINTS) {
                data.add(read(timeframe, closes));
            }
        }
        TimeframeAlignment alignment = align(data);
        log.debug("timeframe_alignment pair={} base={} analysed={} dominant={} aligned={} strength={}",
                series.pair(), effectiveBase.label(), data.size(), alignment.dominantTrend(),
                alignment.aligned(), alignment.strength());
        return alignment;
    }

    /**
     * Every {@code step}-th close ending at the latest one, oldest first, capped at the last {@value #MAX_POINTS}.
     */
    static double[] sample(double[] prices, int step) {
        if (prices.length == 0) {
            return prices;
        }
        int count = Math.min(MAX_POINTS, (prices.length - 1) / step + 1);
        double[] out = new double[count];
        for (int i = 0; i < count; i++) {
            out[count - 1 - i] = prices[prices.length - 1 - i * step];
        }
        return out;
    }

    static TimeframeData read(Timeframe timeframe, double[] closes) {
        double ema9 = TechnicalIndicators.ema(closes, 9);
        double ema50 = TechnicalIndicators.ema(closes, 50);
        int strength = ema50 == 0 ? 0
                : (int) Math.min(100, Math.round(Math.abs(ema9 - ema50) / ema50 * 1000));

        MacdResult macd = TechnicalIndicators.macd(closes);
        DirectionPrediction.Bias macdBias = DirectionPrediction.Bias.NEUTRAL;
        if (macd.histogram() > 0 && macd.macd() > macd.signal()) {
            macdBias = DirectionPrediction.Bias.BULLISH;
        } else if (macd.histogram() < 0 && macd.macd() < macd.signal()) {
            macdBias = DirectionPrediction.Bias.BEARISH;
        }
        return new TimeframeData(timeframe, TechnicalIndicators.trend(closes), strength,
                TechnicalIndicators.rsi(closes), macdBias);
    }

    static TimeframeAlignment align(List<TimeframeData> data) {
        if (data.isEmpty()) {
            return TimeframeAlignment.insufficient();
        }

        int bullish = 0;
        int bearish = 0;
        int neutral = 0;
        for (TimeframeData d : data) {
            if (d.trend() == MarketTrend.BULLISH) bullish++;
            else if (d.trend() == MarketTrend.BEARISH) bearish++;
            else neutral++;
        }
        MarketTrend dominant = MarketTrend.NEUTRAL;
        if (bullish > bearish && bullish > neutral) dominant = MarketTrend.BULLISH;
        else if (bearish > bullish && bearish > neutral) dominant = MarketTrend.BEARISH;

        List<Timeframe> agreeing = new ArrayList<>();
        List<Timeframe> conflicting = new ArrayList<>();
        int agreeingStrength = 0;
        for (TimeframeData d : data) {
            if (d.trend() == dominant) {
                agreeing.add(d.timeframe());
                agreeingStrength += d.strength();
            } else if (d.trend() != MarketTrend.NEUTRAL) {
                conflicting.add(d.timeframe());
            }
        }

        double ratio = (double) agreeing.size() / data.size();
        double meanStrength = agreeing.isEmpty() ? 0 : (double) agreeingStrength / agreeing.size();
        int strength = (int) Math.round(ratio * meanStrength);

        return new TimeframeAlignment(ratio >= ALIGNED_RATIO, agreeing, conflicting, strength, dominant,
                divergences(data, conflicting, dominant), data);
    }

    private static List<String> divergences(List<TimeframeData> data, List<Timeframe> conflicting,
                                            MarketTrend dominant) {
        List<String> out = new ArrayList<>();
        boolean lowerMixed = false;
        for (TimeframeData d : data) {
            if (!conflicting.contains(d.timeframe())) {
                continue;
            }
            if (d.timeframe() == Timeframe.H4 || d.timeframe() == Timeframe.D1) {
                out.add(d.timeframe().label() + " shows " + d.trend() + " trend (conflicts with " + dominant + ")");
            } else if (d.timeframe() == Timeframe.M5 || d.timeframe() == Timeframe.M15) {
                lowerMixed = true;
            }
        }
        if (lowerMixed) {
            out.add("Lower timeframes show mixed signals");
        }

        long overbought = data.stream().filter(d -> d.rsi() > RSI_OVERBOUGHT).count();
        long oversold = data.stream().filter(d -> d.rsi() < RSI_OVERSOLD).count();
        if (overbought >= 2) {
            out.add(overbought + " timeframes show RSI overbought (>70)");
        }
        if (oversold >= 2) {
            out.add(oversold + " timeframes show RSI oversold (<30)");
        }
        return out;
    }
}
