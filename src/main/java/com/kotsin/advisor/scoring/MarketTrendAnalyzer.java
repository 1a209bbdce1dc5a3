package com.kotsin.advisor.scoring;

import com.kotsin.advisor.indicator.TechnicalIndicators;
import com.kotsin.advisor.model.MarketTrend;
import com.kotsin.advisor.model.PriceSeries;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Broader market read used for the counter-trend gate and the risk score.
 * Deterministic: the same series always produces the same analysis.
 */
@Component
public class MarketTrendAnalyzer {

    public record Analysis(MarketTrend trend, double compositeScore, double riskScore, List<String> reasoning) {
    }

    public Analysis analyze(PriceSeries series) {
        double[] prices = series.prices();
        double[] volumes = series.volumes();
        List<String> reasoning = new ArrayList<>();
        double score = 50;

        double current = series.currentPrice();
        if (prices.length >= 2) {
            int from = Math.max(0, prices.length - 20);
            double recentHigh = Double.NEGATIVE_INFINITY;
            double recentLow = Double.POSITIVE_INFINITY;
            for (int i = from; i < prices.length; i++) {
                recentHigh = Math.max(recentHigh, prices[i]);
                recentLow = Math.min(recentLow, prices[i]);
            }
            if (current > recentHigh * 0.98) {
                score += 10;
                reasoning.add("Price near recent highs - bullish structure");
            } else if (current < recentLow * 1.02) {
                score -= 10;
                reasoning.add("Price near recent lows - bearish structure");
            }

            double rsi = TechnicalIndicators.rsi(prices);
            if (rsi < 35) {
                score += 8;
                reasoning.add(String.format("RSI oversold (%.1f) - potential bounce", rsi));
            } else if (rsi > 65) {
                score -= 8;
                reasoning.add(String.format("RSI overbought (%.1f) - correction risk", rsi));
            }

            if (volumes.length > 0) {
                double avgVolume = 0;
                for (double v : volumes) avgVolume += v;
                avgVolume /= volumes.length;
                double prev = prices[prices.length - 2];
                if (series.currentVolume() > avgVolume * 1.5 && current > prev) {
                    score += 10;
                    reasoning.add("High volume breakout - strong bullish momentum");
                } else if (series.currentVolume() > avgVolume * 1.5 && current < prev) {
                    score -= 10;
                    reasoning.add("High volume breakdown - strong bearish momentum");
                }
            }

            MarketTrend emaTrend = TechnicalIndicators.trend(prices);
            if (emaTrend == MarketTrend.BULLISH) {
                score += 12;
                reasoning.add("EMA 9/21/50 stacked upward");
            } else if (emaTrend == MarketTrend.BEARISH) {
                score -= 12;
                reasoning.add("EMA 9/21/50 stacked downward");
            }
        }

        MarketTrend trend = classify(score);
        double volatility = Math.min(1.0, TechnicalIndicators.volatility(prices) * 50);
        double riskScore = (1 - Math.abs(score - 50) / 50) * 60 + volatility * 40;
        riskScore = TechnicalIndicators.clamp(Math.round(riskScore), 0, 100);

        return new Analysis(trend, score, riskScore, reasoning);
    }

    static MarketTrend classify(double compositeScore) {
        if (compositeScore >= 70) return MarketTrend.STRONG_BULLISH;
        if (compositeScore >= 55) return MarketTrend.BULLISH;
        if (compositeScore >= 45) return MarketTrend.NEUTRAL;
        if (compositeScore >= 30) return MarketTrend.BEARISH;
        return MarketTrend.STRONG_BEARISH;
    }
}
