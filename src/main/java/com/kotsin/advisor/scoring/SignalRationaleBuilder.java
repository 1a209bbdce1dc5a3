package com.kotsin.advisor.scoring;

import com.kotsin.advisor.indicator.MacdResult;
import com.kotsin.advisor.model.MarketCondition;
import com.kotsin.advisor.model.MarketTrend;
import com.kotsin.advisor.model.TechnicalAlignment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class SignalRationaleBuilder {

    public MarketCondition marketCondition(double sentiment, double currentVolume, double volumeAverage, MarketTrend trend) {
        if (Math.abs(sentiment) >= 60 && currentVolume > volumeAverage * 1.5) {
            return MarketCondition.NEWS_DRIVEN;
        }
        if (currentVolume > volumeAverage * 2) {
            return MarketCondition.HIGH_VOLATILITY;
        }
        if (trend == MarketTrend.STRONG_BULLISH || trend == MarketTrend.STRONG_BEARISH) {
            return MarketCondition.TRENDING;
        }
        if (currentVolume < volumeAverage * 0.8 && trend == MarketTrend.NEUTRAL) {
            return MarketCondition.RANGING;
        }
        if (trend == MarketTrend.BULLISH || trend == MarketTrend.BEARISH) {
            return MarketCondition.TRENDING;
        }
        return MarketCondition.RANGING;
    }

    public TechnicalAlignment alignment(int technicalScore) {
        if (technicalScore >= 80) return TechnicalAlignment.STRONG;
        if (technicalScore >= 65) return TechnicalAlignment.MODERATE;
        return TechnicalAlignment.WEAK;
    }

    /**
     * Sentiment, technical and volume bullets, in that order.
     */
    public List<String> rationale(double sentiment, double rsi, MacdResult macd, double currentVolume,
                                  double volumeAverage, boolean isLong, TechnicalAlignment alignment) {
        List<String> out = new ArrayList<>(3);

        String mood = sentiment > 30 ? "bullish" : sentiment < -30 ? "bearish" : "neutral";
        out.add(String.format("Sentiment: %s (%.0f) %s the setup", mood, sentiment,
                (sentiment > 30 && isLong) || (sentiment < -30 && !isLong) ? "confirming" : "not contradicting"));

        String macdStatus = macd.macd() > macd.signal() ? "bullish" : "bearish";
        String rsiStatus = rsi > 65 ? "overbought" : rsi < 35 ? "oversold" : "neutral";
        out.add(String.format("Technical: RSI at %.1f (%s), MACD %s crossover - %s %s signal",
                rsi, rsiStatus, macdStatus, alignment.name().toLowerCase(), isLong ? "buy" : "sell"));

        long volumePercent = volumeAverage > 0 ? Math.round(currentVolume / volumeAverage * 100) : 100;
        String volumeText = volumePercent > 130 ? "strong participation" : volumePercent > 100 ? "above-average" : "moderate";
        out.add(String.format("Volume: %d%% of average - %s supporting the move", volumePercent, volumeText));
        return out;
    }
}
