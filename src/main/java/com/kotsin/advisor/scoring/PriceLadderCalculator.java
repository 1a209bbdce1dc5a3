package com.kotsin.advisor.scoring;

import com.kotsin.advisor.indicator.BollingerBands;
import com.kotsin.advisor.model.PriceLadder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Stop-loss and take-profit placement.
 */
@Component
public class PriceLadderCalculator {

    static final double TP1_SHARE = 0.25;
    static final double TP2_SHARE = 0.65;
    static final double TP3_SHARE = 0.85;
    static final double MIN_TARGET_DISTANCE = 0.005;

    /**
     * ATR-scaled ladder. Higher confidence tightens the stop and widens the target; agreeing sentiment
     * above 30 widens the target further. The stop is pushed beyond the Bollinger band when that keeps it
     * on the losing side of entry.
     *
     * @param confidence 0-100
     * @param sentiment  -100..100
     * @return empty when the ladder degenerates: a zero ATR puts the stop on entry, a very large one can
     *         push a short target below zero
     */
    public Optional<PriceLadder> atrLadder(boolean isLong, double entry, double atr, double confidence,
                                 double sentiment, BollingerBands bands) {
        double confidenceMultiplier = confidence / 100;
        double sentimentAdjustment = Math.abs(sentiment) / 100;
        double slMultiplier = 1.5 - confidenceMultiplier * 0.3;
        double tpMultiplier = 3.5 + confidenceMultiplier * 2.5;

        double stopLoss;
        double takeProfit;
        if (isLong) {
            if (sentiment > 30) tpMultiplier += sentimentAdjustment * 2;
            stopLoss = entry - atr * slMultiplier;
            takeProfit = entry + atr * tpMultiplier;

            double bandStop = bands.lower() * 0.995;
            if (stopLoss > bands.lower() && bandStop < entry && bandStop > 0) {
                stopLoss = bandStop;
            }
            double bandTarget = bands.upper() * 0.98;
            if (sentiment > 50 && takeProfit < bands.upper() && bandTarget > entry) {
                takeProfit = bandTarget;
            }
        } else {
            if (sentiment < -30) tpMultiplier += sentimentAdjustment * 2;
            stopLoss = entry + atr * slMultiplier;
            takeProfit = entry - atr * tpMultiplier;

            double bandStop = bands.upper() * 1.005;
            if (stopLoss < bands.upper() && bandStop > entry) {
                stopLoss = bandStop;
            }
            double bandTarget = bands.lower() * 1.02;
            if (sentiment < -50 && takeProfit > bands.lower() && bandTarget < entry) {
                takeProfit = bandTarget;
            }
        }
        PriceLadder ladder = split(isLong, entry, stopLoss, takeProfit);
        return usable(isLong, entry, ladder) ? Optional.of(ladder) : Optional.empty();
    }

    static boolean usable(boolean isLong, double entry, PriceLadder ladder) {
        boolean stopOnLosingSide = isLong ? ladder.stopLoss() < entry : ladder.stopLoss() > entry;
        return stopOnLosingSide
                && ladder.stopLoss() > 0
                && ladder.takeProfit() > 0
                && ladder.tp1() > 0
                && ladder.tp2() > 0
                && ladder.tp3() > 0;
    }

    /**
     * Fixed-percentage ladder used by the fast and flow categories.
     */
    public PriceLadder percentLadder(boolean isLong, double entry, double slPct, double tp1Pct, double tp2Pct, double tp3Pct) {
        double sign = isLong ? 1 : -1;
        double tp1 = entry * (1 + sign * tp1Pct / 100);
        double tp2 = entry * (1 + sign * tp2Pct / 100);
        double tp3 = entry * (1 + sign * tp3Pct / 100);
        double stopLoss = entry * (1 - sign * slPct / 100);
        return new PriceLadder(stopLoss, tp3, tp1, tp2, tp3);
    }

    /**
     * TP1/TP2/TP3 at 25/65/85% of the entry-to-target distance, with at least 0.5% of entry as distance.
     */
    PriceLadder split(boolean isLong, double entry, double stopLoss, double takeProfit) {
        double distance = isLong ? takeProfit - entry : entry - takeProfit;
        double minDistance = entry * MIN_TARGET_DISTANCE;
        if (distance < minDistance) {
            distance = minDistance;
            takeProfit = isLong ? entry + distance : entry - distance;
        }
        double sign = isLong ? 1 : -1;
        return new PriceLadder(
                stopLoss,
                takeProfit,
                entry + sign * distance * TP1_SHARE,
                entry + sign * distance * TP2_SHARE,
                entry + sign * distance * TP3_SHARE);
    }
}
