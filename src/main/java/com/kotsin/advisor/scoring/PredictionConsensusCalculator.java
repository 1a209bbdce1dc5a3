package com.kotsin.advisor.scoring;

import com.kotsin.advisor.model.DirectionPrediction;
import com.kotsin.advisor.model.DirectionPrediction.Bias;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Weighs the model prediction, detected patterns and the technical verdict into one direction.
 *
 * Weights: model up to 30% (only when its track record exceeds 60%), patterns up to 30% by average
 * strength, technicals up to 40% by confidence; normalised to 1. A direction needs a 20% margin.
 */
@Component
public class PredictionConsensusCalculator {

    public record Consensus(Bias direction, double agreement, double bullishScore, double bearishScore) {
    }

    public Consensus consensus(Optional<DirectionPrediction> prediction,
                               List<CandlestickPatternDetector.Pattern> patterns,
                               Bias technicalBias,
                               double technicalConfidence) {
        double mlWeight = 0;
        if (prediction.isPresent() && prediction.get().getAccuracy() > 60) {
            mlWeight = prediction.get().getAccuracy() / 100 * 0.3;
        }

        double patternWeight = 0;
        double patternBull = 0;
        double patternBear = 0;
        if (!patterns.isEmpty()) {
            double strengthSum = 0;
            for (CandlestickPatternDetector.Pattern p : patterns) {
                strengthSum += p.strength();
                switch (p.bias()) {
                    case BULLISH -> patternBull += p.strength();
                    case BEARISH -> patternBear += p.strength();
                    default -> {
                        patternBull += p.strength() / 2;
                        patternBear += p.strength() / 2;
                    }
                }
            }
            patternWeight = strengthSum / patterns.size() / 100 * 0.3;
            patternBull /= strengthSum;
            patternBear /= strengthSum;
        }

        double technicalWeight = technicalConfidence / 100 * 0.4;

        double total = mlWeight + patternWeight + technicalWeight;
        if (total > 0) {
            mlWeight /= total;
            patternWeight /= total;
            technicalWeight /= total;
        }

        double bullish = 0;
        double bearish = 0;
        Bias mlBias = Bias.NEUTRAL;
        if (mlWeight > 0) {
            DirectionPrediction p = prediction.get();
            mlBias = p.getDirection();
            if (mlBias == Bias.BULLISH) bullish += p.getConfidence() / 100 * mlWeight;
            else if (mlBias == Bias.BEARISH) bearish += p.getConfidence() / 100 * mlWeight;
        }

        bullish += patternBull * patternWeight;
        bearish += patternBear * patternWeight;

        if (technicalBias == Bias.BULLISH) {
            bullish += technicalConfidence / 100 * technicalWeight;
        } else if (technicalBias == Bias.BEARISH) {
            bearish += technicalConfidence / 100 * technicalWeight;
        } else {
            bullish += 0.5 * technicalWeight;
            bearish += 0.5 * technicalWeight;
        }

        Bias overall;
        if (bullish > bearish * 1.2) overall = Bias.BULLISH;
        else if (bearish > bullish * 1.2) overall = Bias.BEARISH;
        else overall = Bias.NEUTRAL;

        int sources = 1;
        int agreeing = technicalBias == overall ? 1 : 0;
        if (mlWeight > 0) {
            sources++;
            if (mlBias == overall) agreeing++;
        }
        if (patternWeight > 0) {
            sources++;
            Bias patternBias = patternBull > patternBear ? Bias.BULLISH : patternBear > patternBull ? Bias.BEARISH : Bias.NEUTRAL;
            if (patternBias == overall) agreeing++;
        }

        double agreement = Math.round((double) agreeing / sources * 100);
        return new Consensus(overall, agreement, bullish, bearish);
    }
}
