package com.kotsin.advisor.scoring;

import com.kotsin.advisor.indicator.BollingerBands;
import com.kotsin.advisor.indicator.MacdResult;
import com.kotsin.advisor.indicator.TechnicalIndicators;
import com.kotsin.advisor.model.DirectionPrediction.Bias;
import com.kotsin.advisor.model.MarketCondition;
import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.MarketTrend;
import com.kotsin.advisor.model.PriceLadder;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.SignalDirection;
import com.kotsin.advisor.model.SignalStatus;
import com.kotsin.advisor.model.TechnicalAlignment;
import com.kotsin.advisor.model.Timeframe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Hybrid mean-reversion / trend-following scoring for the standard category.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StandardSignalStrategy implements SignalStrategy {

    static final double MIN_PRICE = 0.0001;
    static final int THRESHOLD = 58;
    static final int COUNTER_TREND_MIN_CONFIDENCE = 80;
    static final int SPOT_MIN_CONFIDENCE = 70;
    static final int FUTURE_MIN_CONFIDENCE = 72;
    static final double MIN_PULLBACK = 0.5;
    static final double MAX_PULLBACK = 1.5;

    private final MarketTrendAnalyzer trendAnalyzer;
    private final CandlestickPatternDetector patternDetector;
    private final PredictionConsensusCalculator consensusCalculator;
    private final PriceLadderCalculator ladderCalculator;
    private final SignalRationaleBuilder rationaleBuilder;

    @Override
    public SignalCategory category() {
        return SignalCategory.STANDARD;
    }

    @Override
    public Optional<Signal> evaluate(PriceSeries series, MarketKind marketKind, MarketInputs inputs) {
        double[] prices = series.prices();
        double[] volumes = series.volumes();
        double price = series.currentPrice();

        if (price < MIN_PRICE) {
            log.debug("standard_reject pair={} reason=price_too_low price={}", series.pair(), price);
            return Optional.empty();
        }

        double rsi = TechnicalIndicators.rsi(prices);
        MacdResult macd = TechnicalIndicators.macd(prices);
        BollingerBands bands = TechnicalIndicators.bollinger(prices);
        double ema9 = TechnicalIndicators.ema(prices, 9);
        double ema21 = TechnicalIndicators.ema(prices, 21);
        MarketTrend emaTrend = TechnicalIndicators.trend(prices);
        double volumeAvg = TechnicalIndicators.volumeAverage(volumes);
        double volume = series.currentVolume();
        double momentum = TechnicalIndicators.momentum(prices);
        double roc = TechnicalIndicators.rateOfChange(prices);

        int buy = 0;
        int sell = 0;

        // Mean reversion
        if (rsi < 30 && momentum > -1.5) buy += 25;
        else if (rsi < 40 && momentum > 0) buy += 15;
        else if (rsi > 70) sell += 25;
        else if (rsi > 60 && momentum < 0) sell += 15;

        // Trend following
        if (momentum < -2 && roc < -3) sell += 25;
        else if (momentum < -1 && roc < -2) sell += 15;

        if (momentum > 2 && roc > 3) buy += 25;
        else if (momentum > 1 && roc > 2) buy += 15;

        if (macd.isBullish()) buy += 20;
        else if (macd.isBearish()) sell += 20;

        if (price <= bands.lower() && momentum > -1) buy += 20;
        else if (price >= bands.upper()) sell += 20;

        if (emaTrend == MarketTrend.BULLISH) buy += 15;
        else if (emaTrend == MarketTrend.BEARISH) sell += 15;

        if (volume > volumeAvg * 1.5) {
            if (buy > sell) buy += 10;
            else if (sell > buy) sell += 10;
        }

        if (price > ema9 && price > ema21) buy += 10;
        else if (price < ema9 && price < ema21) sell += 10;

        // Falling knife / rising rocket
        if (momentum < -2.5 && roc < -4 && rsi < 40) buy = Math.max(0, buy - 30);
        if (momentum > 2.5 && roc > 4 && rsi > 60) sell = Math.max(0, sell - 30);

        boolean isLong;
        int technicalScore;
        if (buy >= THRESHOLD && buy > sell) {
            double pullback = TechnicalIndicators.pullbackPercent(prices, 10);
            if (pullback < MIN_PULLBACK || pullback > MAX_PULLBACK) {
                log.debug("standard_reject pair={} reason=no_pullback pullback={}", series.pair(), pullback);
                return Optional.empty();
            }
            isLong = true;
            technicalScore = Math.min(buy, 100);
        } else if (sell >= THRESHOLD && sell > buy) {
            if (marketKind == MarketKind.SPOT) {
                log.debug("standard_reject pair={} reason=spot_short", series.pair());
                return Optional.empty();
            }
            isLong = false;
            technicalScore = Math.min(sell, 100);
        } else {
            return Optional.empty();
        }

        MarketTrendAnalyzer.Analysis analysis = trendAnalyzer.analyze(series);
        boolean counterTrend = (isLong && analysis.trend().isBearish()) || (!isLong && analysis.trend().isBullish());

        double sentiment = TechnicalIndicators.clamp(inputs.sentiment(), -100, 100);
        int confidence = confidence(technicalScore, sentiment, isLong);

        if (counterTrend && confidence < COUNTER_TREND_MIN_CONFIDENCE) {
            log.debug("standard_reject pair={} reason=counter_trend confidence={}", series.pair(), confidence);
            return Optional.empty();
        }
        int floor = marketKind == MarketKind.SPOT ? SPOT_MIN_CONFIDENCE : FUTURE_MIN_CONFIDENCE;
        if (confidence < floor) {
            log.debug("standard_reject pair={} reason=low_confidence confidence={} floor={}", series.pair(), confidence, floor);
            return Optional.empty();
        }

        List<CandlestickPatternDetector.Pattern> patterns = patternDetector.detect(prices);
        Bias technicalBias = isLong ? Bias.BULLISH : Bias.BEARISH;
        PredictionConsensusCalculator.Consensus consensus =
                consensusCalculator.consensus(inputs.prediction(), patterns, technicalBias, technicalScore);
        if (consensus.agreement() >= 80 && consensus.direction() == technicalBias) {
            confidence = (int) Math.min(100, Math.round(confidence + (consensus.agreement() - 80) * 0.1));
        }

        double atr = TechnicalIndicators.atr(prices);
        Optional<PriceLadder> maybeLadder = ladderCalculator.atrLadder(isLong, price, atr, confidence, sentiment, bands);
        if (maybeLadder.isEmpty()) {
            log.debug("standard_reject pair={} reason=degenerate_ladder atr={}", series.pair(), atr);
            return Optional.empty();
        }
        PriceLadder ladder = maybeLadder.get();

        Instant now = inputs.now();
        MarketCondition condition = rationaleBuilder.marketCondition(sentiment, volume, volumeAvg, analysis.trend());
        TechnicalAlignment alignment = rationaleBuilder.alignment(technicalScore);

        Signal signal = Signal.builder()
                .id(SignalStrategy.newId(series.pair(), now))
                .pair(series.pair())
                .category(SignalCategory.STANDARD)
                .marketKind(marketKind)
                .venue(series.venue())
                .direction(SignalDirection.of(isLong, marketKind))
                .status(SignalStatus.ACTIVE)
                .entryPrice(price)
                .currentPrice(price)
                .highestPrice(price)
                .lowestPrice(price)
                .stopLoss(ladder.stopLoss())
                .takeProfit(ladder.takeProfit())
                .takeProfit1(ladder.tp1())
                .takeProfit2(ladder.tp2())
                .takeProfit3(ladder.tp3())
                .confidence(confidence)
                .riskScore(analysis.riskScore())
                .marketTrend(analysis.trend())
                .marketAnalysis(analysis.reasoning())
                .counterTrend(counterTrend)
                .sentimentScore(Math.round(sentiment))
                .marketCondition(condition)
                .technicalAlignment(alignment)
                .rationale(rationaleBuilder.rationale(sentiment, rsi, macd, volume, volumeAvg, isLong, alignment))
                .volumeVsAverage(volumeAvg > 0 ? (double) Math.round(volume / volumeAvg * 100) : null)
                .rsi(rsi)
                .macdValue(macd.macd())
                .macdSignal(macd.signal())
                .predictionAgreement(consensus.agreement())
                .detectedPatterns(patterns.stream().map(CandlestickPatternDetector.Pattern::name).collect(Collectors.toList()))
                .timeframe(Timeframe.H1)
                .createdAt(now)
                .expiresAt(now.plus(marketKind == MarketKind.SPOT ? Duration.ofHours(24) : Duration.ofHours(48)))
                .validUntil(now.plus(condition.validity()))
                .build();
        return Optional.of(signal);
    }

    /**
     * Technical 60%, sentiment 40%; agreeing sentiment beyond ±30 boosts by 15%, strongly opposing
     * sentiment beyond ±40 trims by 15%.
     */
    static int confidence(int technicalScore, double sentiment, boolean isLong) {
        double sentimentPart = Math.max(0, sentiment + 100) / 2;
        double value = technicalScore * 0.6 + sentimentPart * 0.2 + sentimentPart * 0.2;

        if (sentiment > 30 && isLong) {
            value = Math.min(value * 1.15, 100);
        } else if (sentiment < -30 && !isLong) {
            value = Math.min(value * 1.15, 100);
        } else if (Math.abs(sentiment) > 40 && ((sentiment > 0 && !isLong) || (sentiment < 0 && isLong))) {
            value *= 0.85;
        }
        return (int) Math.round(Math.max(0, Math.min(100, value)));
    }
}
