package com.kotsin.advisor.scoring;

import com.kotsin.advisor.indicator.MacdResult;
import com.kotsin.advisor.indicator.TechnicalIndicators;
import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.PriceLadder;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.SignalDirection;
import com.kotsin.advisor.model.SignalStatus;
import com.kotsin.advisor.model.Timeframe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Short-horizon scoring on 5-minute bars with tight fixed targets.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FastSignalStrategy implements SignalStrategy {

    static final int RSI_PERIOD = 7;
    static final int MIN_SCORE = 45;
    static final double MIN_VOLUME_RATIO = 1.2;
    static final double STRONG_VOLUME_RATIO = 2.0;
    static final double MOMENTUM_THRESHOLD = 0.002;

    private final PriceLadderCalculator ladderCalculator;

    @Override
    public SignalCategory category() {
        return SignalCategory.FAST;
    }

    @Override
    public Optional<Signal> evaluate(PriceSeries series, MarketKind marketKind, MarketInputs inputs) {
        double[] prices = series.prices();
        double[] volumes = series.volumes();
        if (prices.length < 14 || volumes.length == 0) {
            return Optional.empty();
        }
        double price = series.currentPrice();

        double rsi = TechnicalIndicators.rsi(prices, RSI_PERIOD);
        MacdResult macd = TechnicalIndicators.macd(prices, 5, 13, 4);
        MacdResult previous = TechnicalIndicators.macd(Arrays.copyOf(prices, prices.length - 1), 5, 13, 4);
        double meanVolume = Arrays.stream(volumes).average().orElse(0);
        double volumeRatio = meanVolume > 0 ? series.currentVolume() / meanVolume : 0;

        int buy = 0;
        int sell = 0;

        if (rsi < 40) buy += 20;
        else if (rsi > 60) sell += 20;

        if (macd.histogram() > 0 && macd.histogram() > previous.histogram()) buy += 25;
        else if (macd.histogram() < 0 && macd.histogram() < previous.histogram()) sell += 25;

        if (volumeRatio >= STRONG_VOLUME_RATIO) {
            buy += 15;
            sell += 15;
        } else if (volumeRatio < MIN_VOLUME_RATIO) {
            log.debug("fast_reject pair={} reason=low_volume ratio={}", series.pair(), volumeRatio);
            return Optional.empty();
        }

        double reference = prices[prices.length - 10];
        double momentum = reference == 0 ? 0 : (price - reference) / reference;
        if (momentum > MOMENTUM_THRESHOLD) buy += 10;
        if (momentum < -MOMENTUM_THRESHOLD) sell += 10;

        boolean isLong;
        int score;
        if (buy >= MIN_SCORE && buy > sell) {
            isLong = true;
            score = buy;
        } else if (sell >= MIN_SCORE && sell > buy) {
            if (marketKind == MarketKind.SPOT) return Optional.empty();
            isLong = false;
            score = sell;
        } else {
            return Optional.empty();
        }

        int confidence = (int) Math.round(Math.min(score / 70.0 * 100, 95));
        PriceLadder ladder = ladderCalculator.percentLadder(isLong, price, 0.3, 0.2, 0.5, 0.8);

        List<String> rationale = new ArrayList<>();
        if (isLong) {
            if (rsi < 40) rationale.add("RSI oversold - bounce expected");
            if (macd.histogram() > 0) rationale.add("MACD bullish momentum");
            if (volumeRatio >= STRONG_VOLUME_RATIO) rationale.add("Strong buying volume");
        } else {
            if (rsi > 60) rationale.add("RSI overbought - pullback expected");
            if (macd.histogram() < 0) rationale.add("MACD bearish momentum");
            if (volumeRatio >= STRONG_VOLUME_RATIO) rationale.add("Strong selling volume");
        }
        rationale.add("5-min setup - quick exit expected");

        return Optional.of(Signal.builder()
                .id(SignalStrategy.newId(series.pair(), inputs.now()))
                .pair(series.pair())
                .category(SignalCategory.FAST)
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
                .rsi(rsi)
                .macdValue(macd.macd())
                .macdSignal(macd.signal())
                .volumeVsAverage((double) Math.round(volumeRatio * 100))
                .sentimentScore(Math.round(inputs.sentiment()))
                .rationale(rationale)
                .timeframe(Timeframe.M5)
                .createdAt(inputs.now())
                .expiresAt(inputs.now().plus(Duration.ofHours(1)))
                .validUntil(inputs.now().plus(Duration.ofHours(1)))
                .build());
    }
}
