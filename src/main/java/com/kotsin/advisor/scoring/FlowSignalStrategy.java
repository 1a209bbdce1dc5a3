package com.kotsin.advisor.scoring;

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
import java.util.List;
import java.util.Optional;

/**
 * Flow-driven scoring: large-volume bars stand in for block transfers, blended 50/50 with a
 * technical read.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FlowSignalStrategy implements SignalStrategy {

    static final int FLOW_WINDOW = 20;
    static final double LARGE_BAR_RATIO = 1.5;
    static final double MIN_ABS_SCORE = 10;

    private final PriceLadderCalculator ladderCalculator;

    public record FlowScore(int score, int inflowBars, int outflowBars) {
    }

    @Override
    public SignalCategory category() {
        return SignalCategory.FLOW;
    }

    @Override
    public Optional<Signal> evaluate(PriceSeries series, MarketKind marketKind, MarketInputs inputs) {
        double[] prices = series.prices();
        if (prices.length < 2) {
            return Optional.empty();
        }
        double price = series.currentPrice();

        FlowScore flow = flowScore(series);
        double rsi = TechnicalIndicators.rsi(prices);
        double macd = TechnicalIndicators.ema(prices, 12) - TechnicalIndicators.ema(prices, 26);
        int technical = technicalScore(rsi, macd);

        double total = flow.score() * 0.5 + technical * 0.5;
        if (Math.abs(total) < MIN_ABS_SCORE) {
            log.debug("flow_reject pair={} reason=weak_score total={}", series.pair(), total);
            return Optional.empty();
        }
        boolean isLong = total > 0;
        if (!isLong && marketKind == MarketKind.SPOT) {
            return Optional.empty();
        }
        int confidence = (int) Math.min(Math.round(Math.abs(total)), 95);
        PriceLadder ladder = ladderCalculator.percentLadder(isLong, price, 3, 5, 8, 12);

        List<String> rationale = new ArrayList<>();
        rationale.add(String.format("%d large-volume bars in the last %d", flow.inflowBars() + flow.outflowBars(), FLOW_WINDOW));
        if (isLong) {
            if (flow.outflowBars() > flow.inflowBars()) rationale.add(flow.outflowBars() + " heavy up-bars - accumulation");
            if (rsi < 40) rationale.add(String.format("RSI oversold (%.0f) - bounce expected", rsi));
        } else {
            if (flow.inflowBars() > flow.outflowBars()) rationale.add(flow.inflowBars() + " heavy down-bars - distribution");
            if (rsi > 60) rationale.add(String.format("RSI overbought (%.0f) - correction expected", rsi));
        }

        return Optional.of(Signal.builder()
                .id(SignalStrategy.newId(series.pair(), inputs.now()))
                .pair(series.pair())
                .category(SignalCategory.FLOW)
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
                .rsi((double) Math.round(rsi))
                .macdValue(macd)
                .sentimentScore(Math.round(inputs.sentiment()))
                .rationale(rationale)
                .timeframe(Timeframe.H1)
                .createdAt(inputs.now())
                .expiresAt(inputs.now().plus(Duration.ofHours(12)))
                .validUntil(inputs.now().plus(Duration.ofHours(12)))
                .build());
    }

    /**
     * ±20 per bar in the window whose volume exceeds 1.5× the window average, signed by its close-to-close
     * move; capped at ±100.
     */
    static FlowScore flowScore(PriceSeries series) {
        double[] prices = series.prices();
        double[] volumes = series.volumes();
        int n = Math.min(prices.length, volumes.length);
        if (n < 2) return new FlowScore(0, 0, 0);

        int from = Math.max(1, n - FLOW_WINDOW);
        double avg = 0;
        for (int i = from; i < n; i++) avg += volumes[i];
        avg /= (n - from);

        int score = 0;
        int inflow = 0;
        int outflow = 0;
        for (int i = from; i < n; i++) {
            if (volumes[i] <= avg * LARGE_BAR_RATIO) continue;
            double change = prices[i] - prices[i - 1];
            if (change > 0) {
                score += 20;
                outflow++;
            } else if (change < 0) {
                score -= 20;
                inflow++;
            }
        }
        return new FlowScore((int) TechnicalIndicators.clamp(score, -100, 100), inflow, outflow);
    }

    static int technicalScore(double rsi, double macd) {
        int score = 0;
        if (rsi < 30) score += 30;
        else if (rsi > 70) score -= 30;
        else if (rsi < 40) score += 15;
        else if (rsi > 60) score -= 15;

        score += macd > 0 ? 20 : -20;
        return score;
    }
}
