package com.kotsin.advisor.scoring;

import com.kotsin.advisor.config.SignalProps;
import com.kotsin.advisor.feed.BoundedCallExecutor;
import com.kotsin.advisor.feed.DirectionPredictor;
import com.kotsin.advisor.feed.SentimentSource;
import com.kotsin.advisor.model.DirectionPrediction;
import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.TimeframeAlignment;
import com.kotsin.advisor.validation.SignalLadderValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for signal synthesis. Gathers sentiment and the model prediction under a deadline,
 * then hands the series to the category's strategy, validates the resulting ladder and attaches the
 * multi-timeframe read.
 */
@Service
@Slf4j
public class SignalScoringEngine {

    private final Map<SignalCategory, SignalStrategy> strategies = new EnumMap<>(SignalCategory.class);
    private final SentimentSource sentimentSource;
    private final DirectionPredictor directionPredictor;
    private final BoundedCallExecutor boundedCalls;
    private final SignalLadderValidator validator;
    private final MultiTimeframeAnalyzer timeframeAnalyzer;
    private final Duration timeout;
    private final Clock clock;

    public SignalScoringEngine(List<SignalStrategy> strategies,
                               SentimentSource sentimentSource,
                               DirectionPredictor directionPredictor,
                               BoundedCallExecutor boundedCalls,
                               SignalLadderValidator validator,
                               MultiTimeframeAnalyzer timeframeAnalyzer,
                               SignalProps props,
                               Clock clock) {
        for (SignalStrategy s : strategies) {
            this.strategies.put(s.category(), s);
        }
        this.sentimentSource = sentimentSource;
        this.directionPredictor = directionPredictor;
        this.boundedCalls = boundedCalls;
        this.validator = validator;
        this.timeframeAnalyzer = timeframeAnalyzer;
        this.timeout = props.feed().timeout();
        this.clock = clock;
    }

    public Optional<Signal> evaluate(PriceSeries series, SignalCategory category, MarketKind marketKind) {
        SignalStrategy strategy = strategies.get(category);
        if (strategy == null) {
            throw new IllegalStateException("No strategy registered for category " + category);
        }
        if (series == null || series.size() == 0) {
            return Optional.empty();
        }

        MarketInputs inputs = gatherInputs(series, category);
        Optional<Signal> signal = strategy.evaluate(series, marketKind, inputs);
        signal.ifPresent(validator::requireValid);
        signal.ifPresent(s -> attachAlignment(s, series));
        signal.ifPresent(s -> log.info("signal_generated id={} pair={} category={} dir={} conf={} entry={} sl={} tp3={}",
                s.getId(), s.getPair(), category, s.getDirection(), s.getConfidence(),
                s.getEntryPrice(), s.getStopLoss(), s.getTakeProfit3()));
        return signal;
    }

    private void attachAlignment(Signal signal, PriceSeries series) {
        TimeframeAlignment alignment = timeframeAnalyzer.analyze(series, signal.getTimeframe());
        signal.setTimeframeAlignment(alignment);
        List<String> analysis = signal.getMarketAnalysis() == null
                ? new ArrayList<>() : new ArrayList<>(signal.getMarketAnalysis());
        if (alignment.aligned()) {
            analysis.add("Timeframes aligned " + alignment.dominantTrend()
                    + " (strength " + alignment.strength() + ")");
        }
        if (signal.getDirection() != null && alignment.confirmedByHigherTimeframe(signal.getDirection())) {
            analysis.add("Higher timeframe confirms the " + signal.getDirection() + " bias");
        }
        analysis.addAll(alignment.divergences());
        signal.setMarketAnalysis(analysis);
    }

    private MarketInputs gatherInputs(PriceSeries series, SignalCategory category) {
        double sentiment = boundedCalls.call("sentiment:" + series.pair(),
                () -> sentimentSource.score(series.pair()), timeout, 0.0);

        Optional<DirectionPrediction> prediction = Optional.empty();
        if (category == SignalCategory.STANDARD) {
            prediction = boundedCalls.call("prediction:" + series.pair(),
                    () -> directionPredictor.predict(series), timeout, Optional.empty());
        }
        return new MarketInputs(sentiment, prediction, clock.instant());
    }
}
