package com.kotsin.advisor.monitor;

import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.Timeframe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Bounded random walk used when no live price is available for a tracked signal.
 * Step size is ±0.15% on 5-minute signals and ±0.4% otherwise, with a 0.15% drift toward TP2
 * once price is within 3% of it.
 */
@Component
@Slf4j
public class PriceWalkSimulator {

    static final double FAST_VOLATILITY = 0.003;
    static final double DEFAULT_VOLATILITY = 0.008;
    static final double TARGET_BIAS = 0.0015;
    static final double BIAS_ZONE = 0.03;

    private final Random random;

    public PriceWalkSimulator() {
        this(new Random());
    }

    public PriceWalkSimulator(Random random) {
        this.random = random;
    }

    public double next(Signal signal) {
        double current = signal.getCurrentPrice() > 0 ? signal.getCurrentPrice() : signal.getEntryPrice();
        double volatility = signal.getTimeframe() == Timeframe.M5 ? FAST_VOLATILITY : DEFAULT_VOLATILITY;
        double change = (random.nextDouble() - 0.5) * volatility + bias(signal, current);
        double next = current * (1 + change);
        log.debug("simulated_price pair={} change={} price={}", signal.getPair(), String.format("%.4f", change), next);
        return next;
    }

    static double bias(Signal signal, double current) {
        if (signal.getTakeProfit2() == null || current <= 0) {
            return 0;
        }
        boolean isLong = signal.isLong();
        double distance = isLong
                ? (signal.getTakeProfit2() - current) / current
                : (current - signal.getTakeProfit2()) / current;
        if (distance > 0 && distance < BIAS_ZONE) {
            return isLong ? TARGET_BIAS : -TARGET_BIAS;
        }
        return 0;
    }
}
