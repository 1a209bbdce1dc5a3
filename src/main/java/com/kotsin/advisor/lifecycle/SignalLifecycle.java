package com.kotsin.advisor.lifecycle;

import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * ACTIVE → COMPLETED | STOPPED transitions.
 *
 * Both methods are pure: they return a new {@link Signal} and never mutate their input.
 * A stop-loss breach is checked before target completion, so a tick that crosses both reports STOPPED.
 */
@Component
public class SignalLifecycle {

    /**
     * Applies one observed price to an active signal, using the running extrema for every crossing.
     */
    public Signal advance(Signal signal, double price, Instant now) {
        if (signal.getStatus() != SignalStatus.ACTIVE) {
            return signal;
        }
        Signal next = signal.toBuilder().currentPrice(price).build();

        next.setHighestPrice(Math.max(seedHigh(signal), price));
        next.setLowestPrice(Math.min(seedLow(signal), price));

        boolean isLong = next.isLong();
        double extreme = isLong ? next.getHighestPrice() : next.getLowestPrice();
        markTargets(next, extreme, isLong, now);

        double adverse = isLong ? next.getLowestPrice() : next.getHighestPrice();
        resolveStatus(next, adverse, isLong, now);
        return next;
    }

    /**
     * Applies a single price observed after a monitoring gap. No extremum history is available,
     * so levels are tested farthest-first against that price: TP3 implies TP2 and TP1.
     */
    public Signal reconcile(Signal signal, double price, Instant now) {
        if (signal.getStatus() != SignalStatus.ACTIVE) {
            return signal;
        }
        Signal next = signal.toBuilder().currentPrice(price).build();
        next.setHighestPrice(Math.max(seedHigh(signal), price));
        next.setLowestPrice(Math.min(seedLow(signal), price));

        boolean isLong = next.isLong();
        if (crossed(next.getTakeProfit3(), price, isLong)) {
            hitTp1(next, now);
            hitTp2(next, now);
            hitTp3(next, now);
        } else if (crossed(next.getTakeProfit2(), price, isLong)) {
            hitTp1(next, now);
            hitTp2(next, now);
        } else if (crossed(next.getTakeProfit1(), price, isLong)) {
            hitTp1(next, now);
        }

        resolveStatus(next, price, isLong, now);
        return next;
    }

    private void markTargets(Signal s, double extreme, boolean isLong, Instant now) {
        if (!s.isTp1Hit() && crossed(s.getTakeProfit1(), extreme, isLong)) hitTp1(s, now);
        if (!s.isTp2Hit() && crossed(s.getTakeProfit2(), extreme, isLong)) hitTp2(s, now);
        if (!s.isTp3Hit() && crossed(s.getTakeProfit3(), extreme, isLong)) hitTp3(s, now);
    }

    private void resolveStatus(Signal s, double adverse, boolean isLong, Instant now) {
        boolean stopped = isLong ? adverse <= s.getStopLoss() : adverse >= s.getStopLoss();

        if (stopped) {
            s.setStatus(SignalStatus.STOPPED);
        } else if (s.isTp2Hit() || s.isTp3Hit()) {
            s.setStatus(SignalStatus.COMPLETED);
        } else if (s.isExpired(now)) {
            s.setStatus(SignalStatus.COMPLETED);
        }

        s.setProfitLossPercentage(s.isTerminal()
                ? ProfitLossCalculator.realizedPercent(s)
                : ProfitLossCalculator.livePercent(s));
    }

    private boolean crossed(Double level, double price, boolean isLong) {
        if (level == null) return false;
        return isLong ? price >= level : price <= level;
    }

    private void hitTp1(Signal s, Instant now) {
        if (!s.isTp1Hit()) {
            s.setTp1Hit(true);
            s.setTp1HitTime(now);
        }
    }

    private void hitTp2(Signal s, Instant now) {
        if (!s.isTp2Hit()) {
            s.setTp2Hit(true);
            s.setTp2HitTime(now);
        }
    }

    private void hitTp3(Signal s, Instant now) {
        if (!s.isTp3Hit()) {
            s.setTp3Hit(true);
            s.setTp3HitTime(now);
        }
    }

    private double seedHigh(Signal s) {
        return s.getHighestPrice() > 0 ? s.getHighestPrice() : s.getEntryPrice();
    }

    private double seedLow(Signal s) {
        return s.getLowestPrice() > 0 ? s.getLowestPrice() : s.getEntryPrice();
    }
}
