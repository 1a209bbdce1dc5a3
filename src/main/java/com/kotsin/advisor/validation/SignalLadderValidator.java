package com.kotsin.advisor.validation;

import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalDirection;
import org.springframework.stereotype.Component;

/**
 * Checks price relationships of a freshly generated signal before it is stored.
 */
@Component
public class SignalLadderValidator {

    public ValidationResult validate(Signal signal) {
        ValidationResult result = new ValidationResult();

        if (signal == null) {
            result.addError("Signal is null");
            return result;
        }
        if (signal.getDirection() == null) {
            result.addError("direction is required");
            return result;
        }

        validatePriceLevels(signal, result);
        validateDirection(signal, result);
        validateScores(signal, result);
        return result;
    }

    /**
     * @throws SignalInvariantException when any error is found
     */
    public Signal requireValid(Signal signal) {
        ValidationResult result = validate(signal);
        if (!result.isValid()) {
            throw new SignalInvariantException(signal == null ? "null" : signal.getId(), result);
        }
        return signal;
    }

    private void validatePriceLevels(Signal signal, ValidationResult result) {
        double entry = signal.getEntryPrice();
        double sl = signal.getStopLoss();
        Double t1 = signal.getTakeProfit1();
        Double t2 = signal.getTakeProfit2();
        Double t3 = signal.getTakeProfit3();

        if (!isFinite(entry) || entry <= 0) result.addError("entryPrice must be > 0");
        if (!isFinite(sl) || sl <= 0) result.addError("stopLoss must be > 0");
        if (t1 == null || t2 == null || t3 == null) {
            result.addError("takeProfit1..3 are required");
            return;
        }

        if (signal.isLong()) {
            // LONG: stopLoss < entry < tp1 < tp2 < tp3
            if (sl >= entry) {
                result.addError("LONG signal must have stopLoss < entryPrice (SL=" + sl + ", Entry=" + entry + ")");
            }
            if (t1 <= entry) {
                result.addError("LONG signal must have takeProfit1 > entryPrice (TP1=" + t1 + ", Entry=" + entry + ")");
            }
            if (!(t1 < t2 && t2 < t3)) {
                result.addError("LONG signal must have TP1 < TP2 < TP3 (" + t1 + ", " + t2 + ", " + t3 + ")");
            }
        } else {
            // SHORT: tp3 < tp2 < tp1 < entry < stopLoss
            if (sl <= entry) {
                result.addError("SHORT signal must have stopLoss > entryPrice (SL=" + sl + ", Entry=" + entry + ")");
            }
            if (t1 >= entry) {
                result.addError("SHORT signal must have takeProfit1 < entryPrice (TP1=" + t1 + ", Entry=" + entry + ")");
            }
            if (!(t1 > t2 && t2 > t3)) {
                result.addError("SHORT signal must have TP1 > TP2 > TP3 (" + t1 + ", " + t2 + ", " + t3 + ")");
            }
        }

        double riskPercent = entry > 0 ? Math.abs(entry - sl) / entry * 100 : 0;
        if (riskPercent > 10.0) {
            result.addWarning("Risk is very wide (>10% of entry price)");
        }
    }

    private void validateDirection(Signal signal, ValidationResult result) {
        SignalDirection direction = signal.getDirection();
        if (signal.getMarketKind() == MarketKind.SPOT && !direction.isLong()) {
            result.addError("SPOT signals can only be BUY (was " + direction + ")");
        }
        if (signal.getMarketKind() == MarketKind.SPOT && direction == SignalDirection.LONG) {
            result.addWarning("SPOT signal labelled LONG");
        }
    }

    private void validateScores(Signal signal, ValidationResult result) {
        if (signal.getConfidence() < 0 || signal.getConfidence() > 100) {
            result.addError("confidence must be in range [0, 100] but was " + signal.getConfidence());
        }
    }

    private boolean isFinite(double v) {
        return !Double.isNaN(v) && !Double.isInfinite(v);
    }
}
