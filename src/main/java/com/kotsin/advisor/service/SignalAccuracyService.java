package com.kotsin.advisor.service;

import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalAccuracy;
import com.kotsin.advisor.model.SignalStatus;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Win/loss summary over a set of signals.
 */
@Service
public class SignalAccuracyService {

    public SignalAccuracy calculate(List<Signal> signals) {
        int successful = 0;
        int failed = 0;
        int active = 0;
        double pnlSum = 0;

        for (Signal s : signals) {
            if (s.getStatus() == SignalStatus.ACTIVE) {
                active++;
                continue;
            }
            pnlSum += s.getProfitLossPercentage();
            if (s.getStatus() == SignalStatus.COMPLETED && s.getProfitLossPercentage() > 0) {
                successful++;
            } else {
                failed++;
            }
        }

        int closed = successful + failed;
        return SignalAccuracy.builder()
                .total(signals.size())
                .successful(successful)
                .failed(failed)
                .active(active)
                .accuracyRate(closed == 0 ? 0.0 : (double) successful / closed * 100.0)
                .averageProfitLoss(closed == 0 ? 0.0 : pnlSum / closed)
                .build();
    }
}
