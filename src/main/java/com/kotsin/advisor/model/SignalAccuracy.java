package com.kotsin.advisor.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SignalAccuracy {
    private int total;
    private int successful;
    private int failed;
    private int active;
    private double accuracyRate;
    private double averageProfitLoss;
}
