package com.kotsin.advisor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalEvent {

    public enum Type {
        SIGNAL_COMPLETED,
        SIGNAL_STOPPED,
        BATCH_GENERATED
    }

    private Type type;
    private SignalCategory category;
    private String signalId;
    private String pair;
    private SignalDirection direction;
    private Double profitLossPercentage;
    private int count;
    private Instant timestamp;

    public static SignalEvent closed(Signal signal, SignalCategory category, Instant now) {
        return SignalEvent.builder()
                .type(signal.getStatus() == SignalStatus.STOPPED ? Type.SIGNAL_STOPPED : Type.SIGNAL_COMPLETED)
                .category(category)
                .signalId(signal.getId())
                .pair(signal.getPair())
                .direction(signal.getDirection())
                .profitLossPercentage(signal.getProfitLossPercentage())
                .timestamp(now)
                .build();
    }

    public static SignalEvent batch(SignalCategory category, int count, Instant now) {
        return SignalEvent.builder()
                .type(Type.BATCH_GENERATED)
                .category(category)
                .count(count)
                .timestamp(now)
                .build();
    }
}
