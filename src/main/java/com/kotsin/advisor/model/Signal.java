package com.kotsin.advisor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An advisory signal and its tracked progress.
 *
 * The ladder fields are fixed at creation. Extrema, hit flags, status and P/L move only through
 * {@link com.kotsin.advisor.lifecycle.SignalLifecycle}; a terminal signal is never advanced again.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Signal {

    private String id;
    private String pair;
    private SignalCategory category;
    private MarketKind marketKind;
    private VenueKind venue;
    private SignalDirection direction;

    // Ladder
    private double entryPrice;
    private double stopLoss;
    private double takeProfit;
    private Double takeProfit1;
    private Double takeProfit2;
    private Double takeProfit3;

    // Tracking
    private double currentPrice;
    private double highestPrice;
    private double lowestPrice;
    private boolean tp1Hit;
    private boolean tp2Hit;
    private boolean tp3Hit;
    private Instant tp1HitTime;
    private Instant tp2HitTime;
    private Instant tp3HitTime;

    @Builder.Default
    private SignalStatus status = SignalStatus.ACTIVE;
    private double profitLossPercentage;

    // Informational
    private int confidence;
    private double riskScore;
    @Builder.Default
    private List<String> rationale = new ArrayList<>();
    @Builder.Default
    private List<String> marketAnalysis = new ArrayList<>();
    @Builder.Default
    private List<String> detectedPatterns = new ArrayList<>();
    private Timeframe timeframe;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant validUntil;
    private double sentimentScore;
    private MarketTrend marketTrend;
    private boolean counterTrend;
    private MarketCondition marketCondition;
    private TechnicalAlignment technicalAlignment;
    private Double volumeVsAverage;
    private Double rsi;
    private Double macdValue;
    private Double macdSignal;
    private Double predictionAgreement;
    private TimeframeAlignment timeframeAlignment;

    // Archival metadata
    private Instant completedAt;
    private SignalCategory archivedCategory;

    @JsonIgnore
    public boolean isLong() {
        return direction != null && direction.isLong();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
