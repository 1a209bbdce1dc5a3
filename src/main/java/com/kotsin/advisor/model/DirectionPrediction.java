package com.kotsin.advisor.model;

import lombok.Builder;
import lombok.Data;

/**
 * Output of an external direction model. Confidence is 0-100, accuracy is the model's own 0-100 track record.
 */
@Data
@Builder
public class DirectionPrediction {
    private Bias direction;
    private double confidence;
    private double accuracy;
    private String model;

    public enum Bias {
        BULLISH,
        BEARISH,
        NEUTRAL
    }
}
