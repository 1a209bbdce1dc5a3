package com.kotsin.advisor.feed;

import com.kotsin.advisor.model.DirectionPrediction;
import com.kotsin.advisor.model.PriceSeries;

import java.util.Optional;

public interface DirectionPredictor {

    Optional<DirectionPrediction> predict(PriceSeries series);
}
