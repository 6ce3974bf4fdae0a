package com.signal.prediction;

import java.util.List;
import java.util.Optional;

/**
 * Oracle used when no prediction model is wired in. Scoring runs on technicals and sentiment only.
 */
public class UnavailablePredictionOracle implements PredictionOracle {

    public static final int DEFAULT_WINDOW = 30;

    @Override
    public int windowSize() {
        return DEFAULT_WINDOW;
    }

    @Override
    public Optional<Double> predictNext(List<Double> closes) {
        return Optional.empty();
    }
}
