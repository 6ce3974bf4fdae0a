package com.signal.prediction;

import java.util.List;
import java.util.Optional;

/**
 * External price-prediction model. Implementations may be slow or fail; callers go through
 * {@link PredictionService}, which never lets a call stall scoring.
 */
public interface PredictionOracle {

    /**
     * Number of trailing closes {@link #predictNext} expects.
     */
    int windowSize();

    /**
     * Predict the next close from exactly {@link #windowSize()} trailing closes, oldest first.
     *
     * @return the predicted close, or empty if the model is unavailable
     */
    Optional<Double> predictNext(List<Double> closes);
}
