package com.signal.model;

/**
 * Discretized strength of a signal's winning score.
 */
public enum SignalStrength {
    WEAK,
    MODERATE,
    STRONG,
    MAX;

    public static SignalStrength forScore(double score) {
        if (score > 100) return MAX;
        if (score > 85) return STRONG;
        if (score > 70) return MODERATE;
        return WEAK;
    }
}
