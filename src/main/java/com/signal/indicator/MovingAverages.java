package com.signal.indicator;

/**
 * Recursive smoothing steps. A {@code null} previous value seeds the average with the raw value.
 */
final class MovingAverages {

    private MovingAverages() {}

    /**
     * Exponential moving average step, {@code k = 2 / (period + 1)}.
     */
    static double ema(double value, Double previous, int period) {
        if (previous == null) return value;
        double k = 2.0 / (period + 1);
        return value * k + previous * (1 - k);
    }

    /**
     * Wilder's moving average step, smoothing factor {@code 1 / period}.
     */
    static double rma(double value, Double previous, int period) {
        if (previous == null) return value;
        return (previous * (period - 1) + value) / period;
    }
}
