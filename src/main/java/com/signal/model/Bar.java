package com.signal.model;

/**
 * Immutable OHLCV bar for one interval.
 *
 * @param timestamp Interval start in Unix milliseconds
 * @param open      First price in the interval
 * @param high      Highest price in the interval
 * @param low       Lowest price in the interval
 * @param close     Last price in the interval
 * @param volume    Traded volume (0 when the feed carries none)
 */
public record Bar(long timestamp, double open, double high, double low, double close, double volume) {

    public Bar {
        if (timestamp < 0) throw new IllegalArgumentException("Timestamp must not be negative");
        if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low)
                || !Double.isFinite(close) || !Double.isFinite(volume)) {
            throw new IllegalArgumentException("Prices and volume must be finite");
        }
        if (high < low) throw new IllegalArgumentException("High must be >= low");
        if (low > Math.min(open, close)) throw new IllegalArgumentException("Low must be <= open and close");
        if (high < Math.max(open, close)) throw new IllegalArgumentException("High must be >= open and close");
        if (volume < 0) throw new IllegalArgumentException("Volume must be non-negative");
    }
}
