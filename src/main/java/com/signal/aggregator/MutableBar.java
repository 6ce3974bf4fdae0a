package com.signal.aggregator;

import com.signal.model.Bar;

/**
 * Mutable accumulator for the in-progress bar.
 *
 * Not thread-safe; the owning {@link BarAggregator} is only driven under the engine lock.
 */
class MutableBar {

    private final long bucketTime;
    private final double open;
    private double high;
    private double low;
    private double close;
    private double volume;

    MutableBar(long bucketTime, double firstPrice, double firstVolume) {
        this.bucketTime = bucketTime;
        this.open = firstPrice;
        this.high = firstPrice;
        this.low = firstPrice;
        this.close = firstPrice;
        this.volume = firstVolume;
    }

    void update(double price, double tickVolume) {
        if (price > high) high = price;
        if (price < low) low = price;
        close = price;
        volume += tickVolume;
    }

    long getBucketTime() {
        return bucketTime;
    }

    double getClose() {
        return close;
    }

    Bar snapshot() {
        return new Bar(bucketTime, open, high, low, close, volume);
    }
}
