package com.signal.event;

/**
 * A single price observation for the tracked instrument.
 *
 * @param price     Last traded or quoted price
 * @param timestamp Unix timestamp in milliseconds
 * @param volume    Traded volume if the venue supplies it, otherwise 0
 */
public record Tick(double price, long timestamp, double volume) {

    public Tick {
        if (!Double.isFinite(price) || price <= 0) throw new IllegalArgumentException("Price must be a positive number");
        if (timestamp < 0) throw new IllegalArgumentException("Timestamp must not be negative");
        if (!Double.isFinite(volume) || volume < 0) throw new IllegalArgumentException("Volume must be non-negative");
    }

    public Tick(double price, long timestamp) {
        this(price, timestamp, 0.0);
    }
}
