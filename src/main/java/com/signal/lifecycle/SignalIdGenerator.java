package com.signal.lifecycle;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic signal identifiers: {@code sig-1}, {@code sig-2}, ...
 * Replays that start from the same seed produce the same ids.
 */
@Component
public class SignalIdGenerator {

    private final AtomicLong counter;

    public SignalIdGenerator() {
        this(0L);
    }

    public SignalIdGenerator(long seed) {
        this.counter = new AtomicLong(seed);
    }

    public String nextId() {
        return "sig-" + counter.incrementAndGet();
    }
}
