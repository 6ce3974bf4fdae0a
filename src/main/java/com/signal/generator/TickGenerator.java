package com.signal.generator;

import com.signal.event.Tick;
import com.signal.service.SignalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated tick source.
 *
 * <p>Produces a Gaussian random walk for the configured instrument at a fixed rate. Enabled
 * unless {@code signal.generator.enabled=false}; a real feed adapter replaces it by calling
 * {@link SignalEngine#ingest} directly.
 */
@Component
@ConditionalOnProperty(name = "signal.generator.enabled", havingValue = "true", matchIfMissing = true)
public class TickGenerator {

    private static final Logger log = LoggerFactory.getLogger(TickGenerator.class);

    /** Standard deviation of one step, relative to price. */
    private static final double STEP = 0.00005;

    private final SignalEngine engine;
    private final Clock clock;
    private final Random random = new Random();
    private final AtomicLong tickCount = new AtomicLong(0);

    private double price;

    public TickGenerator(SignalEngine engine, Clock clock,
                         @Value("${signal.generator.start-price:1.10000}") double startPrice) {
        this.engine = engine;
        this.clock = clock;
        this.price = startPrice;
        log.info("TickGenerator initialized at price={}", startPrice);
    }

    @Scheduled(fixedRateString = "${signal.generator.interval-ms:500}")
    public synchronized void generate() {
        price = Math.max(price + price * random.nextGaussian() * STEP, 0.0001);
        engine.ingest(new Tick(price, clock.millis()));

        long count = tickCount.incrementAndGet();
        if (count % 500 == 0) {
            log.info("Generated {} ticks. Latest price={}", count, String.format("%.5f", price));
        }
    }

    public long getTickCount() {
        return tickCount.get();
    }
}
