package com.signal.service;

import com.signal.event.Tick;
import com.signal.indicator.IndicatorEngine;
import com.signal.lifecycle.ResolutionPolicy;
import com.signal.lifecycle.SignalIdGenerator;
import com.signal.lifecycle.SignalLifecycleManager;
import com.signal.model.Bar;
import com.signal.model.Signal;
import com.signal.model.Timeframe;
import com.signal.prediction.PredictionOracle;
import com.signal.prediction.PredictionService;
import com.signal.scoring.SignalScorer;
import com.signal.sentiment.SentimentTracker;
import com.signal.store.BarHistory;
import com.signal.support.Bars;
import com.signal.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static com.signal.support.Bars.MINUTE;
import static com.signal.support.Bars.T0;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that {@link SignalEngine} keeps its invariants with ticks and resolution sweeps
 * arriving from many threads at once.
 */
@DisplayName("SignalEngine concurrency")
class ConcurrencyTest {

    private static final int SEEDED = 40;

    @Test
    @DisplayName("Concurrent ingestion and resolution keep ordered history and one pending signal per timeframe")
    void concurrentIngestAndResolve() throws InterruptedException {
        MutableClock clock = new MutableClock(T0 + SEEDED * MINUTE);
        SentimentTracker sentiment = new SentimentTracker();
        SignalLifecycleManager lifecycle = new SignalLifecycleManager(ResolutionPolicy.DEFAULT);
        BarHistory history = new BarHistory(3500);
        AtomicInteger violations = new AtomicInteger();
        AtomicInteger createdCount = new AtomicInteger();

        PredictionOracle oracle = new PredictionOracle() {
            @Override
            public int windowSize() {
                return 30;
            }

            @Override
            public Optional<Double> predictNext(List<Double> closes) {
                return Optional.of(closes.get(closes.size() - 1) * 1.01);
            }
        };
        SignalEventListener checker = new SignalEventListener() {
            @Override
            public void onSignalCreated(Signal signal) {
                createdCount.incrementAndGet();
                long pending = lifecycle.signals().stream()
                        .filter(s -> s.isPending() && s.timeframe().equals(signal.timeframe()))
                        .count();
                if (pending > 1) violations.incrementAndGet();
            }
        };

        SignalEngine engine = new SignalEngine(history, new IndicatorEngine(),
                new SignalScorer(sentiment, new SignalIdGenerator(), clock), lifecycle, sentiment,
                new PredictionService(oracle, Runnable::run, 250), List.of(checker), clock,
                List.of(Timeframe.ONE_MINUTE, Timeframe.FIVE_MINUTES));

        double[] closes = new double[SEEDED];
        for (int i = 0; i < SEEDED; i++) closes[i] = 1.1 + i * 0.0005;
        engine.seed(Bars.fromCloses(closes));

        int threads = 8;
        int ticksPerThread = 200;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        AtomicBoolean ingesting = new AtomicBoolean(true);
        ExecutorService executor = Executors.newFixedThreadPool(threads + 1);

        for (int t = 0; t < threads; t++) {
            final int threadIndex = t;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < ticksPerThread; i++) {
                        // 15s apart, so every thread rolls ~50 one-minute buckets
                        long timestamp = T0 + SEEDED * MINUTE + i * 15_000L + threadIndex * 100L;
                        double price = 1.12 + i * 0.0001 + threadIndex * 0.00001;
                        engine.ingest(new Tick(price, timestamp));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        executor.submit(() -> {
            try {
                startLatch.await();
                while (ingesting.get()) {
                    clock.advance(Duration.ofSeconds(20));
                    engine.resolveExpiredSignals();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        startLatch.countDown();
        assertThat(doneLatch.await(30, TimeUnit.SECONDS)).isTrue();
        ingesting.set(false);
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(violations.get()).isZero();
        assertThat(createdCount.get()).isPositive();

        List<Bar> bars = history.snapshot();
        assertThat(bars.size()).isGreaterThan(SEEDED);
        for (int i = 1; i < bars.size(); i++) {
            assertThat(bars.get(i).timestamp()).isGreaterThan(bars.get(i - 1).timestamp());
        }

        Map<String, Long> pendingPerTimeframe = lifecycle.signals().stream()
                .filter(Signal::isPending)
                .collect(Collectors.groupingBy(Signal::timeframe, Collectors.counting()));
        assertThat(pendingPerTimeframe.values()).allSatisfy(count -> assertThat(count).isLessThanOrEqualTo(1L));
        lifecycle.signals().stream().filter(s -> !s.isPending())
                .forEach(s -> assertThat(s.exitPrice()).isNotNull());
    }
}
