package com.signal.aggregator;

import com.signal.event.Tick;
import com.signal.model.Bar;
import com.signal.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Folds a time-ordered stream of {@link Tick}s into base-interval {@link Bar}s.
 *
 * <p>A bar is sealed when the first tick of a newer bucket arrives. Sealing hands the
 * finished bar to the {@code onBarSealed} callback exactly once and opens the next bar
 * at the new tick's price. Ticks older than the open bucket are rejected.
 *
 * <p>Not thread-safe. {@link com.signal.service.SignalEngine} serializes every call.
 */
public class BarAggregator {

    private static final Logger log = LoggerFactory.getLogger(BarAggregator.class);

    private final Timeframe interval;
    private final Consumer<Bar> onBarSealed;

    /** The bar currently being built. Null until the first tick. */
    private MutableBar currentBar;

    public BarAggregator(Consumer<Bar> onBarSealed) {
        this(Timeframe.BASE, onBarSealed);
    }

    public BarAggregator(Timeframe interval, Consumer<Bar> onBarSealed) {
        this.interval = interval;
        this.onBarSealed = onBarSealed;
    }

    /**
     * Apply one tick.
     *
     * @return false if the tick was older than the open bar and was dropped
     */
    public boolean process(Tick tick) {
        long bucket = interval.bucketStart(tick.timestamp());

        if (currentBar == null) {
            currentBar = new MutableBar(bucket, tick.price(), tick.volume());
            log.debug("[{}] Started first bar at bucket={}", interval.getLabel(), bucket);
        } else if (bucket > currentBar.getBucketTime()) {
            seal();
            currentBar = new MutableBar(bucket, tick.price(), tick.volume());
            log.debug("[{}] Rolled to new bar at bucket={}", interval.getLabel(), bucket);
        } else if (bucket == currentBar.getBucketTime()) {
            currentBar.update(tick.price(), tick.volume());
        } else {
            log.warn("[{}] Out-of-order tick rejected: tickTime={} price={} currentBucket={}",
                    interval.getLabel(), tick.timestamp(), tick.price(), currentBar.getBucketTime());
            return false;
        }
        return true;
    }

    /**
     * Snapshot of the in-progress bar, if any tick has been seen.
     */
    public Optional<Bar> current() {
        return currentBar == null ? Optional.empty() : Optional.of(currentBar.snapshot());
    }

    /**
     * Close of the in-progress bar, i.e. the last accepted tick price.
     */
    public Optional<Double> lastPrice() {
        return currentBar == null ? Optional.empty() : Optional.of(currentBar.getClose());
    }

    private void seal() {
        Bar bar = currentBar.snapshot();
        log.info("[{}] Bar sealed: time={} O={} H={} L={} C={} V={}",
                interval.getLabel(), bar.timestamp(), bar.open(), bar.high(), bar.low(), bar.close(), bar.volume());
        onBarSealed.accept(bar);
    }
}
