package com.signal.store;

import com.signal.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * In-memory, append-only history of sealed base bars for the tracked instrument.
 *
 * <p>Bars only enter through {@link #append} (a live bar was sealed) or {@link #seed}
 * (historical backfill) and must be strictly newer than the last stored bar. The history
 * is capped; once full, the oldest bar is evicted for every new one.
 */
@Repository
public class BarHistory {

    private static final Logger log = LoggerFactory.getLogger(BarHistory.class);

    private final int maxBars;
    private final Deque<Bar> bars = new ArrayDeque<>();

    public BarHistory(@Value("${signal.history.max-bars:3500}") int maxBars) {
        if (maxBars <= 0) throw new IllegalArgumentException("maxBars must be positive");
        this.maxBars = maxBars;
    }

    /**
     * Append one sealed bar.
     *
     * @return false if the bar is not newer than the last stored bar
     */
    public synchronized boolean append(Bar bar) {
        Bar last = bars.peekLast();
        if (last != null && bar.timestamp() <= last.timestamp()) {
            log.warn("Rejected bar at time={} (last stored time={})", bar.timestamp(), last.timestamp());
            return false;
        }
        bars.addLast(bar);
        while (bars.size() > maxBars) {
            bars.removeFirst();
        }
        return true;
    }

    /**
     * Load a historical sequence, skipping bars that would break ordering.
     *
     * @return number of bars stored
     */
    public synchronized int seed(List<Bar> historical) {
        int stored = 0;
        for (Bar bar : historical) {
            if (append(bar)) stored++;
        }
        log.info("Seeded {} of {} historical bars (history size={})", stored, historical.size(), bars.size());
        return stored;
    }

    /**
     * Immutable copy of the history, ascending by time.
     */
    public synchronized List<Bar> snapshot() {
        return List.copyOf(bars);
    }

    public synchronized Optional<Bar> last() {
        return Optional.ofNullable(bars.peekLast());
    }

    public synchronized int size() {
        return bars.size();
    }

    /**
     * Clears all data, primarily for testing.
     */
    public synchronized void clear() {
        bars.clear();
    }
}
