package com.signal.aggregator;

import com.signal.model.Bar;
import com.signal.model.Timeframe;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges base-interval bars into coarser bars.
 *
 * <p>Buckets are derived from each input bar's own timestamp,
 * {@code floor(timestamp / interval) * interval}, so callers must pass original base bars
 * rather than an already resampled series.
 */
public final class Resampler {

    private Resampler() {}

    public static List<Bar> resample(List<Bar> bars, Timeframe timeframe) {
        return resample(bars, timeframe.getMillis());
    }

    /**
     * @param bars           base bars, ascending by timestamp
     * @param intervalMillis target interval, a positive multiple of the base interval
     * @return one bar per non-empty bucket, ascending by bucket start
     */
    public static List<Bar> resample(List<Bar> bars, long intervalMillis) {
        long baseMillis = Timeframe.BASE.getMillis();
        if (intervalMillis <= 0 || intervalMillis % baseMillis != 0) {
            throw new IllegalArgumentException("Interval must be a positive multiple of " + baseMillis + "ms: " + intervalMillis);
        }
        if (intervalMillis == baseMillis) {
            return List.copyOf(bars);
        }

        Map<Long, List<Bar>> groups = new TreeMap<>();
        for (Bar bar : bars) {
            long bucket = Math.floorDiv(bar.timestamp(), intervalMillis) * intervalMillis;
            groups.computeIfAbsent(bucket, b -> new ArrayList<>()).add(bar);
        }

        List<Bar> resampled = new ArrayList<>(groups.size());
        for (Map.Entry<Long, List<Bar>> entry : groups.entrySet()) {
            List<Bar> group = entry.getValue();
            double high = Double.NEGATIVE_INFINITY;
            double low = Double.POSITIVE_INFINITY;
            double volume = 0;
            for (Bar bar : group) {
                high = Math.max(high, bar.high());
                low = Math.min(low, bar.low());
                volume += bar.volume();
            }
            resampled.add(new Bar(entry.getKey(), group.get(0).open(), high, low,
                    group.get(group.size() - 1).close(), volume));
        }
        return resampled;
    }
}
