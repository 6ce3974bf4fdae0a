package com.signal.support;

import com.signal.model.AnnotatedBar;
import com.signal.model.Bar;
import com.signal.model.IndicatorValues;

import java.util.ArrayList;
import java.util.List;

/**
 * Bar fixtures shared by tests.
 */
public final class Bars {

    /** 2023-11-14T22:15:00Z, aligned to every supported timeframe up to 5m. */
    public static final long T0 = 1_700_000_100_000L;
    public static final long MINUTE = 60_000L;

    private Bars() {}

    public static Bar flat(long timestamp, double price) {
        return new Bar(timestamp, price, price, price, price, 0);
    }

    /**
     * One-minute bars starting at {@link #T0}, one per close, with a small high/low range.
     */
    public static List<Bar> fromCloses(double... closes) {
        List<Bar> bars = new ArrayList<>(closes.length);
        double prevClose = closes.length > 0 ? closes[0] : 0;
        for (int i = 0; i < closes.length; i++) {
            double open = prevClose;
            double close = closes[i];
            double high = Math.max(open, close) + 0.0002;
            double low = Math.min(open, close) - 0.0002;
            bars.add(new Bar(T0 + i * MINUTE, open, high, low, close, 1));
            prevClose = close;
        }
        return bars;
    }

    /**
     * Deterministic wavy price path around {@code base}.
     */
    public static List<Bar> wave(int count, double base) {
        double[] closes = new double[count];
        for (int i = 0; i < count; i++) {
            closes[i] = base + 0.002 * Math.sin(i / 5.0) + 0.0007 * Math.cos(i / 1.7) + i * 0.00001;
        }
        return fromCloses(closes);
    }

    /**
     * Wrap bars with blank indicators.
     */
    public static List<AnnotatedBar> unannotated(List<Bar> bars) {
        return bars.stream().map(bar -> new AnnotatedBar(bar, IndicatorValues.NONE)).toList();
    }
}
