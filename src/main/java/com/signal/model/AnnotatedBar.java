package com.signal.model;

/**
 * A bar together with the indicator values computed for it in one pass.
 */
public record AnnotatedBar(Bar bar, IndicatorValues indicators) {

    public AnnotatedBar {
        if (bar == null) throw new IllegalArgumentException("Bar is required");
        if (indicators == null) indicators = IndicatorValues.NONE;
    }

    public double close() {
        return bar.close();
    }

    public long timestamp() {
        return bar.timestamp();
    }
}
