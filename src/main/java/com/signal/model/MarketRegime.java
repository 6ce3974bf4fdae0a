package com.signal.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Market state label produced by the signal scorer.
 */
public enum MarketRegime {

    GATHERING_DATA("GATHERING_DATA"),
    CALCULATING("CALCULATING"),
    STRONG_BULL_TREND("STRONG_BULL_TREND"),
    STRONG_BEAR_TREND("STRONG_BEAR_TREND"),
    CHOPPY("CHOPPY/SIDEWAYS"),
    RANGING("RANGING"),
    NEWS_BULLISH("NEWS_BULLISH"),
    NEWS_BEARISH("NEWS_BEARISH");

    private final String label;

    MarketRegime(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
