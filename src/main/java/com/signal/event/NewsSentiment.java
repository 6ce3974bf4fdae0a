package com.signal.event;

/**
 * Direction of a news item's expected market impact.
 */
public enum NewsSentiment {
    POSITIVE(1),
    NEGATIVE(-1),
    NEUTRAL(0);

    private final int sign;

    NewsSentiment(int sign) {
        this.sign = sign;
    }

    public int getSign() {
        return sign;
    }
}
