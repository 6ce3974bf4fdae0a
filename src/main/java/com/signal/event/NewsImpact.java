package com.signal.event;

/**
 * Impact tier of a news item and the sentiment points it is worth.
 */
public enum NewsImpact {
    HIGH(25),
    MEDIUM(15),
    LOW(5);

    private final int points;

    NewsImpact(int points) {
        this.points = points;
    }

    public int getPoints() {
        return points;
    }
}
