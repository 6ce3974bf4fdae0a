package com.signal.event;

/**
 * A discrete market news item.
 *
 * @param headline  Headline text
 * @param sentiment Expected direction of impact
 * @param impact    Impact tier
 * @param timestamp Unix timestamp in milliseconds
 * @param source    Originating feed
 */
public record NewsEvent(String headline, NewsSentiment sentiment, NewsImpact impact, long timestamp, String source) {

    public NewsEvent {
        if (headline == null || headline.isBlank()) throw new IllegalArgumentException("Headline must not be blank");
        if (sentiment == null) throw new IllegalArgumentException("Sentiment is required");
        if (impact == null) throw new IllegalArgumentException("Impact is required");
        if (timestamp < 0) throw new IllegalArgumentException("Timestamp must not be negative");
    }

    /**
     * Signed sentiment points this event contributes: impact points with the sentiment's sign.
     */
    public int signedPoints() {
        return impact.getPoints() * sentiment.getSign();
    }
}
