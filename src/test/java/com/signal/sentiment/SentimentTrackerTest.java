package com.signal.sentiment;

import com.signal.event.NewsEvent;
import com.signal.event.NewsImpact;
import com.signal.event.NewsSentiment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SentimentTracker")
class SentimentTrackerTest {

    private SentimentTracker tracker;

    private static NewsEvent news(NewsSentiment sentiment, NewsImpact impact) {
        return new NewsEvent("headline", sentiment, impact, 0L, "test");
    }

    @BeforeEach
    void setUp() {
        tracker = new SentimentTracker();
    }

    @Test
    @DisplayName("Starts neutral")
    void startsNeutral() {
        assertThat(tracker.read()).isZero();
    }

    @Test
    @DisplayName("Ingest adds signed impact points")
    void ingestAddsPoints() {
        assertThat(tracker.ingest(news(NewsSentiment.POSITIVE, NewsImpact.HIGH))).isEqualTo(25.0);
        assertThat(tracker.ingest(news(NewsSentiment.NEGATIVE, NewsImpact.MEDIUM))).isEqualTo(10.0);
        assertThat(tracker.ingest(news(NewsSentiment.NEUTRAL, NewsImpact.HIGH))).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Score is clamped to [-100, 100]")
    void clamped() {
        for (int i = 0; i < 6; i++) tracker.ingest(news(NewsSentiment.POSITIVE, NewsImpact.HIGH));
        assertThat(tracker.ingest(news(NewsSentiment.POSITIVE, NewsImpact.LOW))).isEqualTo(100.0);

        for (int i = 0; i < 10; i++) tracker.ingest(news(NewsSentiment.NEGATIVE, NewsImpact.HIGH));
        assertThat(tracker.ingest(news(NewsSentiment.NEGATIVE, NewsImpact.LOW))).isEqualTo(-100.0);
    }

    @Test
    @DisplayName("Each read decays the score by 0.995")
    void readDecays() {
        tracker.ingest(news(NewsSentiment.POSITIVE, NewsImpact.HIGH));
        assertThat(tracker.read()).isCloseTo(25 * 0.995, within(1e-9));
        assertThat(tracker.read()).isCloseTo(25 * 0.995 * 0.995, within(1e-9));
    }

    @Test
    @DisplayName("Negative scores decay towards zero without crossing it")
    void negativeDecayNoOvershoot() {
        tracker.ingest(news(NewsSentiment.NEGATIVE, NewsImpact.LOW));
        double previous = -5;
        for (int i = 0; i < 400; i++) {
            double current = tracker.read();
            assertThat(current).isLessThanOrEqualTo(0.0).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
        assertThat(previous).isZero();
    }

    @Test
    @DisplayName("A magnitude below 1 snaps to exactly zero")
    void snapsToZero() {
        tracker.ingest(news(NewsSentiment.POSITIVE, NewsImpact.LOW));
        // 5 * 0.995^n < 1 once n >= 322
        for (int i = 0; i < 321; i++) tracker.read();
        assertThat(tracker.read()).isZero();
        assertThat(tracker.read()).isZero();
    }
}
