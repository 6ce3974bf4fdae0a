package com.signal.sentiment;

import com.signal.event.NewsEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling market sentiment in {@code [-100, 100]}, raised or lowered by news and decayed
 * towards zero on every read.
 *
 * <p>Decay is read-triggered: each {@link #read()} multiplies the score by {@value #DECAY}
 * and snaps it to exactly 0 once its magnitude drops below 1. Nothing decays while nobody reads.
 */
@Component
public class SentimentTracker {

    private static final Logger log = LoggerFactory.getLogger(SentimentTracker.class);

    public static final double DECAY = 0.995;
    public static final double LIMIT = 100.0;

    private final ReentrantLock lock = new ReentrantLock();
    private double score;

    /**
     * Add the event's signed impact and clamp the running total.
     *
     * @return the score after ingestion
     */
    public double ingest(NewsEvent event) {
        lock.lock();
        try {
            score = Math.max(-LIMIT, Math.min(LIMIT, score + event.signedPoints()));
            log.info("News ingested: [{} / {}] {} -> sentiment={}",
                    event.sentiment(), event.impact(), event.headline(), String.format("%.2f", score));
            return score;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decay the score one step and return it.
     */
    public double read() {
        lock.lock();
        try {
            score = score * DECAY;
            if (Math.abs(score) < 1) score = 0;
            return score;
        } finally {
            lock.unlock();
        }
    }
}
