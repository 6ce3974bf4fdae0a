package com.signal.generator;

import com.signal.event.NewsEvent;
import com.signal.event.NewsImpact;
import com.signal.event.NewsSentiment;
import com.signal.service.SignalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Simulated macro news feed. Picks a headline template at a fixed rate and feeds it to the
 * engine's sentiment tracker.
 */
@Component
@ConditionalOnProperty(name = "signal.news.enabled", havingValue = "true", matchIfMissing = true)
public class NewsGenerator {

    private static final Logger log = LoggerFactory.getLogger(NewsGenerator.class);

    static final String SOURCE = "Simulated Wire";

    private record Template(String headline, NewsSentiment sentiment, NewsImpact impact) {
    }

    private static final List<Template> TEMPLATES = List.of(
            new Template("US CPI Inflation data shows cooling trend", NewsSentiment.POSITIVE, NewsImpact.HIGH),
            new Template("Federal Reserve hints at interest rate hold", NewsSentiment.POSITIVE, NewsImpact.HIGH),
            new Template("ECB President warns on Eurozone growth", NewsSentiment.NEGATIVE, NewsImpact.MEDIUM),
            new Template("US Jobless claims higher than expected", NewsSentiment.NEGATIVE, NewsImpact.HIGH),
            new Template("Geopolitical tensions easing in key regions", NewsSentiment.POSITIVE, NewsImpact.MEDIUM),
            new Template("Tech sector rally boosting market confidence", NewsSentiment.POSITIVE, NewsImpact.LOW),
            new Template("Crude Oil inventory surplus reported", NewsSentiment.NEGATIVE, NewsImpact.MEDIUM),
            new Template("Market consolidation ahead of FOMC minutes", NewsSentiment.NEUTRAL, NewsImpact.LOW),
            new Template("Retail Sales data disappoints analysts", NewsSentiment.NEGATIVE, NewsImpact.MEDIUM),
            new Template("German Manufacturing PMI beats expectations", NewsSentiment.POSITIVE, NewsImpact.MEDIUM)
    );

    private final SignalEngine engine;
    private final Clock clock;
    private final Random random = new Random();

    public NewsGenerator(SignalEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${signal.news.interval-ms:240000}")
    public void publish() {
        Template template = TEMPLATES.get(random.nextInt(TEMPLATES.size()));
        NewsEvent event = new NewsEvent(template.headline(), template.sentiment(), template.impact(),
                clock.millis(), SOURCE);
        log.info("NEWS: [{}] {}", event.sentiment(), event.headline());
        engine.onNews(event);
    }
}
