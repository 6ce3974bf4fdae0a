package com.signal.controller;

import com.signal.event.NewsEvent;
import com.signal.event.NewsImpact;
import com.signal.event.NewsSentiment;
import com.signal.event.Tick;
import com.signal.service.SignalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Push endpoints for external tick and news feeds.
 *
 * <pre>
 * POST /ticks {"price": 1.10012, "timestamp": 1700000000000}
 * POST /news  {"headline": "...", "sentiment": "POSITIVE", "impact": "HIGH"}
 * </pre>
 */
@RestController
public class IngestController {

    private static final Logger log = LoggerFactory.getLogger(IngestController.class);

    private final SignalEngine engine;
    private final Clock clock;

    public IngestController(SignalEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    public record TickRequest(Double price, Long timestamp, Double volume) {
    }

    public record NewsRequest(String headline, NewsSentiment sentiment, NewsImpact impact, String source) {
    }

    @PostMapping("/ticks")
    public ResponseEntity<Map<String, String>> tick(@RequestBody TickRequest request) {
        if (request.price() == null) {
            return ResponseEntity.badRequest().body(Map.of("status", "error: price is required"));
        }
        Tick tick;
        try {
            tick = new Tick(request.price(),
                    request.timestamp() == null ? clock.millis() : request.timestamp(),
                    request.volume() == null ? 0.0 : request.volume());
        } catch (IllegalArgumentException e) {
            log.warn("Malformed tick rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("status", "error: " + e.getMessage()));
        }

        if (!engine.ingest(tick)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "rejected: out of order"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @PostMapping("/news")
    public ResponseEntity<Map<String, String>> news(@RequestBody NewsRequest request) {
        NewsEvent event;
        try {
            event = new NewsEvent(request.headline(), request.sentiment(), request.impact(),
                    clock.millis(), request.source() == null ? "api" : request.source());
        } catch (IllegalArgumentException e) {
            log.warn("Malformed news rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("status", "error: " + e.getMessage()));
        }
        engine.onNews(event);
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }
}
