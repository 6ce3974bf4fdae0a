package com.signal.controller;

import com.signal.lifecycle.SignalLifecycleManager;
import com.signal.lifecycle.SignalStats;
import com.signal.model.Signal;
import com.signal.model.Timeframe;
import com.signal.service.SignalEngine;
import com.signal.store.BarHistory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints: liveness, engine status, signals and outcome statistics.
 */
@RestController
public class StatusController {

    private final SignalEngine engine;
    private final SignalLifecycleManager lifecycle;
    private final BarHistory history;

    public StatusController(SignalEngine engine, SignalLifecycleManager lifecycle, BarHistory history) {
        this.engine = engine;
        this.lifecycle = lifecycle;
        this.history = history;
    }

    /**
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * GET /status → bar counts, latest price, regimes per timeframe, last news.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now().toEpochMilli());
        body.put("barsSealed", history.size());
        body.put("latestPrice", engine.latestPrice().orElse(null));
        body.put("regimes", engine.regimes());
        body.put("activeSignals", lifecycle.stats().activeSignals());
        body.put("lastNews", engine.lastNews().orElse(null));
        return ResponseEntity.ok(body);
    }

    /**
     * GET /signals?limit=50 → most recent signals, newest first.
     */
    @GetMapping("/signals")
    public ResponseEntity<List<Signal>> signals(@RequestParam(defaultValue = "50") int limit) {
        if (limit <= 0) {
            return ResponseEntity.badRequest().build();
        }
        List<Signal> signals = lifecycle.signals();
        return ResponseEntity.ok(signals.subList(0, Math.min(limit, signals.size())));
    }

    /**
     * GET /stats → totals, wins, losses, win rate and pending count.
     */
    @GetMapping("/stats")
    public ResponseEntity<SignalStats> stats() {
        return ResponseEntity.ok(lifecycle.stats());
    }

    /**
     * GET /timeframes → timeframes analysed for signals.
     */
    @GetMapping("/timeframes")
    public ResponseEntity<List<String>> timeframes() {
        return ResponseEntity.ok(engine.getTimeframes().stream().map(Timeframe::getLabel).toList());
    }
}
