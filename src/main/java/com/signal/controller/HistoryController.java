package com.signal.controller;

import com.signal.model.AnnotatedBar;
import com.signal.model.Timeframe;
import com.signal.service.SignalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * REST controller exposing resampled, indicator-annotated bars for chart consumers.
 *
 * <pre>
 * GET /history?timeframe=5m&amp;limit=50
 * </pre>
 */
@RestController
@RequestMapping("/history")
@CrossOrigin(origins = "*")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    static final int MAX_LIMIT = 1000;

    private final SignalEngine engine;

    public HistoryController(SignalEngine engine) {
        this.engine = engine;
    }

    /**
     * @param timeframe Timeframe label (e.g., "1m", "5m", "1h")
     * @param limit     Number of most recent bars (1..1000)
     */
    @GetMapping
    public ResponseEntity<HistoryResponse> getHistory(
            @RequestParam(defaultValue = "5m") String timeframe,
            @RequestParam(defaultValue = "50") int limit
    ) {
        log.debug("History request: timeframe={} limit={}", timeframe, limit);

        Optional<Timeframe> parsed = Timeframe.fromLabel(timeframe);
        if (parsed.isEmpty()) {
            log.warn("Invalid timeframe requested: {}", timeframe);
            return ResponseEntity.badRequest()
                    .body(HistoryResponse.error("Unsupported timeframe: " + timeframe
                            + ". Supported: " + String.join(", ", Timeframe.supportedLabels())));
        }

        if (limit <= 0 || limit > MAX_LIMIT) {
            return ResponseEntity.badRequest()
                    .body(HistoryResponse.error("'limit' must be between 1 and " + MAX_LIMIT));
        }

        List<AnnotatedBar> bars = engine.chart(parsed.get(), limit);
        if (bars.isEmpty()) {
            return ResponseEntity.ok(HistoryResponse.noData(timeframe));
        }
        return ResponseEntity.ok(HistoryResponse.ok(timeframe, bars));
    }
}
