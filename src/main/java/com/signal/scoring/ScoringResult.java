package com.signal.scoring;

import com.signal.model.MarketRegime;
import com.signal.model.Signal;

import java.util.Optional;

/**
 * Outcome of scoring one timeframe.
 *
 * @param regime    regime label, or a not-ready label when history is insufficient
 * @param callScore accumulated CALL points
 * @param putScore  accumulated PUT points
 * @param summary   one-line score breakdown for logs
 * @param emitted   the created signal, or null when no side cleared the threshold
 */
public record ScoringResult(MarketRegime regime, double callScore, double putScore, String summary, Signal emitted) {

    static ScoringResult notReady(MarketRegime regime) {
        return new ScoringResult(regime, 0, 0, regime.getLabel(), null);
    }

    public Optional<Signal> signal() {
        return Optional.ofNullable(emitted);
    }
}
