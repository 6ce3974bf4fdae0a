package com.signal.service;

import com.signal.model.Signal;
import com.signal.model.SignalDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes a human-readable alert for every created and resolved signal.
 * Outbound alert channels are not part of this service; this is where they would plug in.
 */
@Component
public class SignalAlertLogger implements SignalEventListener {

    private static final Logger log = LoggerFactory.getLogger(SignalAlertLogger.class);

    private final String symbol;

    public SignalAlertLogger(@Value("${signal.symbol:EUR/USD}") String symbol) {
        this.symbol = symbol;
    }

    @Override
    public void onSignalCreated(Signal signal) {
        log.info(formatAlert(signal));
    }

    @Override
    public void onSignalResolved(Signal signal) {
        log.info("RESULT {} {} {} ({}): {} entry={} exit={} pnl={}",
                symbol, signal.timeframe(), signal.direction(), signal.id(), signal.status(),
                String.format("%.5f", signal.entryPrice()), String.format("%.5f", signal.exitPrice()), signal.pnl());
    }

    String formatAlert(Signal signal) {
        String arrow = signal.direction() == SignalDirection.CALL ? "UP" : "DOWN";
        return String.join(System.lineSeparator(),
                "SIGNAL ALERT",
                "Asset: " + symbol,
                "Type: " + signal.direction() + " " + arrow,
                "Entry: " + String.format("%.5f", signal.entryPrice()),
                "Timeframe: " + signal.timeframe(),
                "Strength: " + signal.strength(),
                "Model Target: " + (signal.prediction() == null ? "N/A" : String.format("%.5f", signal.prediction())),
                "Strategy: " + signal.strategy(),
                "Conf: " + String.format("%.0f%%", signal.confidence() * 100),
                "News Ctx: " + (signal.sentimentContext() == null ? "N/A" : signal.sentimentContext()));
    }
}
