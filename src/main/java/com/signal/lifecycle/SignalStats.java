package com.signal.lifecycle;

/**
 * Aggregate outcome counters over every signal emitted since startup.
 *
 * @param totalSignals  all signals, pending or resolved
 * @param wins          resolved as WIN
 * @param losses        resolved as LOSS
 * @param winRate       wins / resolved in percent, 0 when nothing is resolved
 * @param activeSignals still pending
 */
public record SignalStats(int totalSignals, int wins, int losses, double winRate, int activeSignals) {
}
