package com.signal.lifecycle;

/**
 * Payouts booked when a signal expires.
 *
 * @param winPayout  pnl of a winning signal
 * @param lossPayout pnl of a losing signal
 */
public record ResolutionPolicy(double winPayout, double lossPayout) {

    public static final ResolutionPolicy DEFAULT = new ResolutionPolicy(0.85, -1.0);

    public ResolutionPolicy {
        if (winPayout < 0) throw new IllegalArgumentException("Win payout must not be negative");
        if (lossPayout > 0) throw new IllegalArgumentException("Loss payout must not be positive");
    }
}
