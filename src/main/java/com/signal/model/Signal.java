package com.signal.model;

/**
 * One scoring decision and, once expired, its outcome.
 *
 * <p>Everything except {@code status}, {@code exitPrice} and {@code pnl} is fixed at creation.
 * Those three change exactly once, through {@link #resolve}, which returns a new record.
 *
 * @param id               Unique identifier
 * @param createdAt        Creation time in Unix milliseconds
 * @param direction        CALL or PUT
 * @param entryPrice       Close of the bar the signal was scored on
 * @param timeframe        Timeframe label, e.g. "5m"
 * @param regime           Market regime at creation
 * @param strategy         Label of the strategies that contributed
 * @param prediction       Price predicted by the external model, or null
 * @param predictionScore  Points the prediction contributed (0..100)
 * @param confidence       min(score / 150, 0.99)
 * @param strength         Strength tier of the winning score
 * @param sentimentContext Description of the sentiment contribution, or null
 * @param status           PENDING, WIN or LOSS
 * @param exitPrice        Price at resolution, null while pending
 * @param pnl              Payout at resolution, null while pending
 */
public record Signal(
        String id,
        long createdAt,
        SignalDirection direction,
        double entryPrice,
        String timeframe,
        MarketRegime regime,
        String strategy,
        Double prediction,
        double predictionScore,
        double confidence,
        SignalStrength strength,
        String sentimentContext,
        SignalStatus status,
        Double exitPrice,
        Double pnl
) {

    public Signal {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Id must not be blank");
        if (direction == null) throw new IllegalArgumentException("Direction is required");
        if (timeframe == null || timeframe.isBlank()) throw new IllegalArgumentException("Timeframe must not be blank");
        if (status == null) throw new IllegalArgumentException("Status is required");
        if (status == SignalStatus.PENDING && (exitPrice != null || pnl != null)) {
            throw new IllegalArgumentException("Pending signal cannot carry an exit price or pnl");
        }
    }

    public boolean isPending() {
        return status == SignalStatus.PENDING;
    }

    /**
     * Returns the resolved copy of this pending signal.
     *
     * @throws IllegalStateException if this signal is already resolved
     */
    public Signal resolve(SignalStatus outcome, double exit, double payout) {
        if (!isPending()) throw new IllegalStateException("Signal " + id + " is already " + status);
        if (outcome == SignalStatus.PENDING) throw new IllegalArgumentException("Outcome must be WIN or LOSS");
        return new Signal(id, createdAt, direction, entryPrice, timeframe, regime, strategy, prediction,
                predictionScore, confidence, strength, sentimentContext, outcome, exit, payout);
    }
}
