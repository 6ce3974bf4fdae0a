package com.signal.model;

/**
 * Indicator readings attached to one bar. A {@code null} component means the indicator
 * is not yet computable for that bar (insufficient history), never zero.
 *
 * @param ema200    200-period exponential moving average of close
 * @param macd      MACD 12/26/9
 * @param bollinger Bollinger bands 20 x 2
 * @param atr       Average true range (Wilder, 14)
 * @param adx       Average directional index (Wilder, 14)
 * @param rsi       Relative strength index (Wilder, 14)
 */
public record IndicatorValues(Double ema200, Macd macd, Bollinger bollinger, Double atr, Double adx, Double rsi) {

    public static final IndicatorValues NONE = new IndicatorValues(null, null, null, null, null, null);

    public record Macd(double line, double signal, double hist) {
    }

    public record Bollinger(double upper, double middle, double lower) {
    }

    /**
     * True when every indicator the signal scorer relies on is present.
     */
    public boolean isScorable() {
        return macd != null && bollinger != null && adx != null && rsi != null;
    }
}
