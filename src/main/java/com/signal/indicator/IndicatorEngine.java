package com.signal.indicator;

import com.signal.model.AnnotatedBar;
import com.signal.model.Bar;
import com.signal.model.IndicatorValues;
import com.signal.model.IndicatorValues.Bollinger;
import com.signal.model.IndicatorValues.Macd;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes trend, momentum and volatility indicators over a bar sequence.
 *
 * <p>Every value attached to bar {@code i} is derived from bars {@code 0..i} only. Each call
 * to {@link #annotate} is a fresh pass: recursive state (EMA/RMA chains) starts over from the
 * first bar of the given sequence, so the same input always yields the same output.
 *
 * <p>Stateless between calls and safe to share.
 */
@Component
public class IndicatorEngine {

    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int EMA_TREND = 200;
    public static final int BB_PERIOD = 20;
    public static final double BB_MULT = 2.0;
    public static final int ADX_PERIOD = 14;
    public static final int RSI_PERIOD = 14;

    /** Substituted for zero denominators. */
    static final double EPSILON = 1e-7;

    public List<AnnotatedBar> annotate(List<Bar> bars) {
        Pass pass = new Pass(bars);
        List<AnnotatedBar> annotated = new ArrayList<>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            annotated.add(new AnnotatedBar(bars.get(i), pass.next(i)));
        }
        return annotated;
    }

    /**
     * Recursive state for one pass over a sequence.
     */
    private static final class Pass {

        private final List<Bar> bars;

        private Double ema12;
        private Double ema26;
        private Double macdSignal;
        private Double ema200;
        private Double smoothTr;
        private Double smoothPlusDm;
        private Double smoothMinusDm;
        private Double adx;
        private Double avgGain;
        private Double avgLoss;

        Pass(List<Bar> bars) {
            this.bars = bars;
        }

        IndicatorValues next(int index) {
            Bar bar = bars.get(index);
            Bar prev = index > 0 ? bars.get(index - 1) : null;

            Macd macd = macd(bar, index);
            ema200 = MovingAverages.ema(bar.close(), ema200, EMA_TREND);
            Bollinger bollinger = bollinger(index);

            Double atr = null;
            Double adxValue = null;
            Double rsi = null;
            if (prev != null) {
                atr = directionalMovement(bar, prev, index);
                if (index > ADX_PERIOD * 2) {
                    adxValue = adx;
                }
                rsi = rsi(bar, prev, index);
            }

            return new IndicatorValues(ema200, macd, bollinger, atr, adxValue, rsi);
        }

        // MACD

        private Macd macd(Bar bar, int index) {
            ema12 = MovingAverages.ema(bar.close(), ema12, MACD_FAST);
            ema26 = MovingAverages.ema(bar.close(), ema26, MACD_SLOW);
            if (index < MACD_SLOW) return null;
            double line = ema12 - ema26;
            macdSignal = MovingAverages.ema(line, macdSignal, MACD_SIGNAL);
            return new Macd(line, macdSignal, line - macdSignal);
        }

        // Bollinger bands

        private Bollinger bollinger(int index) {
            if (index + 1 < BB_PERIOD) return null;
            double sum = 0;
            for (int i = index - BB_PERIOD + 1; i <= index; i++) {
                sum += bars.get(i).close();
            }
            double mean = sum / BB_PERIOD;
            double variance = 0;
            for (int i = index - BB_PERIOD + 1; i <= index; i++) {
                double diff = bars.get(i).close() - mean;
                variance += diff * diff;
            }
            double stdDev = Math.sqrt(variance / BB_PERIOD);
            return new Bollinger(mean + stdDev * BB_MULT, mean, mean - stdDev * BB_MULT);
        }

        // ATR / ADX

        /**
         * Advances the true-range and directional-movement chains and returns the ATR.
         */
        private double directionalMovement(Bar bar, Bar prev, int index) {
            double tr = Math.max(bar.high() - bar.low(),
                    Math.max(Math.abs(bar.high() - prev.close()), Math.abs(bar.low() - prev.close())));

            double upMove = bar.high() - prev.high();
            double downMove = prev.low() - bar.low();
            double plusDm = upMove > downMove && upMove > 0 ? upMove : 0;
            double minusDm = downMove > upMove && downMove > 0 ? downMove : 0;

            smoothTr = MovingAverages.rma(tr, smoothTr, ADX_PERIOD);
            smoothPlusDm = MovingAverages.rma(plusDm, smoothPlusDm, ADX_PERIOD);
            smoothMinusDm = MovingAverages.rma(minusDm, smoothMinusDm, ADX_PERIOD);

            if (index > ADX_PERIOD * 2) {
                double trDenominator = smoothTr == 0 ? EPSILON : smoothTr;
                double plusDi = 100 * smoothPlusDm / trDenominator;
                double minusDi = 100 * smoothMinusDm / trDenominator;
                double diSum = plusDi + minusDi;
                double dx = 100 * Math.abs(plusDi - minusDi) / (diSum == 0 ? EPSILON : diSum);
                adx = MovingAverages.rma(dx, adx, ADX_PERIOD);
            }
            return smoothTr;
        }

        // RSI

        private Double rsi(Bar bar, Bar prev, int index) {
            if (avgGain == null) {
                if (index != RSI_PERIOD) return null;
                double gains = 0;
                double losses = 0;
                for (int i = 1; i <= RSI_PERIOD; i++) {
                    double change = bars.get(i).close() - bars.get(i - 1).close();
                    if (change > 0) gains += change;
                    else losses -= change;
                }
                avgGain = gains / RSI_PERIOD;
                avgLoss = losses / RSI_PERIOD;
            } else {
                double change = bar.close() - prev.close();
                avgGain = MovingAverages.rma(Math.max(change, 0), avgGain, RSI_PERIOD);
                avgLoss = MovingAverages.rma(Math.max(-change, 0), avgLoss, RSI_PERIOD);
            }
            double rs = avgGain / (avgLoss == 0 ? EPSILON : avgLoss);
            return 100 - 100 / (1 + rs);
        }
    }
}
