package com.signal.scoring;

import com.signal.lifecycle.SignalIdGenerator;
import com.signal.model.AnnotatedBar;
import com.signal.model.IndicatorValues;
import com.signal.model.IndicatorValues.Bollinger;
import com.signal.model.IndicatorValues.Macd;
import com.signal.model.MarketRegime;
import com.signal.model.Signal;
import com.signal.model.SignalDirection;
import com.signal.model.SignalStatus;
import com.signal.model.SignalStrength;
import com.signal.sentiment.SentimentTracker;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Classifies the market regime of one timeframe and scores a CALL and a PUT side from
 * two overlapping strategies, rolling sentiment and an optional price prediction.
 *
 * <p>Scores are additive and unbounded. A signal is created only when one side reaches
 * {@value #THRESHOLD} points and strictly beats the other side.
 *
 * <ul>
 *   <li>Trend (ADX &gt; 25): MACD cross 25, mid-band cross 20, RSI in the trend band 10,
 *       histogram momentum 5.</li>
 *   <li>Mean reversion (ADX &le; 30): band breach 30, RSI extreme 20, MACD cross 10.</li>
 *   <li>Sentiment: up to 30 for the side matching its sign, once |sentiment| &gt; 5.</li>
 *   <li>Prediction: up to 100 for the side it points to, scaled by its distance from the
 *       close in units of 0.05% of the close, capped at 2 units.</li>
 * </ul>
 */
@Component
public class SignalScorer {

    public static final int MIN_BARS = 30;
    public static final double THRESHOLD = 70;

    static final double STRONG_TREND_ADX = 25;
    static final double WEAK_TREND_ADX = 20;
    static final double REVERSION_MAX_ADX = 30;
    static final double SENTIMENT_TRIGGER = 5;
    static final double SENTIMENT_CAP = 30;
    static final double PREDICTION_UNIT = 0.0005;
    static final double PREDICTION_MAX_UNITS = 2.0;
    static final double PREDICTION_POINTS_PER_UNIT = 50;
    static final double MAX_CONFIDENCE = 0.99;

    private final SentimentTracker sentiment;
    private final SignalIdGenerator ids;
    private final Clock clock;

    public SignalScorer(SentimentTracker sentiment, SignalIdGenerator ids, Clock clock) {
        this.sentiment = sentiment;
        this.ids = ids;
        this.clock = clock;
    }

    /**
     * Score the latest bar of an indicator-annotated timeframe series.
     *
     * @param bars       annotated bars of one timeframe, ascending
     * @param timeframe  timeframe label stamped on the signal
     * @param prediction predicted next close, empty when unavailable
     */
    public ScoringResult score(List<AnnotatedBar> bars, String timeframe, Optional<Double> prediction) {
        if (bars.size() < MIN_BARS) return ScoringResult.notReady(MarketRegime.GATHERING_DATA);

        AnnotatedBar last = bars.get(bars.size() - 1);
        AnnotatedBar prev = bars.get(bars.size() - 2);
        if (!last.indicators().isScorable() || !prev.indicators().isScorable()) {
            return ScoringResult.notReady(MarketRegime.CALCULATING);
        }

        IndicatorValues now = last.indicators();
        IndicatorValues before = prev.indicators();
        double close = last.close();
        double adx = now.adx();
        double ema200 = now.ema200() == null ? 0 : now.ema200();

        MarketRegime regime = classify(adx, close, ema200);
        double callScore = 0;
        double putScore = 0;
        String strategy = "";

        // Sentiment
        double mood = sentiment.read();
        String sentimentContext = null;
        if (mood > SENTIMENT_TRIGGER) {
            double points = Math.min(mood, SENTIMENT_CAP);
            callScore += points;
            sentimentContext = "Bullish Sentiment (+" + (int) Math.floor(points) + ")";
            regime = MarketRegime.NEWS_BULLISH;
        } else if (mood < -SENTIMENT_TRIGGER) {
            double points = Math.min(-mood, SENTIMENT_CAP);
            putScore += points;
            sentimentContext = "Bearish Sentiment (+" + (int) Math.floor(points) + ")";
            regime = MarketRegime.NEWS_BEARISH;
        }

        double rsi = now.rsi();
        Macd macd = now.macd();
        Macd prevMacd = before.macd();
        Bollinger bands = now.bollinger();

        boolean aboveEma = close > ema200;
        boolean bullCross = prevMacd.line() < prevMacd.signal() && macd.line() > macd.signal();
        boolean bearCross = prevMacd.line() > prevMacd.signal() && macd.line() < macd.signal();
        boolean histImproving = macd.hist() > prevMacd.hist();
        boolean histDeclining = macd.hist() < prevMacd.hist();
        boolean midCrossUp = prev.close() < bands.middle() && close > bands.middle();
        boolean midCrossDown = prev.close() > bands.middle() && close < bands.middle();

        // Trend following
        if (adx > STRONG_TREND_ADX) {
            if (aboveEma) {
                if (bullCross) callScore += 25;
                if (midCrossUp) callScore += 20;
                if (rsi > 50 && rsi < 70) callScore += 10;
                if (histImproving && macd.hist() > 0) callScore += 5;
                if (callScore > 20) strategy = "Trend Alpha";
            } else {
                if (bearCross) putScore += 25;
                if (midCrossDown) putScore += 20;
                if (rsi < 50 && rsi > 30) putScore += 10;
                if (histDeclining && macd.hist() < 0) putScore += 5;
                if (putScore > 20) strategy = "Trend Alpha";
            }
        }

        // Mean reversion; overlaps the trend branch for 25 < ADX <= 30
        if (adx <= REVERSION_MAX_ADX) {
            if (close < bands.lower()) callScore += 30;
            if (rsi < 30) callScore += 20;
            if (bullCross) callScore += 10;
            if (callScore > 20 && strategy.isEmpty()) strategy = "BB Reversion";

            if (close > bands.upper()) putScore += 30;
            if (rsi > 70) putScore += 20;
            if (bearCross) putScore += 10;
            if (putScore > 20 && strategy.isEmpty()) strategy = "BB Reversion";
        }

        // Prediction
        Double predicted = prediction.filter(Double::isFinite).orElse(null);
        double predictionScore = 0;
        if (predicted != null) {
            double units = Math.min(Math.abs(predicted - close) / (close * PREDICTION_UNIT), PREDICTION_MAX_UNITS);
            predictionScore = units * PREDICTION_POINTS_PER_UNIT;
            if (predicted > close) {
                callScore += predictionScore;
                strategy = strategy.isEmpty() ? "Model Pure" : strategy + " + Model";
            } else if (predicted < close) {
                putScore += predictionScore;
                strategy = strategy.isEmpty() ? "Model Pure" : strategy + " + Model";
            }
        }

        if (sentimentContext != null) {
            strategy = strategy.isEmpty() ? "News Event" : strategy + " & News";
        }

        String summary = String.format("Call: %.0f, Put: %.0f (Req: %.0f)", callScore, putScore, THRESHOLD)
                + (sentimentContext != null ? " [" + sentimentContext + "]" : "");

        Signal signal = null;
        if (callScore >= THRESHOLD && callScore > putScore) {
            signal = create(SignalDirection.CALL, callScore, close, timeframe, regime, strategy,
                    predicted, predictionScore, sentimentContext);
        } else if (putScore >= THRESHOLD && putScore > callScore) {
            signal = create(SignalDirection.PUT, putScore, close, timeframe, regime, strategy,
                    predicted, predictionScore, sentimentContext);
        }
        return new ScoringResult(regime, callScore, putScore, summary, signal);
    }

    /**
     * True when the series has enough history and indicators on its last two bars to be scored.
     */
    public static boolean isReady(List<AnnotatedBar> bars) {
        return bars.size() >= MIN_BARS
                && bars.get(bars.size() - 1).indicators().isScorable()
                && bars.get(bars.size() - 2).indicators().isScorable();
    }

    /**
     * Regime from trend strength alone, before any sentiment override.
     */
    public static MarketRegime classify(double adx, double close, double ema200) {
        if (adx > STRONG_TREND_ADX) {
            return close > ema200 ? MarketRegime.STRONG_BULL_TREND : MarketRegime.STRONG_BEAR_TREND;
        }
        if (adx < WEAK_TREND_ADX) return MarketRegime.CHOPPY;
        return MarketRegime.RANGING;
    }

    private Signal create(SignalDirection direction, double score, double entry, String timeframe,
                          MarketRegime regime, String strategy, Double predicted, double predictionScore,
                          String sentimentContext) {
        return new Signal(
                ids.nextId(),
                clock.millis(),
                direction,
                entry,
                timeframe,
                regime,
                strategy.isEmpty() ? "Hybrid" : strategy,
                predicted,
                predictionScore,
                Math.min(score / 150, MAX_CONFIDENCE),
                SignalStrength.forScore(score),
                sentimentContext,
                SignalStatus.PENDING,
                null,
                null);
    }
}
