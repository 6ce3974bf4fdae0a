package com.signal.support;

import com.signal.indicator.IndicatorEngine;
import com.signal.lifecycle.ResolutionPolicy;
import com.signal.lifecycle.SignalIdGenerator;
import com.signal.lifecycle.SignalLifecycleManager;
import com.signal.model.Timeframe;
import com.signal.prediction.PredictionService;
import com.signal.prediction.UnavailablePredictionOracle;
import com.signal.scoring.SignalScorer;
import com.signal.sentiment.SentimentTracker;
import com.signal.service.SignalEngine;
import com.signal.store.BarHistory;

import java.time.Clock;
import java.util.List;

/**
 * Engine wired without Spring, predictions disabled and no listeners.
 */
public final class Engines {

    private Engines() {}

    public static SignalEngine plain(Clock clock, Timeframe... timeframes) {
        SentimentTracker sentiment = new SentimentTracker();
        return new SignalEngine(new BarHistory(3500), new IndicatorEngine(),
                new SignalScorer(sentiment, new SignalIdGenerator(), clock),
                new SignalLifecycleManager(ResolutionPolicy.DEFAULT), sentiment,
                new PredictionService(new UnavailablePredictionOracle(), Runnable::run, 250),
                List.of(), clock, List.of(timeframes));
    }
}
