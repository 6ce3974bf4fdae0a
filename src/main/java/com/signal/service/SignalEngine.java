package com.signal.service;

import com.signal.aggregator.BarAggregator;
import com.signal.aggregator.Resampler;
import com.signal.event.NewsEvent;
import com.signal.event.Tick;
import com.signal.indicator.IndicatorEngine;
import com.signal.lifecycle.SignalLifecycleManager;
import com.signal.model.AnnotatedBar;
import com.signal.model.Bar;
import com.signal.model.MarketRegime;
import com.signal.model.Signal;
import com.signal.model.SignalStrength;
import com.signal.model.Timeframe;
import com.signal.prediction.PredictionService;
import com.signal.scoring.ScoringResult;
import com.signal.scoring.SignalScorer;
import com.signal.sentiment.SentimentTracker;
import com.signal.store.BarHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Single-instrument pipeline coordinator.
 *
 * <ul>
 *   <li>Folds ticks into base bars via {@link BarAggregator}</li>
 *   <li>On every bar close: appends to {@link BarHistory}, then for each configured timeframe
 *       (unless it already has a pending signal) resamples, annotates, predicts and scores</li>
 *   <li>On a wall-clock schedule: resolves expired signals at the latest price</li>
 * </ul>
 *
 * <p>Tick ingestion, seeding and resolution share one fair lock, so a bar close and its full
 * analysis fan-out finish before the next tick is applied. Callers that arrive meanwhile
 * block rather than drop data.
 */
@Service
public class SignalEngine {

    private static final Logger log = LoggerFactory.getLogger(SignalEngine.class);

    private final ReentrantLock lock = new ReentrantLock(true);

    private final BarHistory history;
    private final BarAggregator aggregator;
    private final IndicatorEngine indicators;
    private final SignalScorer scorer;
    private final SignalLifecycleManager lifecycle;
    private final SentimentTracker sentiment;
    private final PredictionService predictions;
    private final List<SignalEventListener> listeners;
    private final Clock clock;
    private final List<Timeframe> timeframes;

    /** Latest regime per timeframe; timeframes gated by a pending signal keep their previous value. */
    private final Map<Timeframe, MarketRegime> regimes = new ConcurrentHashMap<>();

    private volatile List<AnnotatedBar> baseBars = List.of();
    private volatile NewsEvent lastNews;

    @Autowired
    public SignalEngine(BarHistory history,
                        IndicatorEngine indicators,
                        SignalScorer scorer,
                        SignalLifecycleManager lifecycle,
                        SentimentTracker sentiment,
                        PredictionService predictions,
                        List<SignalEventListener> listeners,
                        Clock clock,
                        @Value("${signal.timeframes:5m,15m,30m,45m,1h}") String[] timeframeLabels) {
        this(history, indicators, scorer, lifecycle, sentiment, predictions, listeners, clock,
                Timeframe.parseAll(timeframeLabels));
    }

    public SignalEngine(BarHistory history,
                        IndicatorEngine indicators,
                        SignalScorer scorer,
                        SignalLifecycleManager lifecycle,
                        SentimentTracker sentiment,
                        PredictionService predictions,
                        List<SignalEventListener> listeners,
                        Clock clock,
                        List<Timeframe> timeframes) {
        this.history = history;
        this.indicators = indicators;
        this.scorer = scorer;
        this.lifecycle = lifecycle;
        this.sentiment = sentiment;
        this.predictions = predictions;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
        this.timeframes = List.copyOf(timeframes);
        this.aggregator = new BarAggregator(this::onBarSealed);
        log.info("Signal engine analysing timeframes {}", this.timeframes.stream().map(Timeframe::getLabel).toList());
    }

    /**
     * Apply one tick. Blocks while another tick, seed or resolution pass is in progress.
     *
     * @return false if the tick falls in an already sealed or seeded bar, or is older than the
     *         open bar, and was rejected
     */
    public boolean ingest(Tick tick) {
        lock.lock();
        try {
            Optional<Bar> lastSealed = history.last();
            if (lastSealed.isPresent() && Timeframe.BASE.bucketStart(tick.timestamp()) <= lastSealed.get().timestamp()) {
                log.warn("Tick inside stored history rejected: tickTime={} price={} lastBar={}",
                        tick.timestamp(), tick.price(), lastSealed.get().timestamp());
                return false;
            }
            return aggregator.process(tick);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Load historical bars ahead of live ticks.
     *
     * @return number of bars stored
     */
    public int seed(List<Bar> bars) {
        lock.lock();
        try {
            int stored = history.seed(bars);
            baseBars = indicators.annotate(history.snapshot());
            return stored;
        } finally {
            lock.unlock();
        }
    }

    public void onNews(NewsEvent event) {
        sentiment.ingest(event);
        lastNews = event;
    }

    /**
     * Resolve every pending signal whose timeframe has elapsed, at the latest known price.
     * Driven by wall-clock time, independent of tick flow.
     */
    @Scheduled(fixedRateString = "${signal.resolution.interval-ms:1000}")
    public void resolveExpiredSignals() {
        List<Signal> resolved;
        lock.lock();
        try {
            Optional<Double> price = latestPrice();
            if (price.isEmpty()) return;
            resolved = lifecycle.resolveDue(price.get(), clock.millis());
        } finally {
            lock.unlock();
        }
        resolved.forEach(signal -> publish(listener -> listener.onSignalResolved(signal)));
    }

    /**
     * Annotated bars of a timeframe for display, including the in-progress bar.
     *
     * @param limit maximum number of most recent bars returned
     */
    public List<AnnotatedBar> chart(Timeframe timeframe, int limit) {
        List<Bar> bars;
        lock.lock();
        try {
            bars = new ArrayList<>(history.snapshot());
            aggregator.current().ifPresent(open -> {
                if (bars.isEmpty() || open.timestamp() > bars.get(bars.size() - 1).timestamp()) {
                    bars.add(open);
                }
            });
        } finally {
            lock.unlock();
        }
        List<AnnotatedBar> annotated = indicators.annotate(Resampler.resample(bars, timeframe));
        return annotated.subList(Math.max(0, annotated.size() - limit), annotated.size());
    }

    /**
     * Last price seen: the in-progress bar's close, else the last sealed close.
     */
    public Optional<Double> latestPrice() {
        lock.lock();
        try {
            Optional<Double> live = aggregator.lastPrice();
            return live.isPresent() ? live : history.last().map(Bar::close);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Latest regime label per analysed timeframe, in configuration order.
     */
    public Map<String, String> regimes() {
        Map<String, String> labels = new LinkedHashMap<>();
        for (Timeframe timeframe : timeframes) {
            labels.put(timeframe.getLabel(), regimes.getOrDefault(timeframe, MarketRegime.GATHERING_DATA).getLabel());
        }
        return labels;
    }

    /**
     * Base-interval bars annotated at the last bar close or seed.
     */
    public List<AnnotatedBar> baseBars() {
        return baseBars;
    }

    public Optional<NewsEvent> lastNews() {
        return Optional.ofNullable(lastNews);
    }

    public List<Timeframe> getTimeframes() {
        return timeframes;
    }

    /** Called by the aggregator with the lock held. */
    private void onBarSealed(Bar bar) {
        if (!history.append(bar)) return;
        List<Bar> sealed = history.snapshot();
        baseBars = indicators.annotate(sealed);

        int created = 0;
        for (Timeframe timeframe : timeframes) {
            if (analyse(timeframe, sealed)) created++;
        }
        if (created > 0) {
            log.info("Generated {} signal(s) on bar close time={}", created, bar.timestamp());
        }
    }

    private boolean analyse(Timeframe timeframe, List<Bar> sealed) {
        String label = timeframe.getLabel();
        if (lifecycle.hasPending(label)) {
            log.debug("[{}] Skipped, signal still pending", label);
            return false;
        }

        List<AnnotatedBar> series = indicators.annotate(Resampler.resample(sealed, timeframe));
        Optional<Double> prediction = SignalScorer.isReady(series) ? predictions.predict(series) : Optional.empty();
        ScoringResult result = scorer.score(series, label, prediction);
        regimes.put(timeframe, result.regime());
        log.debug("[{}] regime={} {}", label, result.regime().getLabel(), result.summary());

        Optional<Signal> emitted = result.signal();
        if (emitted.isEmpty()) return false;
        Signal signal = emitted.get();
        if (signal.strength() == SignalStrength.WEAK) {
            log.debug("[{}] Discarded WEAK {} signal", label, signal.direction());
            return false;
        }
        if (!lifecycle.register(signal)) return false;

        log.info("[{}] SIGNAL {} {} [{}] entry={} strategy={} confidence={}",
                label, signal.id(), signal.direction(), signal.strength(), signal.entryPrice(),
                signal.strategy(), String.format("%.2f", signal.confidence()));
        publish(listener -> listener.onSignalCreated(signal));
        return true;
    }

    private void publish(Consumer<SignalEventListener> event) {
        for (SignalEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Signal listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
