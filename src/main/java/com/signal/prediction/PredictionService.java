package com.signal.prediction;

import com.signal.model.AnnotatedBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort access to a {@link PredictionOracle}.
 *
 * <p>The oracle runs on its own executor and is given at most {@code timeoutMillis}. A timeout,
 * an exception, too little history or a non-finite answer all degrade to "no prediction".
 */
public class PredictionService {

    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    private final PredictionOracle oracle;
    private final Executor executor;
    private final long timeoutMillis;

    public PredictionService(PredictionOracle oracle, Executor executor, long timeoutMillis) {
        this.oracle = oracle;
        this.executor = executor;
        this.timeoutMillis = timeoutMillis;
    }

    public Optional<Double> predict(List<AnnotatedBar> bars) {
        int window = oracle.windowSize();
        if (bars.size() < window) return Optional.empty();

        List<Double> closes = bars.subList(bars.size() - window, bars.size()).stream()
                .map(AnnotatedBar::close)
                .toList();

        CompletableFuture<Optional<Double>> call;
        try {
            call = CompletableFuture.supplyAsync(() -> oracle.predictNext(closes), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Prediction executor rejected the call, scoring without it");
            return Optional.empty();
        }
        try {
            Optional<Double> predicted = call.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (predicted == null) return Optional.empty();
            return predicted.filter(Double::isFinite);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Prediction timed out after {}ms, scoring without it", timeoutMillis);
        } catch (ExecutionException e) {
            log.warn("Prediction failed, scoring without it: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for prediction");
        }
        return Optional.empty();
    }
}
