package com.signal.loader;

import com.signal.service.SignalEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Seeds the engine's history from every {@link HistoricalBarLoader} on startup.
 * A failing loader only delays analysis until enough live bars have closed.
 */
@Component
public class HistorySeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(HistorySeeder.class);

    private final SignalEngine engine;
    private final ObjectProvider<HistoricalBarLoader> loaders;

    public HistorySeeder(SignalEngine engine, ObjectProvider<HistoricalBarLoader> loaders) {
        this.engine = engine;
        this.loaders = loaders;
    }

    @Override
    public void run(ApplicationArguments args) {
        loaders.orderedStream().forEach(this::seedFrom);
    }

    void seedFrom(HistoricalBarLoader loader) {
        try {
            int stored = engine.seed(loader.load());
            log.info("Loaded {} historical bars from {}", stored, loader.describe());
        } catch (IOException | RuntimeException e) {
            log.error("Could not load history from {}; analysis will be delayed", loader.describe(), e);
        }
    }
}
