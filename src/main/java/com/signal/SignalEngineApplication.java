package com.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SignalEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(SignalEngineApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SignalEngineApplication.class, args);
        log.info("Tick Signal Engine started.");
        log.info("Chart:   GET http://localhost:8080/history?timeframe=5m&limit=50");
        log.info("Signals: GET http://localhost:8080/signals");
        log.info("Stats:   GET http://localhost:8080/stats");
        log.info("Health:  GET http://localhost:8080/actuator/health");
    }
}
