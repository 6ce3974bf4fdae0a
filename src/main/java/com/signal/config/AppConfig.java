package com.signal.config;

import com.signal.lifecycle.ResolutionPolicy;
import com.signal.prediction.PredictionOracle;
import com.signal.prediction.PredictionService;
import com.signal.prediction.UnavailablePredictionOracle;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Application-wide Spring configuration.
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /**
     * Task scheduler for {@code @Scheduled} methods: tick and news generators plus signal resolution.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("signal-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        return scheduler;
    }

    /**
     * Runs prediction oracle calls off the tick-processing thread.
     */
    @Bean
    public ThreadPoolTaskExecutor predictionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("prediction-");
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResolutionPolicy resolutionPolicy(@Value("${signal.payout.win:0.85}") double winPayout,
                                             @Value("${signal.payout.loss:-1.0}") double lossPayout) {
        return new ResolutionPolicy(winPayout, lossPayout);
    }

    @Bean
    @ConditionalOnMissingBean(PredictionOracle.class)
    public PredictionOracle predictionOracle() {
        return new UnavailablePredictionOracle();
    }

    @Bean
    public PredictionService predictionService(PredictionOracle oracle,
                                               @Value("${signal.prediction.timeout-ms:250}") long timeoutMillis) {
        return new PredictionService(oracle, predictionExecutor(), timeoutMillis);
    }
}
