package com.stakeduel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.random.RandomGenerator;

@Configuration
public class StakeduelRuntimeConfig {

    private static final Logger log = LoggerFactory.getLogger(StakeduelRuntimeConfig.class);

    @Bean
    public Clock stakeduelClock() {
        return Clock.systemUTC();
    }

    /**
     * Opponent randomness. Never seeded from round data visible to the player.
     */
    @Bean
    public RandomGenerator opponentRandom() {
        SecureRandom random = new SecureRandom();
        log.info("Initialized opponent random source using {}", random.getAlgorithm());
        return random;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService priceFeedExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "price-feed-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }
}
