package com.kotsin.advisor.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(SignalProps.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Cache<String, Double> sentimentCache(
            @Value("${signals.sentiment.cache-ttl-seconds:300}") long ttlSeconds) {
        return Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(Duration.ofSeconds(ttlSeconds))
                .build();
    }

    @Bean
    public OkHttpClient advisorHttpClient(SignalProps props) {
        Duration timeout = props.feed().timeout();
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    /**
     * Workers for per-signal evaluation in the monitor and catch-up.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService signalEvaluationExecutor(SignalProps props) {
        AtomicInteger n = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, props.monitor().parallelism()), r -> {
            Thread t = new Thread(r, "signal-eval-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs feed, sentiment and prediction calls so callers can abandon them at the deadline.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService externalCallExecutor() {
        AtomicInteger n = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "signal-io-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "signal-notify");
            t.setDaemon(true);
            return t;
        });
    }
}
