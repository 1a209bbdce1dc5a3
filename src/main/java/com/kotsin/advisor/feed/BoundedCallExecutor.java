package com.kotsin.advisor.feed;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs an external call with a hard deadline. A timeout or failure yields the caller's fallback.
 */
@Component
@Slf4j
public class BoundedCallExecutor {

    private final ExecutorService executor;

    public BoundedCallExecutor(@Qualifier("externalCallExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    public <T> T call(String what, Supplier<T> supplier, Duration timeout, T fallback) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(supplier, executor)
                .completeOnTimeout(fallback, timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            T value = future.get();
            return value == null ? fallback : value;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("bounded_call_interrupted what={}", what);
            return fallback;
        } catch (ExecutionException e) {
            log.debug("bounded_call_failed what={} err={}", what, e.getCause() == null ? e.toString() : e.getCause().toString());
            return fallback;
        }
    }
}
