package com.kotsin.advisor.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
@RequiredArgsConstructor
public class ErrorMonitoringService {

    private final MeterRegistry meterRegistry;
    private final Map<String, AtomicLong> errorsByArea = new ConcurrentHashMap<>();

    public void recordError(String area, String message, Throwable t) {
        log.error("Error area={} msg={}", area, message, t);
        errorsByArea.computeIfAbsent(area, a -> new AtomicLong()).incrementAndGet();
        meterRegistry.counter("signals.errors", "area", area).increment();
    }

    public void recordWarn(String area, String message) {
        log.warn("Warn area={} msg={}", area, message);
    }

    public long errorCount(String area) {
        AtomicLong count = errorsByArea.get(area);
        return count == null ? 0 : count.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> out = new ConcurrentHashMap<>();
        errorsByArea.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }
}
