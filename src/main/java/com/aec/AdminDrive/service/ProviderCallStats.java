package com.aec.AdminDrive.service;

import com.aec.AdminDrive.dto.ProviderPerformanceSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class ProviderCallStats {

    static final long FREQUENT_RATE_LIMIT_HITS = 10;
    static final double SLOW_AVERAGE_MS = 5000;
    static final double HIGH_FAILURE_RATE = 0.10;

    private final MeterRegistry registry;
    private final Map<String, OperationCounters> operations = new ConcurrentHashMap<>();
    private final AtomicLong rateLimitHits = new AtomicLong();
    private final Counter rateLimitCounter;
    private volatile Instant lastRateLimitHit;

    public ProviderCallStats(MeterRegistry registry) {
        this.registry = registry;
        this.rateLimitCounter = Counter.builder("admin_drive.provider.rate_limit_hits")
                .description("Rate-limit responses from the storage provider")
                .register(registry);
    }

    public void recordSuccess(String operation, Duration elapsed) {
        counters(operation).record(true, elapsed);
        timer(operation, "success").record(elapsed);
    }

    public void recordFailure(String operation, Duration elapsed) {
        counters(operation).record(false, elapsed);
        timer(operation, "failure").record(elapsed);
    }

    public void recordRateLimitHit(Instant at) {
        rateLimitHits.incrementAndGet();
        rateLimitCounter.increment();
        lastRateLimitHit = at;
    }

    public long rateLimitHits() {
        return rateLimitHits.get();
    }

    public ProviderPerformanceSummary summary() {
        Map<String, ProviderPerformanceSummary.OperationStats> ops = new LinkedHashMap<>();
        new TreeMap<>(operations).forEach((name, c) -> ops.put(name, c.snapshot()));

        List<String> recommendations = new ArrayList<>();
        long hits = rateLimitHits.get();
        if (hits > FREQUENT_RATE_LIMIT_HITS) {
            recommendations.add("Frequent rate limiting (" + hits + " hits): reduce request frequency or batch provider calls");
        }
        ops.forEach((name, s) -> {
            if (s.getAverageDurationMs() > SLOW_AVERAGE_MS) {
                recommendations.add("Slow " + name + " operations: average "
                        + Math.round(s.getAverageDurationMs()) + " ms");
            }
            if (s.getFailureRate() > HIGH_FAILURE_RATE) {
                recommendations.add("High failure rate for " + name + ": "
                        + Math.round(s.getFailureRate() * 100) + "%");
            }
        });

        return ProviderPerformanceSummary.builder()
                .operations(ops)
                .rateLimitHits(hits)
                .lastRateLimitHit(lastRateLimitHit)
                .recommendations(recommendations)
                .build();
    }

    private OperationCounters counters(String operation) {
        return operations.computeIfAbsent(operation, k -> new OperationCounters());
    }

    private Timer timer(String operation, String outcome) {
        return Timer.builder("admin_drive.provider.calls")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry);
    }

    private static final class OperationCounters {
        private long total;
        private long successful;
        private long failed;
        private long totalMillis;

        synchronized void record(boolean success, Duration elapsed) {
            total++;
            if (success) successful++; else failed++;
            totalMillis += elapsed.toMillis();
        }

        synchronized ProviderPerformanceSummary.OperationStats snapshot() {
            return ProviderPerformanceSummary.OperationStats.builder()
                    .total(total)
                    .successful(successful)
                    .failed(failed)
                    .averageDurationMs(total == 0 ? 0.0 : (double) totalMillis / total)
                    .failureRate(total == 0 ? 0.0 : (double) failed / total)
                    .build();
        }
    }
}
