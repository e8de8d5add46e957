package com.aec.AdminDrive.service;

import com.aec.AdminDrive.config.RetryProperties;
import com.aec.AdminDrive.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

@Slf4j
@Component
public class RetryExecutor {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final RetryProperties props;
    private final ProviderCallStats stats;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public RetryExecutor(RetryProperties props, ProviderCallStats stats, Clock clock) {
        this(props, stats, clock, d -> Thread.sleep(d.toMillis()));
    }

    RetryExecutor(RetryProperties props, ProviderCallStats stats, Clock clock, Sleeper sleeper) {
        this.props = props;
        this.stats = stats;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int maxAttempts = Math.max(1, props.getMaxAttempts());
        ProviderException last = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Instant started = clock.instant();
            try {
                T result = call.get();
                stats.recordSuccess(operation, Duration.between(started, clock.instant()));
                return result;
            } catch (ProviderException e) {
                stats.recordFailure(operation, Duration.between(started, clock.instant()));
                last = e;
                if (!e.isRetryable()) {
                    log.warn("{}: non-retryable provider error {}", operation, e.kind());
                    throw e;
                }
                if (e.kind() == ProviderException.Kind.RATE_LIMITED) {
                    stats.recordRateLimitHit(clock.instant());
                }
                if (attempt + 1 >= maxAttempts) {
                    break;
                }
                Duration delay = delayFor(attempt);
                log.warn("{}: attempt {}/{} failed ({}), retrying in {} ms",
                        operation, attempt + 1, maxAttempts, e.kind(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("{}: interrupted during backoff", operation);
                    throw e;
                }
            }
        }
        log.error("{}: giving up after {} attempts ({})", operation, maxAttempts, last.kind());
        throw last;
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    Duration delayFor(int attempt) {
        Duration delay = props.getBaseDelay().multipliedBy(1L << Math.min(attempt, 30));
        return delay.compareTo(props.getMaxDelay()) > 0 ? props.getMaxDelay() : delay;
    }
}
