package com.aec.AdminDrive.service;

import com.aec.AdminDrive.config.StorageMonitorProperties;
import com.aec.AdminDrive.dto.MonitorConfigUpdate;
import com.aec.AdminDrive.dto.MonitorLifecycleResult;
import com.aec.AdminDrive.dto.MonitorStatusDto;
import com.aec.AdminDrive.dto.QuotaCheckSummary;
import com.aec.AdminDrive.exception.ConfigException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class StorageMonitorScheduler {

    static final String THREAD_NAME = "admin-drive-storage-monitor";

    private final StorageQuotaService quotaService;
    private final StorageMonitorProperties props;
    private final Clock clock;
    private final MonitorRunStats stats = new MonitorRunStats();

    private final Object lifecycleLock = new Object();
    private Thread worker;
    private CountDownLatch stopSignal;

    private volatile boolean enabled;
    private volatile int intervalMinutes;

    public StorageMonitorScheduler(StorageQuotaService quotaService, StorageMonitorProperties props, Clock clock) {
        this.quotaService = quotaService;
        this.props = props;
        this.clock = clock;
        this.enabled = props.isEnabled();
        this.intervalMinutes = props.getIntervalMinutes();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (props.isAutoStart() && enabled) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    /** Idempotent: a running monitor is left alone and its stats returned. */
    public MonitorLifecycleResult start() {
        synchronized (lifecycleLock) {
            if (!enabled) {
                return lifecycle(false, true, "Storage monitoring is disabled");
            }
            if (worker != null && worker.isAlive()) {
                if (stopSignal.getCount() == 0) {
                    return lifecycle(false, false, "Previous monitor worker is still stopping");
                }
                return lifecycle(true, true, "Storage monitor already running");
            }
            CountDownLatch signal = new CountDownLatch(1);
            Thread t = new Thread(() -> runLoop(signal), THREAD_NAME);
            t.setDaemon(true);
            stopSignal = signal;
            worker = t;
            stats.markStarted(clock.instant());
            t.start();
        }
        log.info("Storage monitor started, interval {} min", intervalMinutes);
        return lifecycle(true, true, "Storage monitor started");
    }

    /**
     * Signals the worker and waits up to {@code stopTimeout}. The signal stays set when the
     * worker does not exit in time; it exits on its next wake-up.
     */
    public MonitorLifecycleResult stop() {
        Thread t;
        synchronized (lifecycleLock) {
            t = worker;
            if (t == null || !t.isAlive()) {
                worker = null;
                return lifecycle(true, true, "Storage monitor not running");
            }
            stopSignal.countDown();
        }
        boolean clean;
        try {
            t.join(props.getStopTimeout().toMillis());
            clean = !t.isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clean = false;
        }
        if (clean) {
            synchronized (lifecycleLock) {
                if (worker == t) worker = null;
            }
            log.info("Storage monitor stopped");
            return lifecycle(true, true, "Storage monitor stopped");
        }
        log.warn("Storage monitor did not stop within {}", props.getStopTimeout());
        return lifecycle(true, false, "Stop signalled; worker did not exit within " + props.getStopTimeout());
    }

    public MonitorLifecycleResult restart() {
        MonitorLifecycleResult stopped = stop();
        MonitorLifecycleResult started = start();
        if (!stopped.isClean()) {
            started.setMessage(started.getMessage() + " (previous worker did not stop cleanly)");
            started.setClean(false);
        }
        return started;
    }

    /** Synchronous pass outside the timer; does not touch the worker's stats. */
    public QuotaCheckSummary forceCheckNow() {
        try {
            return quotaService.checkAllStorageQuotas(true);
        } catch (RuntimeException e) {
            log.error("Forced storage check failed", e);
            return QuotaCheckSummary.builder()
                    .success(false)
                    .forced(true)
                    .error(e.getMessage())
                    .timestamp(clock.instant())
                    .build();
        }
    }

    /** Null arguments keep the current value. */
    public MonitorConfigUpdate updateConfig(Integer newInterval, Boolean newEnabled) {
        if (newInterval != null && newInterval < StorageMonitorProperties.MIN_INTERVAL_MINUTES) {
            throw new ConfigException(ConfigException.Kind.INVALID_INTERVAL,
                    "Monitor interval must be at least " + StorageMonitorProperties.MIN_INTERVAL_MINUTES
                            + " minutes, got " + newInterval);
        }
        synchronized (lifecycleLock) {
            boolean intervalChanged = newInterval != null && newInterval != intervalMinutes;
            boolean enabledChanged = newEnabled != null && newEnabled != enabled;
            if (intervalChanged) intervalMinutes = newInterval;
            if (enabledChanged) enabled = newEnabled;

            boolean restarted = false;
            if (intervalChanged || enabledChanged) {
                log.info("Storage monitor config updated: interval={} min, enabled={}", intervalMinutes, enabled);
                if (!enabled) {
                    if (isRunning()) stop();
                } else if (isRunning()) {
                    restart();
                    restarted = true;
                }
            }
            return MonitorConfigUpdate.builder()
                    .changed(intervalChanged || enabledChanged)
                    .restarted(restarted)
                    .intervalMinutes(intervalMinutes)
                    .enabled(enabled)
                    .build();
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return worker != null && worker.isAlive() && stopSignal.getCount() > 0;
        }
    }

    public MonitorStatusDto getStatus() {
        boolean alive;
        synchronized (lifecycleLock) {
            alive = worker != null && worker.isAlive();
        }
        return MonitorStatusDto.builder()
                .enabled(enabled)
                .running(isRunning())
                .workerAlive(alive)
                .intervalMinutes(intervalMinutes)
                .stats(stats.snapshot(clock.instant()))
                .build();
    }

    void runLoop(CountDownLatch signal) {
        log.info("Storage monitor worker running");
        while (signal.getCount() > 0) {
            Duration wait;
            try {
                QuotaCheckSummary summary = quotaService.checkAllStorageQuotas(false);
                stats.recordPass(clock.instant(), summary.getAlertsGenerated(), summary.isSuccess() ? null : summary.getError());
                if (summary.isSuccess()) {
                    log.debug("Storage check: {} session(s), {} alert(s)",
                            summary.getSessionsChecked(), summary.getAlertsGenerated());
                    wait = Duration.ofMinutes(intervalMinutes);
                } else {
                    log.warn("Storage check incomplete: {}", summary.getError());
                    wait = props.getErrorRecoveryInterval();
                }
            } catch (Exception e) {
                stats.recordError(clock.instant(), e.getClass().getSimpleName() + ": " + e.getMessage());
                log.error("Storage monitor pass failed ({} consecutive)", stats.consecutiveErrors(), e);
                wait = props.getErrorRecoveryInterval();
            }
            try {
                if (signal.await(wait.toMillis(), TimeUnit.MILLISECONDS)) break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Storage monitor worker exiting");
    }

    private MonitorLifecycleResult lifecycle(boolean success, boolean clean, String message) {
        return MonitorLifecycleResult.builder()
                .success(success)
                .clean(clean)
                .message(message)
                .stats(stats.snapshot(clock.instant()))
                .build();
    }
}
