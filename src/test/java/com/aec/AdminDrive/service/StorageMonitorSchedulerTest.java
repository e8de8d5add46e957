package com.aec.AdminDrive.service;

import com.aec.AdminDrive.config.StorageMonitorProperties;
import com.aec.AdminDrive.dto.MonitorConfigUpdate;
import com.aec.AdminDrive.dto.MonitorLifecycleResult;
import com.aec.AdminDrive.dto.MonitorStatusDto;
import com.aec.AdminDrive.dto.QuotaCheckSummary;
import com.aec.AdminDrive.exception.ConfigException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

class StorageMonitorSchedulerTest {

    private StorageQuotaService quotaService;
    private StorageMonitorProperties props;
    private StorageMonitorScheduler scheduler;

    @BeforeEach
    void setUp() {
        quotaService = Mockito.mock(StorageQuotaService.class);
        when(quotaService.checkAllStorageQuotas(anyBoolean())).thenAnswer(inv -> QuotaCheckSummary.builder()
                .success(true)
                .sessionsChecked(1)
                .alertsGenerated(1)
                .forced(inv.getArgument(0))
                .timestamp(Instant.now())
                .build());
        props = new StorageMonitorProperties();
        props.setStopTimeout(Duration.ofSeconds(2));
        props.setErrorRecoveryInterval(Duration.ofMinutes(5));
        scheduler = new StorageMonitorScheduler(quotaService, props, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private static long monitorThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> StorageMonitorScheduler.THREAD_NAME.equals(t.getName()) && t.isAlive())
                .count();
    }

    @Test
    void starting_twice_keeps_a_single_worker() {
        MonitorLifecycleResult first = scheduler.start();
        MonitorLifecycleResult second = scheduler.start();

        assertTrue(first.isSuccess());
        assertTrue(second.isSuccess());
        assertEquals("Storage monitor already running", second.getMessage());
        assertTrue(scheduler.isRunning());
        assertEquals(1, monitorThreads());
    }

    @Test
    void worker_runs_a_pass_immediately_and_counts_it() throws InterruptedException {
        scheduler.start();
        verify(quotaService, timeout(2000)).checkAllStorageQuotas(false);

        MonitorStatusDto status = awaitStatus(s -> s.getStats().getTotalChecks() == 1);
        assertEquals(1, status.getStats().getTotalAlertsSent());
        assertEquals(0, status.getStats().getConsecutiveErrors());
        assertNotNull(status.getStats().getServiceStarted());
        assertTrue(status.isRunning());
    }

    @Test
    void loop_errors_are_recorded_and_do_not_kill_the_worker() throws InterruptedException {
        when(quotaService.checkAllStorageQuotas(false)).thenThrow(new IllegalStateException("db down"));

        scheduler.start();

        MonitorStatusDto status = awaitStatus(s -> s.getStats().getConsecutiveErrors() == 1);
        assertEquals("IllegalStateException: db down", status.getStats().getLastError());
        assertEquals(0, status.getStats().getTotalChecks());
        assertTrue(status.isWorkerAlive());
    }

    @Test
    void stop_ends_the_worker_cleanly() {
        scheduler.start();

        MonitorLifecycleResult stopped = scheduler.stop();

        assertTrue(stopped.isClean());
        assertFalse(scheduler.isRunning());
        assertEquals(0, monitorThreads());
        assertTrue(scheduler.stop().isClean());
    }

    @Test
    void forced_check_bypasses_the_timer_and_stats() {
        QuotaCheckSummary summary = scheduler.forceCheckNow();

        assertTrue(summary.isForced());
        verify(quotaService).checkAllStorageQuotas(true);
        assertEquals(0, scheduler.getStatus().getStats().getTotalChecks());
    }

    @Test
    void forced_check_failure_is_returned_not_thrown() {
        when(quotaService.checkAllStorageQuotas(true)).thenThrow(new IllegalStateException("boom"));

        QuotaCheckSummary summary = scheduler.forceCheckNow();

        assertFalse(summary.isSuccess());
        assertEquals("boom", summary.getError());
    }

    @Test
    void interval_below_five_minutes_is_rejected() {
        ConfigException e = assertThrows(ConfigException.class, () -> scheduler.updateConfig(2, null));

        assertEquals(ConfigException.Kind.INVALID_INTERVAL, e.kind());
        assertEquals(60, scheduler.getStatus().getIntervalMinutes());
    }

    @Test
    void changed_interval_on_running_monitor_restarts_exactly_once() {
        StorageMonitorScheduler spy = Mockito.spy(scheduler);
        doReturn(true).when(spy).isRunning();
        doReturn(MonitorLifecycleResult.builder().success(true).clean(true).build()).when(spy).restart();

        MonitorConfigUpdate update = spy.updateConfig(90, null);

        assertTrue(update.isChanged());
        assertTrue(update.isRestarted());
        assertEquals(90, update.getIntervalMinutes());
        verify(spy, times(1)).restart();
    }

    @Test
    void concurrent_identical_updates_restart_once() throws Exception {
        StorageMonitorScheduler spy = Mockito.spy(scheduler);
        doReturn(true).when(spy).isRunning();
        doAnswer(inv -> {
            Thread.sleep(100);
            return MonitorLifecycleResult.builder().success(true).clean(true).build();
        }).when(spy).restart();

        CyclicBarrier go = new CyclicBarrier(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<MonitorConfigUpdate> update = () -> {
                go.await(5, TimeUnit.SECONDS);
                return spy.updateConfig(90, null);
            };
            Future<MonitorConfigUpdate> a = pool.submit(update);
            Future<MonitorConfigUpdate> b = pool.submit(update);
            MonitorConfigUpdate first = a.get(5, TimeUnit.SECONDS);
            MonitorConfigUpdate second = b.get(5, TimeUnit.SECONDS);

            assertEquals(1, (first.isRestarted() ? 1 : 0) + (second.isRestarted() ? 1 : 0));
            assertEquals(1, (first.isChanged() ? 1 : 0) + (second.isChanged() ? 1 : 0));
            verify(spy, times(1)).restart();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unchanged_config_does_not_restart() {
        StorageMonitorScheduler spy = Mockito.spy(scheduler);
        doReturn(true).when(spy).isRunning();

        MonitorConfigUpdate update = spy.updateConfig(60, true);

        assertFalse(update.isChanged());
        verify(spy, never()).restart();
    }

    @Test
    void disabling_stops_and_start_is_refused() {
        scheduler.start();

        scheduler.updateConfig(null, false);

        assertFalse(scheduler.isRunning());
        MonitorLifecycleResult start = scheduler.start();
        assertFalse(start.isSuccess());
        assertEquals(0, monitorThreads());
    }

    private MonitorStatusDto awaitStatus(java.util.function.Predicate<MonitorStatusDto> condition)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        MonitorStatusDto status = scheduler.getStatus();
        while (!condition.test(status) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            status = scheduler.getStatus();
        }
        assertTrue(condition.test(status), "condition not reached in time");
        return status;
    }
}
