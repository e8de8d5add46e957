package com.aec.AdminDrive.controller;

import com.aec.AdminDrive.dto.*;
import com.aec.AdminDrive.service.ProviderCallStats;
import com.aec.AdminDrive.service.StorageMonitorScheduler;
import com.aec.AdminDrive.service.StorageQuotaService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/drive")
@RequiredArgsConstructor
public class StorageMonitorController {

    private final StorageQuotaService quotaService;
    private final StorageMonitorScheduler scheduler;
    private final ProviderCallStats providerStats;

    @GetMapping("/storage/analytics")
    public ResponseEntity<StorageAnalyticsDto> analytics() {
        return ResponseEntity.ok(quotaService.getStorageAnalytics());
    }

    @GetMapping("/storage/status")
    public ResponseEntity<StorageStatusSummary> storageStatus() {
        return ResponseEntity.ok(quotaService.getAllStorageStatus());
    }

    @GetMapping("/storage/performance")
    public ResponseEntity<ProviderPerformanceSummary> performance() {
        return ResponseEntity.ok(providerStats.summary());
    }

    @GetMapping("/monitor/status")
    public ResponseEntity<MonitorStatusDto> monitorStatus() {
        return ResponseEntity.ok(scheduler.getStatus());
    }

    @PostMapping("/monitor/start")
    public ResponseEntity<MonitorLifecycleResult> start() {
        return ResponseEntity.ok(scheduler.start());
    }

    @PostMapping("/monitor/stop")
    public ResponseEntity<MonitorLifecycleResult> stop() {
        return ResponseEntity.ok(scheduler.stop());
    }

    @PostMapping("/monitor/restart")
    public ResponseEntity<MonitorLifecycleResult> restart() {
        return ResponseEntity.ok(scheduler.restart());
    }

    @PostMapping("/monitor/check")
    public ResponseEntity<QuotaCheckSummary> check() {
        return ResponseEntity.ok(scheduler.forceCheckNow());
    }

    @PutMapping("/monitor/config")
    public ResponseEntity<MonitorConfigUpdate> updateConfig(@RequestBody MonitorConfigRequest req) {
        return ResponseEntity.ok(scheduler.updateConfig(req.getIntervalMinutes(), req.getEnabled()));
    }
}
