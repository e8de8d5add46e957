package com.aec.AdminDrive.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MonitorStatusDto {
    private boolean enabled;
    private boolean running;
    private boolean workerAlive;
    private int intervalMinutes;
    private MonitorStatsSnapshot stats;
}
