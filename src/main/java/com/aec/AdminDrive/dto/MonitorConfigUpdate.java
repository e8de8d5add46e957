package com.aec.AdminDrive.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MonitorConfigUpdate {
    private boolean changed;
    private boolean restarted;
    private int intervalMinutes;
    private boolean enabled;
}
