package com.aec.AdminDrive.dto;

import lombok.*;

/** Absent fields keep their current value. */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MonitorConfigRequest {
    private Integer intervalMinutes;
    private Boolean enabled;
}
