package com.aec.AdminDrive.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "admin-drive.alerts.mail")
public class AlertMailProperties {
    private boolean enabled = false;
    private String from;
    private List<String> to = new ArrayList<>();
}
