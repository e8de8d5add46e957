package com.aec.AdminDrive.drive;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DriveQuota {
    private String accountEmail;
    private Long limitBytes;   // null for unlimited accounts
    private Long usageBytes;
}
