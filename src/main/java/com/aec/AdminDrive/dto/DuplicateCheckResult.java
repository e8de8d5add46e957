package com.aec.AdminDrive.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DuplicateCheckResult {
    private String contentHash;
    private boolean duplicate;
    private int duplicateSequence;
    private String displayName;
    private Long originalFileId;
    private String originalDisplayName;
    /** null when the file is not a duplicate. */
    private String notification;
}
