package com.aec.AdminDrive.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "stored_files", indexes = @Index(name = "idx_stored_files_owner_hash", columnList = "ownerUserId, contentHash"))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StoredFile {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long ownerUserId;

    // null while the file only lives in local storage
    @Column(unique = true)
    private String driveFileId;

    @Column(nullable = false)
    private String originalName;

    @Column(nullable = false)
    private String displayName;    // "Resume (1).pdf" for duplicates

    private String fileType;       // MIME type

    @Column(nullable = false)
    private Long size;             // bytes

    @Column(nullable = false, length = 64)
    private String contentHash;    // SHA-256, hex

    @Column(nullable = false)
    private int duplicateSequence;

    private Long originalFileId;

    @Column(nullable = false)
    private Instant uploadedAt;

    @Column(nullable = false)
    private boolean deleted;
}
