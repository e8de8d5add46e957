package com.aec.AdminDrive.service;

import com.aec.AdminDrive.Repository.StoredFileRepository;
import com.aec.AdminDrive.dto.DuplicateCheckResult;
import com.aec.AdminDrive.model.StoredFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateFileHandler {

    private static final Pattern SEQUENCE_SUFFIX = Pattern.compile("^(.*) \\((\\d+)\\)$");
    private static final int BUFFER_SIZE = 8192;

    private final StoredFileRepository repo;

    public static String sha256Hex(InputStream in) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] buf = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buf)) != -1) {
            digest.update(buf, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /** "Resume.pdf", 2 -> "Resume (2).pdf"; an existing " (n)" suffix is replaced. */
    public static String duplicateName(String originalName, int sequence) {
        if (sequence <= 0) return originalName;
        String base = originalName;
        String ext = "";
        int dot = originalName.lastIndexOf('.');
        if (dot > 0) {
            base = originalName.substring(0, dot);
            ext = originalName.substring(dot);
        }
        Matcher m = SEQUENCE_SUFFIX.matcher(base);
        if (m.matches()) {
            base = m.group(1);
        }
        return base + " (" + sequence + ")" + ext;
    }

    @Transactional(readOnly = true)
    public DuplicateCheckResult check(Long ownerUserId, String originalName, InputStream content) throws IOException {
        String hash = sha256Hex(content);
        return checkHash(ownerUserId, originalName, hash);
    }

    @Transactional(readOnly = true)
    public DuplicateCheckResult checkHash(Long ownerUserId, String originalName, String contentHash) {
        List<StoredFile> existing = repo
                .findByOwnerUserIdAndContentHashAndDeletedFalseOrderByDuplicateSequenceAsc(ownerUserId, contentHash);
        if (existing.isEmpty()) {
            return DuplicateCheckResult.builder()
                    .contentHash(contentHash)
                    .duplicate(false)
                    .duplicateSequence(0)
                    .displayName(originalName)
                    .build();
        }

        StoredFile original = existing.get(0);
        int next = repo.findMaxDuplicateSequence(ownerUserId, contentHash) + 1;
        String displayName = duplicateName(originalName, next);
        log.info("Duplicate upload for user {}: '{}' matches file {} -> '{}'",
                ownerUserId, originalName, original.getId(), displayName);

        return DuplicateCheckResult.builder()
                .contentHash(contentHash)
                .duplicate(true)
                .duplicateSequence(next)
                .displayName(displayName)
                .originalFileId(original.getId())
                .originalDisplayName(original.getDisplayName())
                .notification("This file is identical to '" + original.getDisplayName()
                        + "'. It was saved as '" + displayName + "'.")
                .build();
    }

    @Transactional
    public StoredFile register(Long ownerUserId, String originalName, String fileType, long size,
                               String driveFileId, DuplicateCheckResult check) {
        StoredFile f = StoredFile.builder()
                .ownerUserId(ownerUserId)
                .originalName(originalName)
                .displayName(check.getDisplayName())
                .fileType(fileType)
                .size(size)
                .contentHash(check.getContentHash())
                .duplicateSequence(check.getDuplicateSequence())
                .originalFileId(check.getOriginalFileId())
                .driveFileId(driveFileId)
                .uploadedAt(Instant.now())
                .deleted(false)
                .build();
        return repo.save(f);
    }
}
