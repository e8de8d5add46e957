package com.aec.AdminDrive.service;

import com.aec.AdminDrive.Repository.StoredFileRepository;
import com.aec.AdminDrive.dto.DuplicateCheckResult;
import com.aec.AdminDrive.model.StoredFile;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;

class DuplicateFileHandlerTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void hashes_streamed_content() throws IOException {
        String hash = DuplicateFileHandler.sha256Hex(new ByteArrayInputStream("abc".getBytes(StandardCharsets.UTF_8)));
        assertEquals(ABC_SHA256, hash);
    }

    @Test
    void duplicate_names_replace_existing_sequence() {
        assertEquals("Resume (1).pdf", DuplicateFileHandler.duplicateName("Resume.pdf", 1));
        assertEquals("Resume (2).pdf", DuplicateFileHandler.duplicateName("Resume (1).pdf", 2));
        assertEquals("notes (3)", DuplicateFileHandler.duplicateName("notes", 3));
        assertEquals("archive.tar (1).gz", DuplicateFileHandler.duplicateName("archive.tar.gz", 1));
        assertEquals("Resume.pdf", DuplicateFileHandler.duplicateName("Resume.pdf", 0));
    }

    @Test
    void new_content_keeps_its_name() throws IOException {
        StoredFileRepository repo = Mockito.mock(StoredFileRepository.class);
        Mockito.when(repo.findByOwnerUserIdAndContentHashAndDeletedFalseOrderByDuplicateSequenceAsc(5L, ABC_SHA256))
                .thenReturn(List.of());

        DuplicateCheckResult result = new DuplicateFileHandler(repo)
                .check(5L, "Resume.pdf", new ByteArrayInputStream("abc".getBytes(StandardCharsets.UTF_8)));

        assertFalse(result.isDuplicate());
        assertEquals("Resume.pdf", result.getDisplayName());
        assertNull(result.getNotification());
    }

    @Test
    void repeated_content_gets_next_sequence() {
        StoredFileRepository repo = Mockito.mock(StoredFileRepository.class);
        StoredFile original = StoredFile.builder().id(11L).displayName("Resume.pdf").duplicateSequence(0).build();
        StoredFile copy = StoredFile.builder().id(12L).displayName("Resume (1).pdf").duplicateSequence(1).build();
        Mockito.when(repo.findByOwnerUserIdAndContentHashAndDeletedFalseOrderByDuplicateSequenceAsc(5L, ABC_SHA256))
                .thenReturn(List.of(original, copy));
        Mockito.when(repo.findMaxDuplicateSequence(5L, ABC_SHA256)).thenReturn(1);

        DuplicateCheckResult result = new DuplicateFileHandler(repo).checkHash(5L, "Resume.pdf", ABC_SHA256);

        assertTrue(result.isDuplicate());
        assertEquals(2, result.getDuplicateSequence());
        assertEquals("Resume (2).pdf", result.getDisplayName());
        assertEquals(11L, result.getOriginalFileId());
        assertTrue(result.getNotification().contains("'Resume.pdf'"));
    }

    @Test
    void register_persists_chosen_name() {
        StoredFileRepository repo = Mockito.mock(StoredFileRepository.class);
        Mockito.when(repo.save(any(StoredFile.class))).thenAnswer(inv -> inv.getArgument(0));
        DuplicateCheckResult check = DuplicateCheckResult.builder()
                .contentHash(ABC_SHA256).duplicate(true).duplicateSequence(1)
                .displayName("Resume (1).pdf").originalFileId(11L).build();

        StoredFile saved = new DuplicateFileHandler(repo).register(5L, "Resume.pdf", "application/pdf", 3, "drive-1", check);

        assertEquals("Resume (1).pdf", saved.getDisplayName());
        assertEquals(1, saved.getDuplicateSequence());
        assertEquals(11L, saved.getOriginalFileId());
        assertNotNull(saved.getUploadedAt());
    }
}
