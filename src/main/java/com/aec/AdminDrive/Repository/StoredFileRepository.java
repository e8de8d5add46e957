package com.aec.AdminDrive.Repository;

import com.aec.AdminDrive.model.StoredFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface StoredFileRepository extends JpaRepository<StoredFile, Long> {
    List<StoredFile> findByOwnerUserIdAndContentHashAndDeletedFalseOrderByDuplicateSequenceAsc(Long ownerUserId, String contentHash);

    @Query("select coalesce(max(f.duplicateSequence), 0) from StoredFile f "
            + "where f.ownerUserId = :owner and f.contentHash = :hash and f.deleted = false")
    int findMaxDuplicateSequence(@Param("owner") Long ownerUserId, @Param("hash") String contentHash);
}
