package com.aec.AdminDrive.Repository;

import com.aec.AdminDrive.model.AdminCredential;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AdminCredentialRepository extends JpaRepository<AdminCredential, Long> {

    Optional<AdminCredential> findByUserId(Long userId);

    boolean existsByPersistentSessionId(String persistentSessionId);

    List<AdminCredential> findAllByActiveTrueOrderByIdAsc();

    /** The credential handed out when a caller does not name one. */
    Optional<AdminCredential> findFirstByActiveTrueOrderByUpdatedAtDesc();

    Optional<AdminCredential> findFirstByOrderByUpdatedAtDesc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from AdminCredential c where c.id = :id")
    Optional<AdminCredential> findByIdForUpdate(@Param("id") Long id);
}
