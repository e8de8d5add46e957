package com.aec.AdminDrive.Repository;

import com.aec.AdminDrive.model.OAuthStateNonce;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface OAuthStateNonceRepository extends JpaRepository<OAuthStateNonce, String> {

    @Modifying
    @Query("delete from OAuthStateNonce n where n.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    /** @return 1 for the caller that removed the row, 0 for everyone else */
    @Transactional
    @Modifying
    @Query("delete from OAuthStateNonce n where n.state = :state")
    int deleteByState(@Param("state") String state);
}
