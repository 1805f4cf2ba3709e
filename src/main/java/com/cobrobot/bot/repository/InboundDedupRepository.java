package com.cobrobot.bot.repository;

import com.cobrobot.bot.model.InboundDedup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Repository
public interface InboundDedupRepository extends JpaRepository<InboundDedup, String> {

    /**
     * Atomically claims {@code key}. Returns 1 when the key was free or its previous claim had expired,
     * 0 when a live claim already exists.
     */
    @Transactional
    @Modifying
    @Query(value = "INSERT INTO inbound_dedup (dedup_key, created_at, expires_at) VALUES (:key, :now, :expiresAt) " +
            "ON CONFLICT (dedup_key) DO UPDATE SET created_at = EXCLUDED.created_at, expires_at = EXCLUDED.expires_at " +
            "WHERE inbound_dedup.expires_at <= EXCLUDED.created_at", nativeQuery = true)
    int claim(@Param("key") String key,
              @Param("now") LocalDateTime now,
              @Param("expiresAt") LocalDateTime expiresAt);

    @Transactional
    @Modifying
    @Query("DELETE FROM InboundDedup d WHERE d.expiresAt < :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
