package com.cobrobot.bot.repository;

import com.cobrobot.bot.model.ProcessedBillingEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Repository
public interface ProcessedBillingEventRepository extends JpaRepository<ProcessedBillingEvent, String> {

    @Transactional
    @Modifying
    @Query(value = "INSERT INTO processed_billing_events (event_id, event_type, claimed_at) VALUES (:eventId, :type, :now) " +
            "ON CONFLICT (event_id) DO NOTHING", nativeQuery = true)
    int claim(@Param("eventId") String eventId, @Param("type") String type, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying
    @Query("UPDATE ProcessedBillingEvent e SET e.processedAt = :now WHERE e.eventId = :eventId AND e.processedAt IS NULL")
    int markProcessed(@Param("eventId") String eventId, @Param("now") LocalDateTime now);

    long countByProcessedAtIsNullAndClaimedAtBefore(LocalDateTime threshold);
}
