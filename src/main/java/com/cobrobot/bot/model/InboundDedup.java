package com.cobrobot.bot.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Claim on an inbound delivery. The primary key is the concurrency primitive: a second
 * claim of a live key means the delivery was already handled, possibly by another instance.
 */
@Entity
@Table(name = "inbound_dedup", indexes = {
        @Index(name = "idx_inbound_dedup_expires_at", columnList = "expires_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InboundDedup {

    @Id
    @Column(name = "dedup_key", length = 128, nullable = false, updatable = false)
    private String dedupKey;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;
}
