package com.cobrobot.bot.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "processed_billing_events")
@Getter
@Setter
public class ProcessedBillingEvent {

    @Id
    @Column(name = "event_id", length = 255, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "event_type", length = 128)
    private String eventType;

    @Column(name = "claimed_at", nullable = false)
    private LocalDateTime claimedAt;

    // null while the event is claimed but its effects have not finished
    @Column(name = "processed_at")
    private LocalDateTime processedAt;
}
