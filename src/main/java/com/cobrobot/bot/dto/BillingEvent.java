package com.cobrobot.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Verified billing notification, reduced to the fields the pipeline acts on.
 * {@code payloadReadable} is false when the processor's object could not be deserialized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingEvent {

    private String eventId;

    private String type;

    private boolean payloadReadable;

    private String phone;

    private String customerId;

    private String subscriptionId;

    private String subscriptionStatus;

    private LocalDateTime periodEnd;

    private String cycle;
}
