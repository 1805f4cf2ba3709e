package com.cobrobot.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {

    private String from;

    private String body;

    // Twilio MessageSid; some transports omit it
    private String deliveryId;
}
