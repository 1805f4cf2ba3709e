package com.cobrobot.bot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Data carried between the turns of a multi-turn flow. Each {@link PendingAction} reads only its own fields:
 * CHOOSE_TONE uses the client fields and remindAt, CONFIRM_SEND adds tone and draft, ASK_NAME/ASK_CYCLE use businessName.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PendingPayload {

    private String clientName;

    private String clientPhone;

    private BigDecimal amountDue;

    private Tone tone;

    private String draft;

    // ISO local date-time; absent when the reminder goes out on confirmation
    private String remindAt;

    private String businessName;
}
