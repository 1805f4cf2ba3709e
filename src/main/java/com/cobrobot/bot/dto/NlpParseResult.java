package com.cobrobot.bot.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Raw, untrusted output of the NLP resolver. Every field may be missing or malformed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NlpParseResult {

    private String intent;

    @JsonProperty("client_name")
    private String clientName;

    @JsonProperty("amount_due")
    private BigDecimal amountDue;

    @JsonProperty("since_text")
    private String sinceText;

    @JsonProperty("remind_when_text")
    private String remindWhenText;

    private String tone;

    public static NlpParseResult unknown() {
        return NlpParseResult.builder().intent("unknown").build();
    }
}
