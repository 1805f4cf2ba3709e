package com.cobrobot.bot.dto;

import com.cobrobot.bot.model.BillingCycle;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {

    private String phone;

    private BillingCycle cycle;

    private String customerId;
}
