package com.cobrobot.bot.service;

import com.cobrobot.bot.constant.BotConstants;
import com.cobrobot.bot.dto.BotReply;
import com.cobrobot.bot.dto.CheckoutRequest;
import com.cobrobot.bot.dto.CheckoutResponse;
import com.cobrobot.bot.model.BillingCycle;
import com.cobrobot.bot.model.User;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import static com.cobrobot.bot.constant.MessageTemplates.*;

/**
 * Hosted checkout for the PRO subscription.
 */
@Slf4j
@Service
public class PaymentService {

    private final BillingGateway billingGateway;

    @Autowired
    public PaymentService(BillingGateway billingGateway) {
        this.billingGateway = billingGateway;
    }

    @NotNull
    public BotReply createCheckout(@NotNull User user) {
        if (BotConstants.SUBSCRIPTION_ACTIVE.equals(user.getSubscriptionStatus())
                || BotConstants.SUBSCRIPTION_TRIALING.equals(user.getSubscriptionStatus())) {
            return BotReply.of(ALREADY_PRO);
        }

        BillingCycle cycle = user.getBillingCycle() != null ? user.getBillingCycle() : BillingCycle.MONTHLY;
        CheckoutRequest request = CheckoutRequest.builder()
                .phone(user.getPhone())
                .cycle(cycle)
                .customerId(user.getStripeCustomerId())
                .build();

        CheckoutResponse response = billingGateway.createCheckout(request);
        if (response == null || response.getPaymentUrl() == null) {
            log.error("Checkout could not be created for {}", user.getPhone());
            return BotReply.of(CHECKOUT_FAILED);
        }

        log.info("Checkout {} issued to {} ({})", response.getSessionId(), user.getPhone(), cycle.name());
        return BotReply.of(String.format(CHECKOUT_LINK, cycle.getDisplayName(), response.getPaymentUrl()));
    }
}
