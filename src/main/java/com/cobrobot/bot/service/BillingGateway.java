package com.cobrobot.bot.service;

import com.cobrobot.bot.dto.BillingEvent;
import com.cobrobot.bot.dto.CheckoutRequest;
import com.cobrobot.bot.dto.CheckoutResponse;
import com.cobrobot.bot.exception.BillingSignatureException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The payment processor: verifies its notifications and opens hosted checkouts.
 */
public interface BillingGateway {

    /**
     * @throws BillingSignatureException when the payload was not signed by the processor
     */
    @NotNull
    BillingEvent verify(@NotNull String payload, @Nullable String signatureHeader);

    /**
     * @return the checkout, or null when the processor refused to create one
     */
    @Nullable
    CheckoutResponse createCheckout(@NotNull CheckoutRequest request);
}
