package com.cobrobot.bot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Stripe keys, redirect URLs and subscription price IDs.
 */
@ConfigurationProperties(prefix = "stripe")
@Data
public class StripeProperties {
    /** Secret API key (server-side). */
    private String secretKey;

    /** Webhook signing secret for signature verification. */
    private String webhookSecret;

    /** Success redirect URL for Checkout Sessions. */
    private String successUrl;

    /** Cancel redirect URL for Checkout Sessions. */
    private String cancelUrl;

    private String priceMonthly;

    private String priceYearly;
}
