package com.cobrobot.bot.config;

import com.stripe.Stripe;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private final StripeProperties stripe;

    @PostConstruct
    void init() {
        if (StringUtils.hasText(stripe.getSecretKey())) {
            Stripe.apiKey = stripe.getSecretKey();
        } else {
            log.warn("stripe.secret-key is not set; checkout links will fail until it is configured");
        }
    }
}
