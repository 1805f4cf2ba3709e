package com.cobrobot.bot.service;

import com.cobrobot.bot.config.StripeProperties;
import com.cobrobot.bot.dto.BillingEvent;
import com.cobrobot.bot.dto.CheckoutRequest;
import com.cobrobot.bot.dto.CheckoutResponse;
import com.cobrobot.bot.exception.BillingSignatureException;
import com.cobrobot.bot.model.BillingCycle;
import com.google.gson.JsonSyntaxException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Event;
import com.stripe.model.Invoice;
import com.stripe.model.StripeObject;
import com.stripe.model.Subscription;
import com.stripe.model.checkout.Session;
import com.stripe.net.Webhook;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.cobrobot.bot.constant.BotConstants.METADATA_CYCLE;
import static com.cobrobot.bot.constant.BotConstants.METADATA_PHONE;

@Slf4j
@Service
public class StripeBillingGateway implements BillingGateway {

    private final StripeProperties stripeProperties;
    private final Clock clock;

    public StripeBillingGateway(StripeProperties stripeProperties, Clock clock) {
        this.stripeProperties = stripeProperties;
        this.clock = clock;
    }

    @NotNull
    @Override
    public BillingEvent verify(@NotNull String payload, @Nullable String signatureHeader) {
        String webhookSecret = stripeProperties.getWebhookSecret();
        if (!StringUtils.hasText(webhookSecret)) {
            log.warn("Stripe webhook secret not configured; rejecting request");
            throw new BillingSignatureException("Webhook secret not configured");
        }

        if (!StringUtils.hasText(signatureHeader)) {
            throw new BillingSignatureException("Missing Stripe-Signature header");
        }

        final Event event;
        try {
            event = Webhook.constructEvent(payload, signatureHeader, webhookSecret);
        } catch (SignatureVerificationException e) {
            log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
            throw new BillingSignatureException("Invalid Stripe signature", e);
        } catch (JsonSyntaxException e) {
            log.warn("Stripe webhook payload is not valid JSON: {}", e.getMessage());
            throw new BillingSignatureException("Malformed Stripe payload", e);
        }

        BillingEvent.BillingEventBuilder builder = BillingEvent.builder()
                .eventId(event.getId())
                .type(event.getType());

        Optional<StripeObject> dataObject = event.getDataObjectDeserializer().getObject();
        if (dataObject.isEmpty()) {
            log.warn("Could not deserialize data object of event {} ({}); API version mismatch?",
                    event.getId(), event.getType());
            return builder.payloadReadable(false).build();
        }

        StripeObject stripeObject = dataObject.get();
        if (stripeObject instanceof Session session) {
            Map<String, String> metadata = session.getMetadata();
            String phone = metadata != null ? metadata.get(METADATA_PHONE) : null;
            builder.phone(StringUtils.hasText(phone) ? phone : session.getClientReferenceId())
                    .customerId(session.getCustomer())
                    .subscriptionId(session.getSubscription())
                    .cycle(metadata != null ? metadata.get(METADATA_CYCLE) : null);
        } else if (stripeObject instanceof Subscription subscription) {
            Map<String, String> metadata = subscription.getMetadata();
            builder.phone(metadata != null ? metadata.get(METADATA_PHONE) : null)
                    .cycle(metadata != null ? metadata.get(METADATA_CYCLE) : null)
                    .customerId(subscription.getCustomer())
                    .subscriptionId(subscription.getId())
                    .subscriptionStatus(subscription.getStatus())
                    .periodEnd(toLocalDateTime(subscription.getCurrentPeriodEnd()));
        } else if (stripeObject instanceof Invoice invoice) {
            builder.customerId(invoice.getCustomer())
                    .subscriptionId(invoice.getSubscription());
        }

        return builder.payloadReadable(true).build();
    }

    @Nullable
    @Override
    public CheckoutResponse createCheckout(@NotNull CheckoutRequest request) {
        String priceId = request.getCycle() == BillingCycle.YEARLY
                ? stripeProperties.getPriceYearly()
                : stripeProperties.getPriceMonthly();
        if (!StringUtils.hasText(priceId)) {
            log.error("No Stripe price configured for cycle {}", request.getCycle());
            return null;
        }

        String cycle = request.getCycle().name().toLowerCase(Locale.ROOT);
        SessionCreateParams.Builder params = SessionCreateParams.builder()
                .setMode(SessionCreateParams.Mode.SUBSCRIPTION)
                .setSuccessUrl(stripeProperties.getSuccessUrl())
                .setCancelUrl(stripeProperties.getCancelUrl())
                .addLineItem(
                        SessionCreateParams.LineItem.builder()
                                .setQuantity(1L)
                                .setPrice(priceId)
                                .build()
                )
                .setClientReferenceId(request.getPhone())
                .putMetadata(METADATA_PHONE, request.getPhone())
                .putMetadata(METADATA_CYCLE, cycle)
                .setSubscriptionData(
                        SessionCreateParams.SubscriptionData.builder()
                                .putMetadata(METADATA_PHONE, request.getPhone())
                                .putMetadata(METADATA_CYCLE, cycle)
                                .build()
                );

        if (StringUtils.hasText(request.getCustomerId())) {
            params.setCustomer(request.getCustomerId());
        }

        try {
            Session session = Session.create(params.build());
            log.info("Created Stripe Checkout session id={} for {} cycle={}", session.getId(), request.getPhone(), cycle);
            return new CheckoutResponse(session.getId(), session.getUrl());
        } catch (StripeException e) {
            log.error("Failed to create Stripe Checkout session for {}: {}", request.getPhone(), e.getMessage());
            return null;
        }
    }

    @Nullable
    private LocalDateTime toLocalDateTime(@Nullable Long epochSeconds) {
        return epochSeconds != null ? LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), clock.getZone()) : null;
    }
}
