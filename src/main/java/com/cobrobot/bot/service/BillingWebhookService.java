package com.cobrobot.bot.service;

import com.cobrobot.bot.dto.BillingEvent;
import com.cobrobot.bot.exception.MessageDeliveryException;
import com.cobrobot.bot.model.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;

import static com.cobrobot.bot.constant.BotConstants.*;
import static com.cobrobot.bot.constant.MessageTemplates.*;

/**
 * Verify, claim, apply. Only the first delivery of an event id gets past {@link BillingEventGate}; effect failures
 * after the claim are logged and still answered with success, since a retried delivery would be a duplicate anyway.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillingWebhookService {

    public enum Result { OK, DUPLICATE, IGNORED }

    private final BillingGateway billingGateway;
    private final BillingEventGate eventGate;
    private final SubscriptionService subscriptionService;
    private final MessageTransport messageTransport;
    private final PipelineMetrics metrics;

    @NotNull
    public Result process(@NotNull String payload, @Nullable String signatureHeader) {
        BillingEvent event = billingGateway.verify(payload, signatureHeader);
        String type = event.getType();

        if (!StringUtils.hasText(event.getEventId())) {
            log.warn("Billing event without id ({}) ignored", type);
            return record(type, Result.IGNORED);
        }

        if (!eventGate.acquire(event.getEventId(), type)) {
            return record(type, Result.DUPLICATE);
        }

        Result result;
        try {
            result = route(event);
        } catch (RuntimeException e) {
            log.error("Failed to apply billing event id={} type={}: {}", event.getEventId(), type, e.getMessage(), e);
            result = Result.OK;
        }

        try {
            eventGate.markDone(event.getEventId());
        } catch (DataAccessException e) {
            log.error("Billing event id={} applied but could not be marked done: {}", event.getEventId(), e.getMessage(), e);
        }
        return record(type, result);
    }

    private Result route(BillingEvent event) {
        if (!event.isPayloadReadable() || event.getType() == null) {
            log.warn("Billing event {} ({}) has an unreadable payload", event.getEventId(), event.getType());
            return Result.IGNORED;
        }

        log.info("Processing billing event id={} type={}", event.getEventId(), event.getType());

        switch (event.getType()) {
            case EVENT_CHECKOUT_COMPLETED -> subscriptionService.applyCheckoutCompleted(event)
                    .ifPresent(user -> notifyUser(user, PAYMENT_SUCCESS));
            case EVENT_SUBSCRIPTION_CREATED, EVENT_SUBSCRIPTION_UPDATED -> subscriptionService.applySubscriptionChange(event);
            case EVENT_SUBSCRIPTION_DELETED -> subscriptionService.applySubscriptionDeleted(event)
                    .ifPresent(user -> notifyUser(user, SUBSCRIPTION_ENDED));
            case EVENT_INVOICE_PAYMENT_FAILED -> subscriptionService.applyPaymentFailed(event)
                    .ifPresent(user -> notifyUser(user, PAYMENT_FAILED));
            default -> {
                log.debug("Billing event type {} not handled", event.getType());
                return Result.IGNORED;
            }
        }
        return Result.OK;
    }

    private void notifyUser(User user, String text) {
        try {
            messageTransport.send(user.getPhone(), text);
        } catch (MessageDeliveryException e) {
            log.warn("Could not notify {} about billing change: {}", user.getPhone(), e.getMessage());
        }
    }

    private Result record(String type, Result result) {
        metrics.billingWebhook(type, result.name().toLowerCase(Locale.ROOT));
        return result;
    }
}
