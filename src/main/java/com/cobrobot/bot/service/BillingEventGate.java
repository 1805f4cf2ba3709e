package com.cobrobot.bot.service;

import com.cobrobot.bot.repository.ProcessedBillingEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * At-most-once gate for billing notifications, keyed strictly on the processor's event id.
 * <p>
 * An event acquired but never marked done (crash mid-effect) stays claimed; it is reported by
 * {@link #reportStuckEvents()} for manual replay and never re-opened automatically.
 */
@Slf4j
@Component
public class BillingEventGate {

    private final ProcessedBillingEventRepository repository;
    private final Clock clock;
    private final Duration stuckAfter;

    public BillingEventGate(ProcessedBillingEventRepository repository,
                            Clock clock,
                            @Value("${billing.stuck-after:PT15M}") Duration stuckAfter) {
        this.repository = repository;
        this.clock = clock;
        this.stuckAfter = stuckAfter;
    }

    /**
     * @return true for the single caller that first claims {@code eventId}, false for every later one
     */
    public boolean acquire(@NotNull String eventId, String type) {
        boolean acquired = repository.claim(eventId, type, LocalDateTime.now(clock)) > 0;
        if (!acquired) {
            log.info("Billing event {} ({}) already claimed", eventId, type);
        }
        return acquired;
    }

    public void markDone(@NotNull String eventId) {
        if (repository.markProcessed(eventId, LocalDateTime.now(clock)) == 0) {
            log.warn("Billing event {} was not pending when marked done", eventId);
        }
    }

    @Scheduled(fixedDelayString = "${billing.stuck-check-interval-ms:900000}")
    public void reportStuckEvents() {
        long stuck = repository.countByProcessedAtIsNullAndClaimedAtBefore(LocalDateTime.now(clock).minus(stuckAfter));
        if (stuck > 0) {
            log.error("{} billing event(s) claimed more than {} min ago never finished; replay them manually",
                    stuck, stuckAfter.toMinutes());
        }
    }
}
