package com.cobrobot.bot.service;

import com.cobrobot.bot.model.User;
import com.cobrobot.bot.model.intent.Intent;
import com.cobrobot.bot.repository.UserRepository;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Daily quota for billable intents on the free plan. The check and the increment are one conditional UPDATE,
 * so concurrent requests can never push a user past the limit.
 */
@Slf4j
@Service
public class PaywallService {

    private final UserRepository userRepository;
    private final SubscriptionService subscriptionService;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final int dailyLimit;
    private final int warnThreshold;

    public PaywallService(UserRepository userRepository,
                          SubscriptionService subscriptionService,
                          PipelineMetrics metrics,
                          Clock clock,
                          @Value("${app.paywall.free-daily-limit:15}") int dailyLimit,
                          @Value("${app.paywall.warn-threshold:3}") int warnThreshold) {
        this.userRepository = userRepository;
        this.subscriptionService = subscriptionService;
        this.metrics = metrics;
        this.clock = clock;
        this.dailyLimit = dailyLimit;
        this.warnThreshold = warnThreshold;
    }

    @Getter
    public static final class Gate {

        private static final Gate UNMETERED = new Gate(false, false, -1);

        private final boolean blocked;
        private final boolean warn;
        // -1 when the action is not metered
        private final int remaining;

        private Gate(boolean blocked, boolean warn, int remaining) {
            this.blocked = blocked;
            this.warn = warn;
            this.remaining = remaining;
        }

        public static Gate unmetered() {
            return UNMETERED;
        }

        public static Gate blocked() {
            return new Gate(true, false, 0);
        }

        public static Gate allowed(int remaining, boolean warn) {
            return new Gate(false, warn, remaining);
        }
    }

    @NotNull
    public Gate gate(@NotNull User user, @NotNull Intent intent) {
        if (!intent.getType().isBillable()) {
            return Gate.unmetered();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (subscriptionService.hasProAccess(user, now)) {
            return Gate.unmetered();
        }

        LocalDate today = now.toLocalDate();
        if (userRepository.consumeDailyQuota(user.getPhone(), today, dailyLimit) == 0) {
            log.info("Free quota exhausted for {} ({} per day)", user.getPhone(), dailyLimit);
            metrics.paywall(true);
            return Gate.blocked();
        }

        int used = userRepository.findByPhone(user.getPhone())
                .map(fresh -> fresh.getDailyCountFor(today))
                .orElse(dailyLimit);
        int remaining = Math.max(0, dailyLimit - used);

        metrics.paywall(false);
        return Gate.allowed(remaining, remaining == warnThreshold);
    }

    public int getDailyLimit() {
        return dailyLimit;
    }
}
