package com.cobrobot.bot.service;

import com.cobrobot.bot.dto.BillingEvent;
import com.cobrobot.bot.model.BillingCycle;
import com.cobrobot.bot.model.Plan;
import com.cobrobot.bot.model.PlanSource;
import com.cobrobot.bot.model.User;
import com.cobrobot.bot.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

import static com.cobrobot.bot.constant.BotConstants.*;

/**
 * Owns the plan fields of {@link User}: trial grants and the mirror of the billing processor's subscription state.
 */
@Slf4j
@Service
public class SubscriptionService {

    private final UserRepository userRepository;
    private final Clock clock;
    private final int trialDays;
    private final int graceDays;

    @Autowired
    public SubscriptionService(UserRepository userRepository,
                               Clock clock,
                               @Value("${app.trial-days:7}") int trialDays,
                               @Value("${billing.grace-days:3}") int graceDays) {
        this.userRepository = userRepository;
        this.clock = clock;
        this.trialDays = trialDays;
        this.graceDays = graceDays;
    }

    public boolean hasProAccess(@NotNull User user) {
        return hasProAccess(user, LocalDateTime.now(clock));
    }

    /**
     * Precedence: a live trial or admin grant, then an active/trialing subscription, then a past_due/unpaid
     * subscription still inside its grace window, then a plain PRO flag for users billing never touched.
     * Once the processor reports a status for the user it is authoritative and the plain flag is not consulted.
     */
    public boolean hasProAccess(@NotNull User user, @NotNull LocalDateTime now) {
        PlanSource source = user.getPlanSource();
        if (source == PlanSource.TRIAL || source == PlanSource.ADMIN) {
            if (user.getPlanUntil() == null ? source == PlanSource.ADMIN : user.getPlanUntil().isAfter(now)) {
                return true;
            }
        }

        String status = user.getSubscriptionStatus();
        if (SUBSCRIPTION_ACTIVE.equals(status) || SUBSCRIPTION_TRIALING.equals(status)) {
            return true;
        }
        if (SUBSCRIPTION_PAST_DUE.equals(status) || SUBSCRIPTION_UNPAID.equals(status)) {
            return user.getGraceUntil() != null && user.getGraceUntil().isAfter(now);
        }
        if (status != null || source == PlanSource.TRIAL) {
            return false;
        }

        return user.getPlan() == Plan.PRO && (user.getPlanUntil() == null || user.getPlanUntil().isAfter(now));
    }

    public int getTrialDays() {
        return trialDays;
    }

    /**
     * Grants the one-time trial. Returns false when the user already used it or is already PRO.
     */
    @Transactional
    public boolean activateTrial(@NotNull String phone, @Nullable String businessName, @NotNull BillingCycle cycle) {
        Optional<User> userOptional = userRepository.findByPhone(phone);
        if (userOptional.isEmpty()) {
            log.warn("Trial requested for unknown user {}", phone);
            return false;
        }

        User user = userOptional.get();
        if (user.isTrialUsed() || hasProAccess(user)) {
            return false;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        user.setPlan(Plan.PRO);
        user.setPlanSource(PlanSource.TRIAL);
        user.setPlanUntil(now.plusDays(trialDays));
        user.setTrialUsed(true);
        user.setBillingCycle(cycle);
        if (StringUtils.hasText(businessName)) {
            user.setBusinessName(businessName.trim());
        }
        userRepository.save(user);

        log.info("Trial activated for {} until {} ({})", phone, user.getPlanUntil(), cycle.name());
        return true;
    }

    @Transactional
    public Optional<User> applyCheckoutCompleted(@NotNull BillingEvent event) {
        Optional<User> userOptional = findBillingUser(event);
        userOptional.ifPresent(user -> {
            if (StringUtils.hasText(event.getCustomerId())) {
                user.setStripeCustomerId(event.getCustomerId());
            }
            if (StringUtils.hasText(event.getSubscriptionId())) {
                user.setStripeSubscriptionId(event.getSubscriptionId());
            }
            BillingCycle cycle = parseCycle(event.getCycle());
            if (cycle != null) {
                user.setBillingCycle(cycle);
            }
            user.setSubscriptionStatus(SUBSCRIPTION_ACTIVE);
            user.setGraceUntil(null);
            user.setPlan(Plan.PRO);
            user.setPlanSource(PlanSource.BILLING);
            userRepository.save(user);
            log.info("Checkout completed for {} (customer {})", user.getPhone(), event.getCustomerId());
        });
        return userOptional;
    }

    /**
     * Mirrors a created/updated subscription. past_due and unpaid open a grace window unless one is already open.
     */
    @Transactional
    public Optional<User> applySubscriptionChange(@NotNull BillingEvent event) {
        Optional<User> userOptional = findBillingUser(event);
        userOptional.ifPresent(user -> {
            LocalDateTime now = LocalDateTime.now(clock);
            String status = event.getSubscriptionStatus();

            user.setSubscriptionStatus(status);
            if (StringUtils.hasText(event.getCustomerId())) {
                user.setStripeCustomerId(event.getCustomerId());
            }
            if (StringUtils.hasText(event.getSubscriptionId())) {
                user.setStripeSubscriptionId(event.getSubscriptionId());
            }
            if (event.getPeriodEnd() != null) {
                user.setPlanUntil(event.getPeriodEnd());
            }

            if (SUBSCRIPTION_ACTIVE.equals(status) || SUBSCRIPTION_TRIALING.equals(status)) {
                user.setPlan(Plan.PRO);
                user.setPlanSource(PlanSource.BILLING);
                user.setGraceUntil(null);
            } else if (SUBSCRIPTION_PAST_DUE.equals(status) || SUBSCRIPTION_UNPAID.equals(status)) {
                openGraceWindow(user, now);
            }
            userRepository.save(user);
            log.info("Subscription of {} is now {} (period end {})", user.getPhone(), status, event.getPeriodEnd());
        });
        return userOptional;
    }

    @Transactional
    public Optional<User> applySubscriptionDeleted(@NotNull BillingEvent event) {
        Optional<User> userOptional = findBillingUser(event);
        userOptional.ifPresent(user -> {
            user.setSubscriptionStatus(SUBSCRIPTION_CANCELED);
            user.setGraceUntil(null);
            if (user.getPlanSource() == PlanSource.BILLING) {
                user.setPlan(Plan.FREE);
                user.setPlanSource(null);
                user.setPlanUntil(null);
            }
            userRepository.save(user);
            log.info("Subscription of {} canceled", user.getPhone());
        });
        return userOptional;
    }

    @Transactional
    public Optional<User> applyPaymentFailed(@NotNull BillingEvent event) {
        Optional<User> userOptional = findBillingUser(event);
        userOptional.ifPresent(user -> {
            user.setSubscriptionStatus(SUBSCRIPTION_PAST_DUE);
            openGraceWindow(user, LocalDateTime.now(clock));
            userRepository.save(user);
            log.warn("Payment failed for {}; grace until {}", user.getPhone(), user.getGraceUntil());
        });
        return userOptional;
    }

    private void openGraceWindow(User user, LocalDateTime now) {
        if (user.getGraceUntil() == null || !user.getGraceUntil().isAfter(now)) {
            user.setGraceUntil(now.plusDays(graceDays));
        }
    }

    /**
     * The phone from event metadata wins; the customer id covers events that carry no metadata (invoices).
     */
    private Optional<User> findBillingUser(BillingEvent event) {
        Optional<User> user = Optional.empty();
        if (StringUtils.hasText(event.getPhone())) {
            user = userRepository.findByPhone(event.getPhone());
        }
        if (user.isEmpty() && StringUtils.hasText(event.getCustomerId())) {
            user = userRepository.findByStripeCustomerId(event.getCustomerId());
        }
        if (user.isEmpty()) {
            log.warn("No user for billing event {} (phone={}, customer={})",
                    event.getEventId(), event.getPhone(), event.getCustomerId());
        }
        return user;
    }

    @Nullable
    static BillingCycle parseCycle(@Nullable String cycle) {
        if (cycle == null) {
            return null;
        }
        for (BillingCycle value : BillingCycle.values()) {
            if (value.name().equalsIgnoreCase(cycle) || value.getDisplayName().equalsIgnoreCase(cycle)) {
                return value;
            }
        }
        return null;
    }
}
