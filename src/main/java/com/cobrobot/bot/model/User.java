package com.cobrobot.bot.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @Column(length = 64)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(name = "pending_action", length = 32)
    private PendingAction pendingAction;

    // JSON of PendingPayload, only meaningful together with pendingAction
    @Column(name = "pending_payload", length = 4000)
    private String pendingPayload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private Plan plan = Plan.FREE;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_source", length = 16)
    private PlanSource planSource;

    @Column(name = "plan_until")
    private LocalDateTime planUntil;

    @Column(name = "stripe_customer_id")
    private String stripeCustomerId;

    @Column(name = "stripe_subscription_id")
    private String stripeSubscriptionId;

    @Column(name = "subscription_status", length = 32)
    private String subscriptionStatus;

    @Column(name = "grace_until")
    private LocalDateTime graceUntil;

    @Enumerated(EnumType.STRING)
    @Column(name = "billing_cycle", length = 16)
    private BillingCycle billingCycle;

    @Column(name = "business_name")
    private String businessName;

    @Column(name = "trial_used")
    private boolean trialUsed;

    @Column(name = "daily_count")
    private int dailyCount;

    @Column(name = "daily_count_day")
    private LocalDate dailyCountDay;

    @Column(name = "seen_onboarding")
    private boolean seenOnboarding;

    @Column(name = "registered_at")
    private LocalDateTime registeredAt;

    @Column(name = "last_activity")
    private LocalDateTime lastActivity;

    /**
     * Usage counted for {@code today}; a counter stamped with another day is stale and reads as zero.
     */
    public int getDailyCountFor(LocalDate today) {
        return today.equals(dailyCountDay) ? dailyCount : 0;
    }
}
