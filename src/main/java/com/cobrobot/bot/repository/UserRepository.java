package com.cobrobot.bot.repository;

import com.cobrobot.bot.model.PendingAction;
import com.cobrobot.bot.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, String> {

    Optional<User> findByPhone(String phone);

    Optional<User> findByStripeCustomerId(String stripeCustomerId);

    @Transactional
    @Modifying
    @Query(value = "INSERT INTO users (phone, plan, trial_used, daily_count, seen_onboarding, registered_at, last_activity) " +
            "VALUES (:phone, 'FREE', false, 0, false, :now, :now) " +
            "ON CONFLICT (phone) DO UPDATE SET last_activity = :now", nativeQuery = true)
    int upsert(@Param("phone") String phone, @Param("now") LocalDateTime now);

    /**
     * Idle -> {@code next}; only succeeds while no other flow is pending.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.pendingAction = :next, u.pendingPayload = :payload " +
            "WHERE u.phone = :phone AND u.pendingAction IS NULL")
    int startFlow(@Param("phone") String phone,
                  @Param("next") PendingAction next,
                  @Param("payload") String payload);

    /**
     * Compare-and-swap between two pending states; {@code next} null returns the user to idle.
     * Action and payload always move together.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.pendingAction = :next, u.pendingPayload = :payload " +
            "WHERE u.phone = :phone AND u.pendingAction = :expected")
    int transitionFlow(@Param("phone") String phone,
                       @Param("expected") PendingAction expected,
                       @Param("next") PendingAction next,
                       @Param("payload") String payload);

    /**
     * Counts one billable action for {@code today}, rolling a stale day back to 1, unless the day's
     * counter already reached {@code limit}. Returns 0 when the quota is exhausted.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET " +
            "u.dailyCount = CASE WHEN u.dailyCountDay = :today THEN u.dailyCount + 1 ELSE 1 END, " +
            "u.dailyCountDay = :today " +
            "WHERE u.phone = :phone AND (u.dailyCountDay IS NULL OR u.dailyCountDay <> :today OR u.dailyCount < :limit)")
    int consumeDailyQuota(@Param("phone") String phone,
                          @Param("today") LocalDate today,
                          @Param("limit") int limit);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.seenOnboarding = true WHERE u.phone = :phone AND u.seenOnboarding = false")
    int markOnboarded(@Param("phone") String phone);
}
