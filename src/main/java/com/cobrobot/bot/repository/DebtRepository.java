package com.cobrobot.bot.repository;

import com.cobrobot.bot.model.Debt;
import com.cobrobot.bot.model.DebtStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface DebtRepository extends JpaRepository<Debt, Long> {

    List<Debt> findTop50ByOwnerPhoneAndStatusOrderByCreatedAtDesc(String ownerPhone, DebtStatus status);

    List<Debt> findByOwnerPhoneAndClientKeyAndStatusOrderByCreatedAtAsc(String ownerPhone, String clientKey, DebtStatus status);

    @Query("SELECT DISTINCT d.ownerPhone FROM Debt d WHERE d.status = com.cobrobot.bot.model.DebtStatus.PENDING")
    List<String> findOwnersWithPendingDebts();

    /**
     * Pending debts that were not part of a digest sent after {@code cooldownStart}, oldest first.
     */
    @Query("SELECT d FROM Debt d WHERE d.ownerPhone = :owner AND d.status = com.cobrobot.bot.model.DebtStatus.PENDING " +
            "AND NOT EXISTS (SELECT 1 FROM ReminderLog rl WHERE rl.ownerPhone = d.ownerPhone " +
            "AND rl.debtId = d.id AND rl.sentAt > :cooldownStart) ORDER BY d.createdAt ASC")
    List<Debt> findDigestCandidates(@Param("owner") String ownerPhone,
                                    @Param("cooldownStart") LocalDateTime cooldownStart);
}
