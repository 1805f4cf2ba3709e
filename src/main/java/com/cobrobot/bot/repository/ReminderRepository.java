package com.cobrobot.bot.repository;

import com.cobrobot.bot.model.Reminder;
import com.cobrobot.bot.model.ReminderStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ReminderRepository extends JpaRepository<Reminder, Long> {

    @Query("SELECT r FROM Reminder r WHERE r.status = com.cobrobot.bot.model.ReminderStatus.PENDING " +
            "AND r.remindAt <= :now ORDER BY r.remindAt ASC")
    List<Reminder> findDue(@Param("now") LocalDateTime now, Pageable page);

    /**
     * Moves a reminder from {@code expected} to {@code next}; 0 when another dispatcher got there first.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Reminder r SET r.status = :next, r.sentAt = :sentAt WHERE r.id = :id AND r.status = :expected")
    int updateStatus(@Param("id") Long id,
                     @Param("expected") ReminderStatus expected,
                     @Param("next") ReminderStatus next,
                     @Param("sentAt") LocalDateTime sentAt);
}
