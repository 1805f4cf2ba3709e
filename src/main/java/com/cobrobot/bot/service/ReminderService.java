package com.cobrobot.bot.service;

import com.cobrobot.bot.exception.MessageDeliveryException;
import com.cobrobot.bot.model.Reminder;
import com.cobrobot.bot.model.ReminderStatus;
import com.cobrobot.bot.repository.ReminderRepository;
import com.cobrobot.bot.util.MessageUtils;
import com.cobrobot.bot.util.ReminderTimeParser;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Reminders confirmed for a later time. A due reminder is claimed (PENDING to SENDING) before it is sent,
 * so overlapping dispatch runs deliver it once; the outcome is recorded as SENT or FAILED.
 */
@Slf4j
@Service
public class ReminderService {

    private final ReminderRepository reminderRepository;
    private final MessageTransport messageTransport;
    private final Clock clock;
    private final LocalTime sendAt;
    private final int batchSize;

    @Autowired
    public ReminderService(ReminderRepository reminderRepository,
                           MessageTransport messageTransport,
                           Clock clock,
                           @Value("${app.reminders.send-hour:9}") int sendHour,
                           @Value("${app.reminders.batch-size:50}") int batchSize) {
        this.reminderRepository = reminderRepository;
        this.messageTransport = messageTransport;
        this.clock = clock;
        this.sendAt = LocalTime.of(sendHour, 0);
        this.batchSize = batchSize;
    }

    /**
     * @return when a reminder asked for with {@code whenText} should go out, or null to send it now
     */
    @Nullable
    public LocalDateTime resolveWhen(@Nullable String whenText) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime remindAt = ReminderTimeParser.resolve(whenText, now, sendAt);
        return remindAt != null && remindAt.isAfter(now) ? remindAt : null;
    }

    @NotNull
    public Reminder schedule(@NotNull String ownerPhone, @NotNull String clientPhone, @Nullable String clientName,
                             @Nullable BigDecimal amountDue, @NotNull LocalDateTime remindAt, @NotNull String message) {
        Reminder reminder = reminderRepository.save(Reminder.builder()
                .ownerPhone(ownerPhone)
                .toPhone(clientPhone)
                .clientName(clientName)
                .amountDue(amountDue)
                .remindAt(remindAt)
                .message(message)
                .status(ReminderStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("Reminder #{} from {} to {} scheduled for {}", reminder.getId(), ownerPhone, clientName, remindAt);
        return reminder;
    }

    @Scheduled(fixedDelayString = "${app.reminders.dispatch-interval-ms:60000}")
    public void dispatchDueReminders() {
        List<Reminder> due;
        try {
            due = reminderRepository.findDue(LocalDateTime.now(clock), PageRequest.of(0, batchSize));
        } catch (DataAccessException e) {
            log.error("Could not load due reminders: {}", e.getMessage());
            return;
        }

        int sent = 0;
        for (Reminder reminder : due) {
            if (dispatch(reminder)) {
                sent++;
            }
        }
        if (!due.isEmpty()) {
            log.info("Reminder dispatch done: {} of {} due reminder(s) sent", sent, due.size());
        }
    }

    boolean dispatch(@NotNull Reminder reminder) {
        if (reminderRepository.updateStatus(reminder.getId(), ReminderStatus.PENDING, ReminderStatus.SENDING, null) == 0) {
            log.debug("Reminder #{} already taken", reminder.getId());
            return false;
        }

        try {
            messageTransport.send(MessageUtils.toWhatsAppAddress(reminder.getToPhone()), reminder.getMessage());
        } catch (MessageDeliveryException e) {
            log.warn("Reminder #{} to {} failed: {}", reminder.getId(), reminder.getClientName(), e.getMessage());
            reminderRepository.updateStatus(reminder.getId(), ReminderStatus.SENDING, ReminderStatus.FAILED, null);
            return false;
        }

        reminderRepository.updateStatus(reminder.getId(), ReminderStatus.SENDING, ReminderStatus.SENT,
                LocalDateTime.now(clock));
        log.info("Reminder #{} from {} sent to {}", reminder.getId(), reminder.getOwnerPhone(), reminder.getClientName());
        return true;
    }
}
