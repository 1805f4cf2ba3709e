package com.cobrobot.bot.service;

import com.cobrobot.bot.constant.BotConstants;
import com.cobrobot.bot.exception.MessageDeliveryException;
import com.cobrobot.bot.model.Debt;
import com.cobrobot.bot.model.ReminderLog;
import com.cobrobot.bot.repository.DebtRepository;
import com.cobrobot.bot.repository.ReminderLogRepository;
import com.cobrobot.bot.util.MessageUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static com.cobrobot.bot.constant.MessageTemplates.*;

/**
 * Daily summary of pending debts sent to each owner. A debt included in a digest is skipped by the following
 * ones until the cooldown passes.
 */
@Component
public class CollectionDigestScheduler {

    private static final Logger log = LoggerFactory.getLogger(CollectionDigestScheduler.class);

    private final DebtRepository debtRepository;
    private final ReminderLogRepository reminderLogRepository;
    private final MessageTransport messageTransport;
    private final Clock clock;

    @Value("${app.digest.cooldown-hours:20}")
    private int cooldownHours;

    @Value("${app.digest.max-items:5}")
    private int maxItems;

    @Value("${app.digest.min-amount:50}")
    private BigDecimal minAmount;

    @Autowired
    public CollectionDigestScheduler(DebtRepository debtRepository,
                                     ReminderLogRepository reminderLogRepository,
                                     MessageTransport messageTransport,
                                     Clock clock) {
        this.debtRepository = debtRepository;
        this.reminderLogRepository = reminderLogRepository;
        this.messageTransport = messageTransport;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.digest.cron:0 0 9 * * *}", zone = "${app.zone:America/Mexico_City}")
    public void sendDailyDigests() {
        log.info("Starting daily collection digest");
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cooldownStart = now.minusHours(cooldownHours);

        int sent = 0;
        for (String owner : debtRepository.findOwnersWithPendingDebts()) {
            try {
                if (sendDigest(owner, cooldownStart, now)) {
                    sent++;
                }
            } catch (MessageDeliveryException e) {
                log.error("Digest for {} could not be delivered: {}", owner, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Digest for {} failed: {}", owner, e.getMessage(), e);
            }
        }
        log.info("Daily collection digest done, {} message(s) sent", sent);
    }

    boolean sendDigest(String owner, LocalDateTime cooldownStart, LocalDateTime now) throws MessageDeliveryException {
        List<Debt> candidates = debtRepository.findDigestCandidates(owner, cooldownStart);
        if (candidates.isEmpty()) {
            return false;
        }

        List<Debt> included = selectDebts(candidates);
        messageTransport.send(owner, buildDigest(included, visibleCount(candidates)));

        reminderLogRepository.saveAll(included.stream()
                .map(debt -> ReminderLog.builder()
                        .ownerPhone(owner)
                        .debtId(debt.getId())
                        .sentAt(now)
                        .build())
                .collect(Collectors.toList()));
        return true;
    }

    /**
     * Small amounts are hidden unless nothing else remains; at most {@code maxItems}, oldest first.
     */
    @NotNull
    List<Debt> selectDebts(@NotNull List<Debt> candidates) {
        return visible(candidates).stream().limit(maxItems).collect(Collectors.toList());
    }

    @NotNull
    String buildDigest(@NotNull List<Debt> included, int visibleCount) {
        StringBuilder msg = new StringBuilder(DIGEST_HEADER);
        BigDecimal total = BigDecimal.ZERO;

        for (Debt debt : included) {
            String name = debt.getClientName() != null && !debt.getClientName().isBlank()
                    && !BotConstants.DEFAULT_CLIENT_NAME.equals(debt.getClientName())
                    ? debt.getClientName()
                    : DIGEST_UNNAMED_CLIENT;
            String since = debt.getDueText() != null ? " (desde: " + debt.getDueText() + ")" : "";
            msg.append(String.format(DIGEST_ITEM, name, MessageUtils.formatMoney(debt.getAmountDue()), since));
            total = total.add(debt.getAmountDue());
        }

        if (visibleCount > included.size()) {
            msg.append(String.format(DIGEST_MORE, visibleCount - included.size()));
        }

        msg.append(String.format(DIGEST_TOTAL, MessageUtils.formatMoney(total)));
        msg.append(DIGEST_FOOTER);
        return msg.toString();
    }

    private int visibleCount(List<Debt> candidates) {
        return visible(candidates).size();
    }

    private List<Debt> visible(List<Debt> candidates) {
        List<Debt> large = candidates.stream()
                .filter(debt -> debt.getAmountDue().compareTo(minAmount) >= 0)
                .collect(Collectors.toList());
        return large.isEmpty() ? candidates : large;
    }
}
