package com.cobrobot.bot.service;

import com.cobrobot.bot.constant.BotConstants;
import com.cobrobot.bot.model.Client;
import com.cobrobot.bot.model.Debt;
import com.cobrobot.bot.model.DebtStatus;
import com.cobrobot.bot.model.Tone;
import com.cobrobot.bot.repository.ClientRepository;
import com.cobrobot.bot.repository.DebtRepository;
import com.cobrobot.bot.util.MessageUtils;
import com.cobrobot.bot.util.TextNormalizer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.cobrobot.bot.constant.MessageTemplates.*;

@Slf4j
@Service
public class DebtService {

    private final DebtRepository debtRepository;
    private final ClientRepository clientRepository;
    private final Clock clock;

    @Autowired
    public DebtService(DebtRepository debtRepository, ClientRepository clientRepository, Clock clock) {
        this.debtRepository = debtRepository;
        this.clientRepository = clientRepository;
        this.clock = clock;
    }

    /**
     * What one client owes in total, under the name the debt was first registered with.
     */
    @Value
    public static class Balance {
        String clientName;
        BigDecimal total;
    }

    @Transactional
    public Debt addDebt(@NotNull String ownerPhone, @NotNull String clientName, @NotNull BigDecimal amount,
                        @Nullable String sinceText) {
        String name = clientName.isBlank() ? BotConstants.DEFAULT_CLIENT_NAME : clientName.trim();
        Debt debt = Debt.builder()
                .ownerPhone(ownerPhone)
                .clientName(name)
                .clientKey(TextNormalizer.normalize(name))
                .amountDue(amount)
                .dueText(sinceText)
                .createdAt(LocalDateTime.now(clock))
                .build();

        Debt saved = debtRepository.save(debt);
        log.info("Debt {} registered for {}: {} {}", saved.getId(), ownerPhone, name, amount);
        return saved;
    }

    public List<Debt> listPending(@NotNull String ownerPhone) {
        return debtRepository.findTop50ByOwnerPhoneAndStatusOrderByCreatedAtDesc(ownerPhone, DebtStatus.PENDING);
    }

    /**
     * Largest amount first; between equal amounts the older debt wins.
     */
    public Optional<Debt> topPriority(@NotNull String ownerPhone) {
        return listPending(ownerPhone).stream()
                .min(Comparator.comparing(Debt::getAmountDue, Comparator.reverseOrder())
                        .thenComparing(Debt::getCreatedAt));
    }

    public Optional<Balance> pendingBalance(@NotNull String ownerPhone, @NotNull String clientName) {
        List<Debt> debts = findPendingOf(ownerPhone, clientName);
        if (debts.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal total = debts.stream().map(Debt::getAmountDue).reduce(BigDecimal.ZERO, BigDecimal::add);
        return Optional.of(new Balance(debts.get(0).getClientName(), total));
    }

    /**
     * Marks every pending debt of the client as paid.
     */
    @Transactional
    public Optional<Balance> markPaid(@NotNull String ownerPhone, @NotNull String clientName) {
        List<Debt> debts = findPendingOf(ownerPhone, clientName);
        if (debts.isEmpty()) {
            return Optional.empty();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        BigDecimal total = BigDecimal.ZERO;
        for (Debt debt : debts) {
            debt.setStatus(DebtStatus.PAID);
            debt.setPaidAt(now);
            total = total.add(debt.getAmountDue());
        }
        debtRepository.saveAll(debts);

        log.info("{} debt(s) of {} marked paid by {}", debts.size(), clientName, ownerPhone);
        return Optional.of(new Balance(debts.get(0).getClientName(), total));
    }

    @Transactional
    public Client savePhone(@NotNull String ownerPhone, @NotNull String clientName, @NotNull String phone) {
        String key = TextNormalizer.normalize(clientName);
        Client client = clientRepository.findByOwnerPhoneAndNameKey(ownerPhone, key)
                .orElseGet(() -> Client.builder()
                        .ownerPhone(ownerPhone)
                        .name(clientName.trim())
                        .nameKey(key)
                        .build());
        client.setPhone(phone);
        return clientRepository.save(client);
    }

    public Optional<String> findClientPhone(@NotNull String ownerPhone, @NotNull String clientName) {
        return clientRepository.findByOwnerPhoneAndNameKey(ownerPhone, TextNormalizer.normalize(clientName))
                .map(Client::getPhone);
    }

    @NotNull
    public static String draftReminder(@NotNull Tone tone, @NotNull String clientName, @Nullable BigDecimal amount) {
        String template = switch (tone) {
            case FRIENDLY -> TONE_FRIENDLY;
            case FIRM -> TONE_FIRM;
            case FORMAL -> TONE_FORMAL;
        };
        return String.format(template, clientName, MessageUtils.formatMoney(amount));
    }

    private List<Debt> findPendingOf(String ownerPhone, String clientName) {
        return debtRepository.findByOwnerPhoneAndClientKeyAndStatusOrderByCreatedAtAsc(
                ownerPhone, TextNormalizer.normalize(clientName), DebtStatus.PENDING);
    }
}
