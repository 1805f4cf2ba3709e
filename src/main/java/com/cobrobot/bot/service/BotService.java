package com.cobrobot.bot.service;

import com.cobrobot.bot.constant.BotConstants;
import com.cobrobot.bot.dto.BotReply;
import com.cobrobot.bot.dto.InboundMessage;
import com.cobrobot.bot.model.Debt;
import com.cobrobot.bot.model.User;
import com.cobrobot.bot.model.intent.Intent;
import com.cobrobot.bot.model.intent.ResolvedIntent;
import com.cobrobot.bot.repository.UserRepository;
import com.cobrobot.bot.util.MessageUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.cobrobot.bot.constant.MessageTemplates.*;

/**
 * Inbound chat pipeline: admission, identity, onboarding, pending flow, intent, paywall, effect, reply.
 */
@Slf4j
@Service
public class BotService {

    private final InboundAdmissionService admissionService;
    private final UserRepository userRepository;
    private final ConversationService conversationService;
    private final IntentResolutionService intentResolutionService;
    private final PaywallService paywallService;
    private final DebtService debtService;
    private final PaymentService paymentService;
    private final SubscriptionService subscriptionService;
    private final Clock clock;

    @Autowired
    public BotService(InboundAdmissionService admissionService,
                      UserRepository userRepository,
                      ConversationService conversationService,
                      IntentResolutionService intentResolutionService,
                      PaywallService paywallService,
                      DebtService debtService,
                      PaymentService paymentService,
                      SubscriptionService subscriptionService,
                      Clock clock) {
        this.admissionService = admissionService;
        this.userRepository = userRepository;
        this.conversationService = conversationService;
        this.intentResolutionService = intentResolutionService;
        this.paywallService = paywallService;
        this.debtService = debtService;
        this.paymentService = paymentService;
        this.subscriptionService = subscriptionService;
        this.clock = clock;
    }

    @NotNull
    public BotReply handleMessage(@NotNull InboundMessage message) {
        String identity = message.getFrom();
        if (!StringUtils.hasText(identity)) {
            log.warn("Inbound message without sender ignored");
            return BotReply.silent();
        }
        String body = message.getBody() != null ? message.getBody().trim() : "";

        log.info("Incoming from {} (delivery {}): {} chars", identity, message.getDeliveryId(), body.length());

        switch (admissionService.admit(identity, message.getDeliveryId(), body)) {
            case DUPLICATE:
                return BotReply.silent();
            case THROTTLED:
                return BotReply.of(SLOW_DOWN);
            default:
                break;
        }

        try {
            userRepository.upsert(identity, LocalDateTime.now(clock));
            User user = userRepository.findByPhone(identity)
                    .orElseThrow(() -> new IllegalStateException("User vanished after upsert: " + identity));

            boolean firstContact = !user.isSeenOnboarding() && userRepository.markOnboarded(identity) > 0;
            BotReply reply = process(user, body);

            if (firstContact) {
                return BotReply.of(WELCOME_MESSAGE + (reply.isSilent() ? HELP_MESSAGE : reply.getText()));
            }
            return reply;
        } catch (RuntimeException e) {
            log.error("Error processing message from {}: {}", identity, e.getMessage(), e);
            return BotReply.of(ERROR_MESSAGE);
        }
    }

    private BotReply process(User user, String body) {
        ConversationService.Step step = conversationService.step(user, body);
        if (step.isHandled()) {
            return step.getReply();
        }

        ResolvedIntent resolved = intentResolutionService.resolve(body);
        Intent intent = resolved.getIntent();

        PaywallService.Gate gate = paywallService.gate(user, intent);
        if (gate.isBlocked()) {
            return BotReply.of(String.format(PAYWALL_MESSAGE, paywallService.getDailyLimit()));
        }

        BotReply reply = execute(user, intent);
        if (gate.isWarn() && !reply.isSilent()) {
            return BotReply.of(reply.getText() + String.format(LOW_BALANCE_WARNING, gate.getRemaining()));
        }
        return reply;
    }

    private BotReply execute(User user, Intent intent) {
        if (intent instanceof Intent.AddDebt addDebt) {
            return addDebt(user, addDebt);
        }
        if (intent instanceof Intent.Remind remind) {
            return remind(user, remind);
        }
        if (intent instanceof Intent.MarkPaid markPaid) {
            return debtService.markPaid(user.getPhone(), markPaid.getClientName())
                    .map(balance -> BotReply.of(String.format(DEBT_MARKED_PAID,
                            balance.getClientName(), MessageUtils.formatMoney(balance.getTotal()))))
                    .orElseGet(() -> BotReply.of(String.format(DEBT_NOT_FOUND, markPaid.getClientName())));
        }
        if (intent instanceof Intent.SavePhone savePhone) {
            debtService.savePhone(user.getPhone(), savePhone.getClientName(), savePhone.getPhone());
            return BotReply.of(String.format(PHONE_SAVED, savePhone.getClientName(), savePhone.getPhone()));
        }

        return switch (intent.getType()) {
            case LIST_DEBTS -> listDebts(user);
            case PRIORITIZE -> prioritize(user);
            case PRICING -> BotReply.of(String.format(PRICING_MESSAGE,
                    paywallService.getDailyLimit(),
                    MessageUtils.formatMoney(BigDecimal.valueOf(BotConstants.MONTHLY_PRICE_MXN)),
                    MessageUtils.formatMoney(BigDecimal.valueOf(BotConstants.YEARLY_PRICE_MXN)),
                    subscriptionService.getTrialDays()));
            case WANT_PRO -> conversationService.startTrialSignup(user);
            case PAY -> paymentService.createCheckout(user);
            case HELP -> BotReply.of(HELP_MESSAGE);
            case SUPPORT -> conversationService.startSupport(user);
            case CANCEL -> BotReply.of(NOTHING_TO_CANCEL);
            default -> BotReply.of(FALLBACK_MESSAGE);
        };
    }

    private BotReply addDebt(User user, Intent.AddDebt intent) {
        if (intent.getAmount() == null) {
            return BotReply.of(AMOUNT_MISSING);
        }
        Debt debt = debtService.addDebt(user.getPhone(), intent.getClientName(), intent.getAmount(), intent.getSinceText());
        String since = debt.getDueText() != null ? "• Desde: " + debt.getDueText() + "\n" : "";
        return BotReply.of(String.format(DEBT_REGISTERED,
                debt.getClientName(), MessageUtils.formatMoney(debt.getAmountDue()), since));
    }

    private BotReply listDebts(User user) {
        List<Debt> debts = debtService.listPending(user.getPhone());
        if (debts.isEmpty()) {
            return BotReply.of(NO_DEBTS);
        }

        StringBuilder sb = new StringBuilder(DEBTS_HEADER);
        int i = 1;
        for (Debt debt : debts) {
            sb.append(i++).append(") ").append(debt.getClientName()).append(": ")
                    .append(MessageUtils.formatMoney(debt.getAmountDue()));
            if (debt.getDueText() != null) {
                sb.append(" (desde ").append(debt.getDueText()).append(")");
            }
            sb.append("\n");
        }
        return BotReply.of(sb.toString().trim());
    }

    private BotReply prioritize(User user) {
        return debtService.topPriority(user.getPhone())
                .map(top -> BotReply.of(String.format(PRIORITIZE_REPLY,
                        top.getClientName(),
                        MessageUtils.formatMoney(top.getAmountDue()),
                        top.getDueText() != null ? " (desde " + top.getDueText() + ")" : "")))
                .orElseGet(() -> BotReply.of(NO_DEBTS));
    }

    private BotReply remind(User user, Intent.Remind intent) {
        Optional<DebtService.Balance> balance = debtService.pendingBalance(user.getPhone(), intent.getClientName());
        if (balance.isEmpty()) {
            return BotReply.of(String.format(DEBT_NOT_FOUND, intent.getClientName()));
        }

        String clientName = balance.get().getClientName();
        Optional<String> phone = debtService.findClientPhone(user.getPhone(), clientName);
        if (phone.isEmpty() || !StringUtils.hasText(phone.get())) {
            return BotReply.of(String.format(PHONE_MISSING, clientName, clientName));
        }

        return conversationService.startReminder(user, clientName, phone.get(), balance.get().getTotal(),
                intent.getTone(), intent.getRemindWhen());
    }
}
