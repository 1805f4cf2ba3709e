package com.cobrobot.bot.service;

import com.cobrobot.bot.dto.BotReply;
import com.cobrobot.bot.exception.MessageDeliveryException;
import com.cobrobot.bot.model.BillingCycle;
import com.cobrobot.bot.model.PendingAction;
import com.cobrobot.bot.model.PendingPayload;
import com.cobrobot.bot.model.SupportTicket;
import com.cobrobot.bot.model.Tone;
import com.cobrobot.bot.model.User;
import com.cobrobot.bot.repository.SupportTicketRepository;
import com.cobrobot.bot.repository.UserRepository;
import com.cobrobot.bot.util.MessageUtils;
import com.cobrobot.bot.util.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Set;

import static com.cobrobot.bot.constant.MessageTemplates.*;

/**
 * Multi-turn flows persisted on the user row. Every transition is a compare-and-swap on {@code pending_action};
 * a step that loses the swap was already handled by a concurrent copy of the same message and stays silent.
 * Terminal steps clear the state before running their side effect, so the effect runs at most once.
 */
@Slf4j
@Service
public class ConversationService {

    static final Set<String> CANCEL_WORDS = Set.of("cancelar", "cancela", "salir");
    static final Set<String> CONFIRM_WORDS = Set.of("si", "enviar", "ok", "dale", "va");
    static final Set<String> REJECT_WORDS = Set.of("no");

    private static final int MAX_BUSINESS_NAME = 120;

    private final UserRepository userRepository;
    private final SupportTicketRepository supportTicketRepository;
    private final IntentResolutionService intentResolutionService;
    private final SubscriptionService subscriptionService;
    private final MessageTransport messageTransport;
    private final ReminderService reminderService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public ConversationService(UserRepository userRepository,
                               SupportTicketRepository supportTicketRepository,
                               IntentResolutionService intentResolutionService,
                               SubscriptionService subscriptionService,
                               MessageTransport messageTransport,
                               ReminderService reminderService,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.userRepository = userRepository;
        this.supportTicketRepository = supportTicketRepository;
        this.intentResolutionService = intentResolutionService;
        this.subscriptionService = subscriptionService;
        this.messageTransport = messageTransport;
        this.reminderService = reminderService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Outcome of one message against the pending flow: either the flow answered it, or the message
     * continues to intent resolution.
     */
    public static final class Step {

        private static final Step FALL_THROUGH = new Step(null);

        private final BotReply reply;

        private Step(BotReply reply) {
            this.reply = reply;
        }

        public static Step handled(@NotNull BotReply reply) {
            return new Step(reply);
        }

        public static Step fallThrough() {
            return FALL_THROUGH;
        }

        public boolean isHandled() {
            return reply != null;
        }

        public BotReply getReply() {
            return reply;
        }
    }

    @NotNull
    public Step step(@NotNull User user, @Nullable String text) {
        PendingAction action = user.getPendingAction();
        if (action == null) {
            return Step.fallThrough();
        }

        String normalized = TextNormalizer.normalize(text);
        if (CANCEL_WORDS.contains(normalized)) {
            return finish(user, action, () -> BotReply.of(FLOW_CANCELLED));
        }

        PendingPayload payload = readPayload(user);
        return switch (action) {
            case CHOOSE_TONE -> chooseTone(user, payload, normalized, text);
            case CONFIRM_SEND -> confirmSend(user, payload, normalized, text);
            case ASK_NAME -> askName(user, payload, text);
            case ASK_CYCLE -> askCycle(user, payload, normalized, text);
            case SUPPORT_COLLECT -> collectSupport(user, text);
        };
    }

    // ----- flow entry points -----

    /**
     * Starts a reminder for a client with a known phone. Without a tone the user is asked for one first;
     * a readable {@code remindWhen} turns the final confirmation into scheduling instead of sending.
     */
    @NotNull
    public BotReply startReminder(@NotNull User user, @NotNull String clientName, @NotNull String clientPhone,
                                  @NotNull BigDecimal amount, @Nullable Tone tone, @Nullable String remindWhen) {
        LocalDateTime remindAt = reminderService.resolveWhen(remindWhen);
        PendingPayload payload = PendingPayload.builder()
                .clientName(clientName)
                .clientPhone(clientPhone)
                .amountDue(amount)
                .remindAt(remindAt != null ? remindAt.toString() : null)
                .build();

        if (tone == null) {
            return start(user, PendingAction.CHOOSE_TONE, payload, String.format(CHOOSE_TONE, clientName));
        }

        String draft = DebtService.draftReminder(tone, clientName, amount);
        PendingPayload withDraft = payload.toBuilder().tone(tone).draft(draft).build();
        return start(user, PendingAction.CONFIRM_SEND, withDraft, confirmPrompt(withDraft));
    }

    @NotNull
    public BotReply startTrialSignup(@NotNull User user) {
        if (subscriptionService.hasProAccess(user)) {
            return BotReply.of(ALREADY_PRO);
        }
        if (user.isTrialUsed()) {
            return BotReply.of(TRIAL_ALREADY_USED);
        }
        return start(user, PendingAction.ASK_NAME, null, ASK_BUSINESS_NAME);
    }

    @NotNull
    public BotReply startSupport(@NotNull User user) {
        return start(user, PendingAction.SUPPORT_COLLECT, null, SUPPORT_PROMPT);
    }

    private BotReply start(User user, PendingAction next, @Nullable PendingPayload payload, String prompt) {
        if (userRepository.startFlow(user.getPhone(), next, writePayload(payload)) == 0) {
            log.info("Could not start {} for {}: another flow is pending", next, user.getPhone());
            return BotReply.silent();
        }
        return BotReply.of(prompt);
    }

    // ----- states -----

    private Step chooseTone(User user, PendingPayload payload, String normalized, String text) {
        Tone tone = Tone.fromReply(normalized);
        if (tone == null) {
            return abortOrReprompt(user, PendingAction.CHOOSE_TONE, text,
                    String.format(CHOOSE_TONE, payload.getClientName()));
        }

        String draft = DebtService.draftReminder(tone, payload.getClientName(), payload.getAmountDue());
        PendingPayload next = payload.toBuilder().tone(tone).draft(draft).build();
        if (!transition(user, PendingAction.CHOOSE_TONE, PendingAction.CONFIRM_SEND, next)) {
            return Step.handled(BotReply.silent());
        }
        return Step.handled(BotReply.of(confirmPrompt(next)));
    }

    private Step confirmSend(User user, PendingPayload payload, String normalized, String text) {
        if (REJECT_WORDS.contains(normalized)) {
            return finish(user, PendingAction.CONFIRM_SEND, () -> BotReply.of(REMINDER_DISCARDED));
        }
        if (!CONFIRM_WORDS.contains(normalized)) {
            return abortOrReprompt(user, PendingAction.CONFIRM_SEND, text, CONFIRM_SEND_REPROMPT);
        }

        return finish(user, PendingAction.CONFIRM_SEND, () -> {
            String clientName = payload.getClientName();
            if (!StringUtils.hasText(payload.getClientPhone()) || !StringUtils.hasText(payload.getDraft())) {
                log.warn("Reminder payload of {} is incomplete: {}", user.getPhone(), payload);
                return BotReply.of(String.format(REMINDER_SEND_FAILED, clientName));
            }
            LocalDateTime remindAt = remindAt(payload);
            if (remindAt != null) {
                reminderService.schedule(user.getPhone(), payload.getClientPhone(), clientName,
                        payload.getAmountDue(), remindAt, payload.getDraft());
                return BotReply.of(String.format(REMINDER_SCHEDULED, clientName, MessageUtils.formatWhen(remindAt)));
            }
            try {
                messageTransport.send(MessageUtils.toWhatsAppAddress(payload.getClientPhone()), payload.getDraft());
                log.info("Reminder from {} sent to {}", user.getPhone(), clientName);
                return BotReply.of(String.format(REMINDER_SENT, clientName));
            } catch (MessageDeliveryException e) {
                log.warn("Reminder from {} to {} failed: {}", user.getPhone(), clientName, e.getMessage());
                return BotReply.of(String.format(REMINDER_SEND_FAILED, clientName));
            }
        });
    }

    private Step askName(User user, PendingPayload payload, String text) {
        if (!StringUtils.hasText(text)) {
            return Step.handled(BotReply.of(ASK_BUSINESS_NAME));
        }
        String name = text.trim();
        if (name.length() > MAX_BUSINESS_NAME) {
            name = name.substring(0, MAX_BUSINESS_NAME);
        }

        PendingPayload next = payload.toBuilder().businessName(name).build();
        if (!transition(user, PendingAction.ASK_NAME, PendingAction.ASK_CYCLE, next)) {
            return Step.handled(BotReply.silent());
        }
        return Step.handled(BotReply.of(ASK_CYCLE));
    }

    private Step askCycle(User user, PendingPayload payload, String normalized, String text) {
        BillingCycle cycle = parseCycleReply(normalized);
        if (cycle == null) {
            return abortOrReprompt(user, PendingAction.ASK_CYCLE, text, ASK_CYCLE);
        }

        return finish(user, PendingAction.ASK_CYCLE, () -> {
            String businessName = payload.getBusinessName();
            if (!subscriptionService.activateTrial(user.getPhone(), businessName, cycle)) {
                return BotReply.of(TRIAL_ALREADY_USED);
            }
            return BotReply.of(String.format(TRIAL_ACTIVATED,
                    businessName != null ? businessName : "", subscriptionService.getTrialDays(), cycle.getDisplayName()));
        });
    }

    private Step collectSupport(User user, String text) {
        if (!StringUtils.hasText(text)) {
            return Step.handled(BotReply.of(SUPPORT_PROMPT));
        }
        return finish(user, PendingAction.SUPPORT_COLLECT, () -> {
            SupportTicket ticket = supportTicketRepository.save(SupportTicket.builder()
                    .ownerPhone(user.getPhone())
                    .body(text.trim())
                    .createdAt(LocalDateTime.now(clock))
                    .build());
            log.info("Support ticket #{} opened by {}", ticket.getId(), user.getPhone());
            return BotReply.of(String.format(SUPPORT_CREATED, ticket.getId()));
        });
    }

    // ----- helpers -----

    /**
     * A reply the current state does not understand: a recognizable command leaves the flow and is resolved
     * as a fresh message, anything else repeats the question.
     */
    private Step abortOrReprompt(User user, PendingAction current, String text, String reprompt) {
        if (!intentResolutionService.isCommand(text)) {
            return Step.handled(BotReply.of(reprompt));
        }
        if (!transition(user, current, null, null)) {
            return Step.handled(BotReply.silent());
        }
        log.debug("{} left {} with a new command", user.getPhone(), current);
        return Step.fallThrough();
    }

    /**
     * Clears the state, then runs {@code effect} only if this call won the swap.
     */
    private Step finish(User user, PendingAction current, Effect effect) {
        if (!transition(user, current, null, null)) {
            return Step.handled(BotReply.silent());
        }
        return Step.handled(effect.run());
    }

    private boolean transition(User user, PendingAction expected, @Nullable PendingAction next,
                               @Nullable PendingPayload payload) {
        boolean swapped = userRepository.transitionFlow(user.getPhone(), expected, next, writePayload(payload)) > 0;
        if (!swapped) {
            log.info("Lost {} -> {} transition for {}", expected, next, user.getPhone());
        }
        return swapped;
    }

    private String confirmPrompt(PendingPayload payload) {
        LocalDateTime remindAt = remindAt(payload);
        if (remindAt != null) {
            return String.format(CONFIRM_SCHEDULE, payload.getClientName(), payload.getDraft(),
                    MessageUtils.formatWhen(remindAt));
        }
        return String.format(CONFIRM_SEND, payload.getClientName(), payload.getDraft());
    }

    @Nullable
    private static LocalDateTime remindAt(PendingPayload payload) {
        if (!StringUtils.hasText(payload.getRemindAt())) {
            return null;
        }
        try {
            return LocalDateTime.parse(payload.getRemindAt());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unreadable reminder time '{}'", payload.getRemindAt());
            return null;
        }
    }

    @Nullable
    static BillingCycle parseCycleReply(String normalized) {
        return switch (normalized) {
            case "1", "mensual", "mes" -> BillingCycle.MONTHLY;
            case "2", "anual", "ano" -> BillingCycle.YEARLY;
            default -> null;
        };
    }

    private PendingPayload readPayload(User user) {
        if (!StringUtils.hasText(user.getPendingPayload())) {
            return new PendingPayload();
        }
        try {
            return objectMapper.readValue(user.getPendingPayload(), PendingPayload.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable flow payload for {}: {}", user.getPhone(), e.getMessage());
            return new PendingPayload();
        }
    }

    @Nullable
    private String writePayload(@Nullable PendingPayload payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Flow payload is not serializable", e);
        }
    }

    @FunctionalInterface
    private interface Effect {
        BotReply run();
    }
}
