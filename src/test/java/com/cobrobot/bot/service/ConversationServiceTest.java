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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static com.cobrobot.bot.constant.MessageTemplates.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ConversationServiceTest {

    private static final String PHONE = "whatsapp:+5215511111111";

    @Mock
    private UserRepository userRepository;

    @Mock
    private SupportTicketRepository supportTicketRepository;

    @Mock
    private IntentResolutionService intentResolutionService;

    @Mock
    private SubscriptionService subscriptionService;

    @Mock
    private MessageTransport messageTransport;

    @Mock
    private ReminderService reminderService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConversationService service;

    @BeforeEach
    void setUp() {
        service = new ConversationService(userRepository, supportTicketRepository, intentResolutionService,
                subscriptionService, messageTransport, reminderService, objectMapper, MutableClock.at("2026-10-17T15:00:00Z"));
        when(userRepository.transitionFlow(anyString(), any(), any(), any())).thenReturn(1);
        when(userRepository.startFlow(anyString(), any(), any())).thenReturn(1);
        when(subscriptionService.getTrialDays()).thenReturn(7);
    }

    private User pending(PendingAction action, PendingPayload payload) throws Exception {
        return User.builder()
                .phone(PHONE)
                .pendingAction(action)
                .pendingPayload(payload != null ? objectMapper.writeValueAsString(payload) : null)
                .build();
    }

    private PendingPayload reminderPayload() {
        return PendingPayload.builder()
                .clientName("Juan")
                .clientPhone("5512345678")
                .amountDue(new BigDecimal("8500"))
                .build();
    }

    @Test
    @DisplayName("Idle users fall through to intent resolution")
    void idleFallsThrough() {
        ConversationService.Step step = service.step(User.builder().phone(PHONE).build(), "hola");

        assertThat(step.isHandled()).isFalse();
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("Cancel words end any flow")
    void cancel() throws Exception {
        ConversationService.Step step = service.step(pending(PendingAction.ASK_CYCLE, null), "Cancelar");

        assertThat(step.getReply().getText()).isEqualTo(FLOW_CANCELLED);
        verify(userRepository).transitionFlow(PHONE, PendingAction.ASK_CYCLE, null, null);
    }

    @Nested
    @DisplayName("reminder flow")
    class Reminder {

        @Test
        @DisplayName("Choosing a tone moves to confirmation with a draft")
        void chooseTone() throws Exception {
            ConversationService.Step step = service.step(pending(PendingAction.CHOOSE_TONE, reminderPayload()), "2");

            String draft = DebtService.draftReminder(Tone.FIRM, "Juan", new BigDecimal("8500"));
            assertThat(step.getReply().getText()).isEqualTo(String.format(CONFIRM_SEND, "Juan", draft));

            ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
            verify(userRepository).transitionFlow(eq(PHONE), eq(PendingAction.CHOOSE_TONE),
                    eq(PendingAction.CONFIRM_SEND), payload.capture());
            PendingPayload next = objectMapper.readValue(payload.getValue(), PendingPayload.class);
            assertThat(next.getTone()).isEqualTo(Tone.FIRM);
            assertThat(next.getDraft()).isEqualTo(draft);
        }

        @Test
        @DisplayName("Confirming sends the draft to the client's WhatsApp")
        void confirmSends() throws Exception {
            PendingPayload payload = reminderPayload().toBuilder().tone(Tone.FRIENDLY).draft("Hola Juan").build();

            ConversationService.Step step = service.step(pending(PendingAction.CONFIRM_SEND, payload), "Sí");

            assertThat(step.getReply().getText()).isEqualTo(String.format(REMINDER_SENT, "Juan"));
            verify(messageTransport).send("whatsapp:+525512345678", "Hola Juan");
        }

        @Test
        @DisplayName("A concurrent copy that loses the swap sends nothing and stays silent")
        void lostSwapIsSilent() throws Exception {
            when(userRepository.transitionFlow(anyString(), any(), any(), any())).thenReturn(0);
            PendingPayload payload = reminderPayload().toBuilder().tone(Tone.FRIENDLY).draft("Hola Juan").build();

            ConversationService.Step step = service.step(pending(PendingAction.CONFIRM_SEND, payload), "si");

            assertThat(step.isHandled()).isTrue();
            assertThat(step.getReply().isSilent()).isTrue();
            verifyNoInteractions(messageTransport);
        }

        @Test
        @DisplayName("Delivery failure is reported to the owner")
        void deliveryFailure() throws Exception {
            doThrow(new MessageDeliveryException("twilio down")).when(messageTransport).send(anyString(), anyString());
            PendingPayload payload = reminderPayload().toBuilder().tone(Tone.FRIENDLY).draft("Hola Juan").build();

            ConversationService.Step step = service.step(pending(PendingAction.CONFIRM_SEND, payload), "enviar");

            assertThat(step.getReply().getText()).isEqualTo(String.format(REMINDER_SEND_FAILED, "Juan"));
        }

        @Test
        @DisplayName("'no' discards the draft")
        void reject() throws Exception {
            ConversationService.Step step = service.step(pending(PendingAction.CONFIRM_SEND, reminderPayload()), "no");

            assertThat(step.getReply().getText()).isEqualTo(REMINDER_DISCARDED);
            verifyNoInteractions(messageTransport);
        }

        @Test
        @DisplayName("A new command while choosing a tone leaves the flow and falls through")
        void commandAbortsFlow() throws Exception {
            when(intentResolutionService.isCommand("¿Quién me debe?")).thenReturn(true);

            ConversationService.Step step = service.step(pending(PendingAction.CHOOSE_TONE, reminderPayload()),
                    "¿Quién me debe?");

            assertThat(step.isHandled()).isFalse();
            verify(userRepository).transitionFlow(PHONE, PendingAction.CHOOSE_TONE, null, null);
        }

        @Test
        @DisplayName("An unrecognized answer repeats the question")
        void reprompt() throws Exception {
            ConversationService.Step step = service.step(pending(PendingAction.CHOOSE_TONE, reminderPayload()), "mmm");

            assertThat(step.getReply().getText()).isEqualTo(String.format(CHOOSE_TONE, "Juan"));
            verify(userRepository, never()).transitionFlow(anyString(), any(), any(), any());
        }

        @Test
        @DisplayName("A given tone skips straight to confirmation")
        void startWithTone() {
            BotReply reply = service.startReminder(User.builder().phone(PHONE).build(), "Juan", "5512345678",
                    new BigDecimal("100"), Tone.FORMAL, null);

            assertThat(reply.getText()).contains("Estimado(a) Juan");
            verify(userRepository).startFlow(eq(PHONE), eq(PendingAction.CONFIRM_SEND), anyString());
        }

        @Test
        @DisplayName("A reminder asked for later is confirmed with its time and scheduled instead of sent")
        void scheduledReminder() throws Exception {
            LocalDateTime tomorrow = LocalDateTime.of(2026, 10, 18, 9, 0);
            when(reminderService.resolveWhen("manana")).thenReturn(tomorrow);

            BotReply prompt = service.startReminder(User.builder().phone(PHONE).build(), "Juan", "5512345678",
                    new BigDecimal("8500"), Tone.FRIENDLY, "manana");

            String draft = DebtService.draftReminder(Tone.FRIENDLY, "Juan", new BigDecimal("8500"));
            assertThat(prompt.getText()).isEqualTo(String.format(CONFIRM_SCHEDULE, "Juan", draft, "18/10 a las 09:00"));
            ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);
            verify(userRepository).startFlow(eq(PHONE), eq(PendingAction.CONFIRM_SEND), stored.capture());
            PendingPayload payload = objectMapper.readValue(stored.getValue(), PendingPayload.class);
            assertThat(payload.getRemindAt()).isEqualTo("2026-10-18T09:00");

            ConversationService.Step step = service.step(pending(PendingAction.CONFIRM_SEND, payload), "si");

            assertThat(step.getReply().getText()).isEqualTo(String.format(REMINDER_SCHEDULED, "Juan", "18/10 a las 09:00"));
            verify(reminderService).schedule(PHONE, "5512345678", "Juan", new BigDecimal("8500"), tomorrow, draft);
            verifyNoInteractions(messageTransport);
        }

        @Test
        @DisplayName("A tone chosen for a scheduled reminder keeps its time")
        void chooseToneKeepsTime() throws Exception {
            PendingPayload payload = reminderPayload().toBuilder().remindAt("2026-10-20T09:00").build();

            ConversationService.Step step = service.step(pending(PendingAction.CHOOSE_TONE, payload), "amable");

            String draft = DebtService.draftReminder(Tone.FRIENDLY, "Juan", new BigDecimal("8500"));
            assertThat(step.getReply().getText()).isEqualTo(String.format(CONFIRM_SCHEDULE, "Juan", draft, "20/10 a las 09:00"));
        }

        @Test
        @DisplayName("A flow cannot start over another pending one")
        void startBlockedByPendingFlow() {
            when(userRepository.startFlow(anyString(), any(), any())).thenReturn(0);

            BotReply reply = service.startReminder(User.builder().phone(PHONE).build(), "Juan", "5512345678",
                    new BigDecimal("100"), null, null);

            assertThat(reply.isSilent()).isTrue();
        }
    }

    @Nested
    @DisplayName("trial signup")
    class TrialSignup {

        @Test
        @DisplayName("Name then cycle activates the trial")
        void nameThenCycle() throws Exception {
            ConversationService.Step askName = service.step(pending(PendingAction.ASK_NAME, null), "Tacos Don Juan");
            assertThat(askName.getReply().getText()).isEqualTo(ASK_CYCLE);

            PendingPayload withName = PendingPayload.builder().businessName("Tacos Don Juan").build();
            when(subscriptionService.activateTrial(PHONE, "Tacos Don Juan", BillingCycle.YEARLY)).thenReturn(true);

            ConversationService.Step askCycle = service.step(pending(PendingAction.ASK_CYCLE, withName), "Anual");

            assertThat(askCycle.getReply().getText())
                    .isEqualTo(String.format(TRIAL_ACTIVATED, "Tacos Don Juan", 7, "anual"));
        }

        @Test
        @DisplayName("Used trial is refused before the flow starts")
        void trialUsed() {
            BotReply reply = service.startTrialSignup(User.builder().phone(PHONE).trialUsed(true).build());

            assertThat(reply.getText()).isEqualTo(TRIAL_ALREADY_USED);
            verify(userRepository, never()).startFlow(anyString(), any(), any());
        }

        @Test
        @DisplayName("Cycle replies accept numbers and words")
        void cycleReplies() {
            assertThat(ConversationService.parseCycleReply("1")).isEqualTo(BillingCycle.MONTHLY);
            assertThat(ConversationService.parseCycleReply("ano")).isEqualTo(BillingCycle.YEARLY);
            assertThat(ConversationService.parseCycleReply("quiza")).isNull();
        }
    }

    @Test
    @DisplayName("Support text becomes a ticket")
    void supportTicket() throws Exception {
        when(supportTicketRepository.save(any(SupportTicket.class))).thenAnswer(invocation -> {
            SupportTicket ticket = invocation.getArgument(0);
            ticket.setId(42L);
            return ticket;
        });

        ConversationService.Step step = service.step(pending(PendingAction.SUPPORT_COLLECT, null),
                "No me llegan los recordatorios");

        assertThat(step.getReply().getText()).isEqualTo(String.format(SUPPORT_CREATED, 42L));
    }
}
