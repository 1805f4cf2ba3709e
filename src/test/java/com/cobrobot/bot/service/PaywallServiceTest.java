package com.cobrobot.bot.service;

import com.cobrobot.bot.model.User;
import com.cobrobot.bot.model.intent.Intent;
import com.cobrobot.bot.repository.UserRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PaywallServiceTest {

    private static final String PHONE = "whatsapp:+5215511111111";
    private static final Intent ADD_DEBT = new Intent.AddDebt("Juan", new BigDecimal("500"), null);

    @Mock
    private UserRepository userRepository;

    @Mock
    private SubscriptionService subscriptionService;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private PaywallService paywall;
    private User user;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-10-17T15:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        paywall = new PaywallService(userRepository, subscriptionService, new PipelineMetrics(meterRegistry), clock, 15, 3);
        user = User.builder().phone(PHONE).build();

        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));
        // same semantics as the conditional UPDATE
        when(userRepository.consumeDailyQuota(eq(PHONE), any(LocalDate.class), anyInt())).thenAnswer(invocation -> {
            LocalDate today = invocation.getArgument(1);
            int limit = invocation.getArgument(2);
            if (!today.equals(user.getDailyCountDay())) {
                user.setDailyCountDay(today);
                user.setDailyCount(1);
                return 1;
            }
            if (user.getDailyCount() < limit) {
                user.setDailyCount(user.getDailyCount() + 1);
                return 1;
            }
            return 0;
        });
    }

    @Test
    @DisplayName("Fifteen billable actions pass, the warning fires once at three left, the sixteenth is blocked")
    void freeQuota() {
        List<PaywallService.Gate> gates = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            gates.add(paywall.gate(user, ADD_DEBT));
        }

        assertThat(gates.subList(0, 15)).noneMatch(PaywallService.Gate::isBlocked);
        assertThat(gates.get(15).isBlocked()).isTrue();
        assertThat(gates).filteredOn(PaywallService.Gate::isWarn).hasSize(1);
        assertThat(gates.get(11).isWarn()).isTrue();
        assertThat(gates.get(11).getRemaining()).isEqualTo(3);
        assertThat(gates.get(14).getRemaining()).isZero();

        assertThat(meterRegistry.counter("paywall.gate", "result", "blocked").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A new day starts a fresh quota")
    void newDayResets() {
        for (int i = 0; i < 16; i++) {
            paywall.gate(user, ADD_DEBT);
        }
        assertThat(paywall.gate(user, ADD_DEBT).isBlocked()).isTrue();

        clock.advance(Duration.ofDays(1));

        PaywallService.Gate gate = paywall.gate(user, ADD_DEBT);
        assertThat(gate.isBlocked()).isFalse();
        assertThat(gate.getRemaining()).isEqualTo(14);
    }

    @Test
    @DisplayName("Pro users are never metered")
    void proNeverBlocked() {
        when(subscriptionService.hasProAccess(eq(user), any())).thenReturn(true);

        for (int i = 0; i < 40; i++) {
            assertThat(paywall.gate(user, ADD_DEBT).isBlocked()).isFalse();
        }
        verify(userRepository, never()).consumeDailyQuota(anyString(), any(), anyInt());
    }

    @Test
    @DisplayName("Non-billable intents pass without touching the counter")
    void nonBillableUnmetered() {
        PaywallService.Gate gate = paywall.gate(user, Intent.LIST_DEBTS);

        assertThat(gate.isBlocked()).isFalse();
        assertThat(gate.getRemaining()).isEqualTo(-1);
        verifyNoInteractions(subscriptionService);
        verify(userRepository, never()).consumeDailyQuota(anyString(), any(), anyInt());
    }

    @Test
    @DisplayName("Prioritize and remind are billable")
    void billableIntents() {
        assertThat(paywall.gate(user, Intent.PRIORITIZE).getRemaining()).isEqualTo(14);
        assertThat(paywall.gate(user, new Intent.Remind("Juan", null, null)).getRemaining()).isEqualTo(13);
    }
}
