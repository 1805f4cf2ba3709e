package com.cobrobot.bot.service;

import com.cobrobot.bot.model.Client;
import com.cobrobot.bot.model.Debt;
import com.cobrobot.bot.model.DebtStatus;
import com.cobrobot.bot.model.Tone;
import com.cobrobot.bot.repository.ClientRepository;
import com.cobrobot.bot.repository.DebtRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DebtServiceTest {

    private static final String OWNER = "whatsapp:+5215511111111";
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 17, 9, 0);

    @Mock
    private DebtRepository debtRepository;

    @Mock
    private ClientRepository clientRepository;

    private DebtService service;

    @BeforeEach
    void setUp() {
        service = new DebtService(debtRepository, clientRepository, MutableClock.at("2026-10-17T15:00:00Z"));
        when(debtRepository.save(any(Debt.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(clientRepository.save(any(Client.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private Debt debt(String name, String amount, LocalDateTime createdAt) {
        return Debt.builder().ownerPhone(OWNER).clientName(name).clientKey(name.toLowerCase())
                .amountDue(new BigDecimal(amount)).createdAt(createdAt).build();
    }

    @Test
    @DisplayName("New debts store a normalized lookup key")
    void addDebtKey() {
        Debt debt = service.addDebt(OWNER, "María José", new BigDecimal("700"), "ayer");

        assertThat(debt.getClientKey()).isEqualTo("maria jose");
        assertThat(debt.getStatus()).isEqualTo(DebtStatus.PENDING);
        assertThat(debt.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Priority is the largest amount, then the oldest")
    void topPriority() {
        when(debtRepository.findTop50ByOwnerPhoneAndStatusOrderByCreatedAtDesc(OWNER, DebtStatus.PENDING)).thenReturn(List.of(
                debt("Ana", "300", NOW.minusDays(1)),
                debt("Luis", "900", NOW.minusDays(2)),
                debt("Juan", "900", NOW.minusDays(5))));

        assertThat(service.topPriority(OWNER)).map(Debt::getClientName).contains("Juan");
    }

    @Test
    @DisplayName("Marking paid settles every pending debt of the client, accents ignored")
    void markPaid() {
        List<Debt> pending = List.of(debt("María", "200", NOW.minusDays(3)), debt("María", "300", NOW.minusDays(1)));
        when(debtRepository.findByOwnerPhoneAndClientKeyAndStatusOrderByCreatedAtAsc(OWNER, "maria", DebtStatus.PENDING))
                .thenReturn(pending);

        Optional<DebtService.Balance> balance = service.markPaid(OWNER, "Maria");

        assertThat(balance).isPresent();
        assertThat(balance.get().getTotal()).isEqualByComparingTo("500");
        assertThat(pending).allMatch(d -> d.getStatus() == DebtStatus.PAID && NOW.equals(d.getPaidAt()));
    }

    @Test
    @DisplayName("Saving a phone updates the existing client")
    void savePhoneUpserts() {
        Client existing = Client.builder().ownerPhone(OWNER).name("Juan").nameKey("juan").phone("111").build();
        when(clientRepository.findByOwnerPhoneAndNameKey(OWNER, "juan")).thenReturn(Optional.of(existing));

        service.savePhone(OWNER, "JUAN", "5512345678");

        ArgumentCaptor<Client> saved = ArgumentCaptor.forClass(Client.class);
        verify(clientRepository).save(saved.capture());
        assertThat(saved.getValue()).isSameAs(existing);
        assertThat(saved.getValue().getPhone()).isEqualTo("5512345678");
    }

    @Test
    void draftsUseTheChosenTone() {
        assertThat(DebtService.draftReminder(Tone.FIRM, "Juan", new BigDecimal("8500")))
                .startsWith("Hola Juan. Tienes un saldo pendiente de");
    }
}
