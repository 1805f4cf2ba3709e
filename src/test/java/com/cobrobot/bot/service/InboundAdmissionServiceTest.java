package com.cobrobot.bot.service;

import com.cobrobot.bot.repository.InboundDedupRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

import static com.cobrobot.bot.service.InboundAdmissionService.Admission.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InboundAdmissionServiceTest {

    private static final String FROM = "whatsapp:+5215511111111";

    @Mock
    private InboundDedupRepository dedupRepository;

    private final Map<String, LocalDateTime> claims = new HashMap<>();
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private InboundAdmissionService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-10-17T15:00:00Z");
        meterRegistry = new SimpleMeterRegistry();

        // behaves like the ON CONFLICT upsert: a key can be claimed when free or expired
        when(dedupRepository.claim(anyString(), any(LocalDateTime.class), any(LocalDateTime.class)))
                .thenAnswer(invocation -> {
                    String key = invocation.getArgument(0);
                    LocalDateTime now = invocation.getArgument(1);
                    LocalDateTime existing = claims.get(key);
                    if (existing != null && existing.isAfter(now)) {
                        return 0;
                    }
                    claims.put(key, invocation.getArgument(2));
                    return 1;
                });

        service = newService(10);
    }

    private InboundAdmissionService newService(int maxEvents) {
        return new InboundAdmissionService(dedupRepository,
                new LocalDedupCache(clock),
                new SlidingWindowRateLimiter(clock, Duration.ofSeconds(60), maxEvents),
                new PipelineMetrics(meterRegistry),
                clock,
                Duration.ofHours(48),
                Duration.ofSeconds(20));
    }

    @Test
    @DisplayName("First delivery is admitted and claims both keys")
    void firstDeliveryAdmitted() {
        assertThat(service.admit(FROM, "SM1", "Juan me debe 500")).isEqualTo(ADMITTED);

        assertThat(claims).containsKey("sid:SM1");
        assertThat(claims.keySet()).anyMatch(key -> key.startsWith("hash:"));
    }

    @Test
    @DisplayName("A re-delivered id is a duplicate, whether the local cache or the store catches it")
    void redeliveredIdIsDuplicate() {
        service.admit(FROM, "SM1", "Juan me debe 500");
        assertThat(service.admit(FROM, "SM1", "Juan me debe 500")).isEqualTo(DUPLICATE);

        // another instance without the local cache entry
        InboundAdmissionService other = newService(10);
        clock.advance(Duration.ofMinutes(5));
        assertThat(other.admit(FROM, "SM1", "Juan me debe 500")).isEqualTo(DUPLICATE);
    }

    @Test
    @DisplayName("Same body under a fresh id within the window is a duplicate; after the window it is new")
    void sameBodyWithinWindow() {
        service.admit(FROM, "SM1", "quien me debe");

        clock.advance(Duration.ofSeconds(5));
        assertThat(newService(10).admit(FROM, "SM2", "quien me debe")).isEqualTo(DUPLICATE);

        clock.advance(Duration.ofSeconds(30));
        assertThat(newService(10).admit(FROM, "SM3", "quien me debe")).isEqualTo(ADMITTED);
    }

    @Test
    @DisplayName("Without a delivery id only the body hash is claimed")
    void missingDeliveryId() {
        assertThat(service.admit(FROM, null, "hola")).isEqualTo(ADMITTED);
        assertThat(claims.keySet()).noneMatch(key -> key.startsWith("sid:"));
    }

    @Test
    @DisplayName("Store failure fails open and is counted")
    void storeDownFailsOpen() {
        when(dedupRepository.claim(anyString(), any(LocalDateTime.class), any(LocalDateTime.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(service.admit(FROM, "SM9", "hola")).isEqualTo(ADMITTED);
        assertThat(meterRegistry.counter("inbound.dedup.fail_open").count()).isEqualTo(2.0);

        // the local cache still catches the immediate retry
        assertThat(service.admit(FROM, "SM9", "hola")).isEqualTo(DUPLICATE);
    }

    @Test
    @DisplayName("Admitted messages beyond the rate ceiling are throttled")
    void throttled() {
        InboundAdmissionService limited = newService(2);

        assertThat(limited.admit(FROM, "SM1", "uno")).isEqualTo(ADMITTED);
        assertThat(limited.admit(FROM, "SM2", "dos")).isEqualTo(ADMITTED);
        assertThat(limited.admit(FROM, "SM3", "tres")).isEqualTo(THROTTLED);

        assertThat(meterRegistry.counter("inbound.admission", "result", "throttled").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Duplicates do not consume rate capacity")
    void duplicatesAreNotRateLimited() {
        InboundAdmissionService limited = newService(1);

        assertThat(limited.admit(FROM, "SM1", "uno")).isEqualTo(ADMITTED);
        assertThat(limited.admit(FROM, "SM1", "uno")).isEqualTo(DUPLICATE);
        assertThat(limited.admit(FROM, "SM1", "uno")).isEqualTo(DUPLICATE);
    }

    @Test
    @DisplayName("Purge failures are logged, not thrown")
    void purgeSwallowsStoreFailure() {
        when(dedupRepository.deleteExpired(any())).thenThrow(new DataAccessResourceFailureException("down"));

        service.purgeExpiredClaims();

        verify(dedupRepository).deleteExpired(any());
    }
}
