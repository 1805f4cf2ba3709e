package com.cobrobot.bot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LocalDedupCacheTest {

    private MutableClock clock;
    private LocalDedupCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-10-17T15:00:00Z");
        cache = new LocalDedupCache(clock);
    }

    @Test
    @DisplayName("A remembered key is fresh until its ttl passes")
    void keyExpiresAfterTtl() {
        cache.remember("sid:SM1", Duration.ofSeconds(20));

        assertThat(cache.isFresh("sid:SM1")).isTrue();
        assertThat(cache.isFresh("sid:SM2")).isFalse();

        clock.advance(Duration.ofSeconds(19));
        assertThat(cache.isFresh("sid:SM1")).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.isFresh("sid:SM1")).isFalse();
    }

    @Test
    @DisplayName("Sweep drops only expired keys")
    void sweepRemovesExpiredKeys() {
        cache.remember("hash:a", Duration.ofSeconds(20));
        cache.remember("sid:b", Duration.ofHours(48));

        clock.advance(Duration.ofMinutes(1));

        assertThat(cache.sweep()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.isFresh("sid:b")).isTrue();
    }
}
