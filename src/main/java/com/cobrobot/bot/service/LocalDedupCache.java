package com.cobrobot.bot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process mirror of recently claimed dedup keys. It only saves a store round trip for re-deliveries
 * that hit the same instance; the store stays the authority across instances.
 */
@Slf4j
@Component
public class LocalDedupCache {

    private final Map<String, Long> expiries = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalDedupCache(Clock clock) {
        this.clock = clock;
    }

    public boolean isFresh(String key) {
        Long expiresAt = expiries.get(key);
        return expiresAt != null && expiresAt > clock.millis();
    }

    public void remember(String key, Duration ttl) {
        expiries.put(key, clock.millis() + ttl.toMillis());
    }

    public int sweep() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Map.Entry<String, Long>> iterator = expiries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getValue() <= now) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired local dedup keys", removed);
        }
        return removed;
    }

    int size() {
        return expiries.size();
    }
}
