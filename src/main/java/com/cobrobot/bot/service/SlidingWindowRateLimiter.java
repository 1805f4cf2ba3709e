package com.cobrobot.bot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-identity sliding window over recent message timestamps. Purely in-process and rebuilt from
 * scratch on restart: it damps abuse, it does not enforce correctness.
 */
@Slf4j
@Component
public class SlidingWindowRateLimiter {

    private final Map<String, Deque<Long>> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long windowMillis;
    private final int maxEvents;

    public SlidingWindowRateLimiter(Clock clock,
                                    @Value("${app.rate-limit.window:PT60S}") Duration window,
                                    @Value("${app.rate-limit.max-events:10}") int maxEvents) {
        this.clock = clock;
        this.windowMillis = window.toMillis();
        this.maxEvents = maxEvents;
    }

    /**
     * Records an event for {@code identity} and reports whether it stays within the ceiling.
     */
    public boolean tryAcquire(String identity) {
        long now = clock.millis();
        Deque<Long> timestamps = windows.computeIfAbsent(identity, k -> new ArrayDeque<>());
        synchronized (timestamps) {
            evictOlderThan(timestamps, now - windowMillis);
            timestamps.addLast(now);
            return timestamps.size() <= maxEvents;
        }
    }

    public int sweep() {
        long cutoff = clock.millis() - windowMillis;
        int removed = 0;
        Iterator<Map.Entry<String, Deque<Long>>> iterator = windows.entrySet().iterator();
        while (iterator.hasNext()) {
            Deque<Long> timestamps = iterator.next().getValue();
            synchronized (timestamps) {
                evictOlderThan(timestamps, cutoff);
                if (timestamps.isEmpty()) {
                    iterator.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    private static void evictOlderThan(Deque<Long> timestamps, long cutoff) {
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }
}
