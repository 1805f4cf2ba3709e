package com.cobrobot.bot.service;

import com.cobrobot.bot.constant.BotConstants;
import com.cobrobot.bot.repository.InboundDedupRepository;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HexFormat;

/**
 * First stage of the inbound pipeline: drops re-delivered messages and damps floods before any side effect runs.
 *
 * Re-delivery is detected with two durable claims, one on the transport's delivery id (long retention) and one
 * on a hash of sender and body (a few seconds, catching retries that arrive under a fresh id). Both claims fail
 * open: with the store down a legitimate message is worth more than strict dedup.
 */
@Slf4j
@Service
public class InboundAdmissionService {

    public enum Admission { ADMITTED, DUPLICATE, THROTTLED }

    private final InboundDedupRepository dedupRepository;
    private final LocalDedupCache localCache;
    private final SlidingWindowRateLimiter rateLimiter;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Duration sidRetention;
    private final Duration hashWindow;

    public InboundAdmissionService(InboundDedupRepository dedupRepository,
                                   LocalDedupCache localCache,
                                   SlidingWindowRateLimiter rateLimiter,
                                   PipelineMetrics metrics,
                                   Clock clock,
                                   @Value("${app.dedup.sid-retention:PT48H}") Duration sidRetention,
                                   @Value("${app.dedup.hash-window:PT20S}") Duration hashWindow) {
        this.dedupRepository = dedupRepository;
        this.localCache = localCache;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
        this.clock = clock;
        this.sidRetention = sidRetention;
        this.hashWindow = hashWindow;
    }

    @NotNull
    public Admission admit(@NotNull String identity, @Nullable String deliveryId, @Nullable String body) {
        Admission admission = checkDuplicates(identity, deliveryId, body);

        if (admission == Admission.ADMITTED && !rateLimiter.tryAcquire(identity)) {
            log.info("Rate limit hit for {}", identity);
            admission = Admission.THROTTLED;
        }

        metrics.admission(admission);
        return admission;
    }

    private Admission checkDuplicates(String identity, @Nullable String deliveryId, @Nullable String body) {
        String sidKey = StringUtils.hasText(deliveryId) ? BotConstants.DEDUP_SID_PREFIX + deliveryId : null;
        String hashKey = BotConstants.DEDUP_HASH_PREFIX + sha1(identity + "|" + (body != null ? body : ""));

        if ((sidKey != null && localCache.isFresh(sidKey)) || localCache.isFresh(hashKey)) {
            log.debug("Duplicate delivery from {} caught by local cache", identity);
            return Admission.DUPLICATE;
        }

        if (sidKey != null && !claim(sidKey, sidRetention)) {
            log.info("Duplicate delivery {} from {}", deliveryId, identity);
            return Admission.DUPLICATE;
        }

        if (!claim(hashKey, hashWindow)) {
            log.info("Duplicate body from {} within {}s", identity, hashWindow.toSeconds());
            return Admission.DUPLICATE;
        }

        return Admission.ADMITTED;
    }

    /**
     * @return false only when the store confirms a live claim by someone else
     */
    private boolean claim(String key, Duration ttl) {
        LocalDateTime now = LocalDateTime.now(clock);
        try {
            boolean claimed = dedupRepository.claim(key, now, now.plus(ttl)) > 0;
            if (claimed) {
                localCache.remember(key, ttl);
            }
            return claimed;
        } catch (DataAccessException e) {
            log.warn("Dedup store unavailable, admitting {} without durable check: {}", key, e.getMessage());
            metrics.dedupFailOpen();
            localCache.remember(key, ttl);
            return true;
        }
    }

    @Scheduled(fixedRate = 30000)
    public void sweepLocalState() {
        localCache.sweep();
        rateLimiter.sweep();
    }

    @Scheduled(fixedDelayString = "${app.dedup.sweep-interval-ms:3600000}")
    public void purgeExpiredClaims() {
        try {
            int deleted = dedupRepository.deleteExpired(LocalDateTime.now(clock));
            if (deleted > 0) {
                log.info("Purged {} expired dedup claims", deleted);
            }
        } catch (DataAccessException e) {
            log.error("Failed to purge dedup claims: {}", e.getMessage(), e);
        }
    }

    @NotNull
    static String sha1(@NotNull String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
