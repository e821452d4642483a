package com.flagship.wallet_ledger.wallet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Idempotency-Key bookkeeping for deposits and transfers.
 *
 * Strategy:
 * 1. Redis first, holding completed outcomes only (fast, but may be unavailable)
 * 2. The idempotency_keys table is the source of truth: the first request
 *    claims the key with a unique insert, later requests see the claim
 * 3. Completed outcomes are written to both
 *
 * A request that fails in a way the client may retry releases its claim, so
 * the retry runs the operation again.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration RETENTION = Duration.ofDays(7);

    private static final String CLAIM = """
            INSERT INTO idempotency_keys
                (idempotency_key, account_id, operation, request_hash, status, created_at)
            VALUES (?, ?, ?, ?, 'IN_PROGRESS', CURRENT_TIMESTAMP)
            ON CONFLICT (account_id, idempotency_key) DO NOTHING""";

    private static final String SELECT = """
            SELECT request_hash, status, response_status, response_body
            FROM idempotency_keys
            WHERE account_id = ? AND idempotency_key = ?""";

    private static final String COMPLETE = """
            UPDATE idempotency_keys
            SET status = 'COMPLETED', response_status = ?, response_body = ?, completed_at = CURRENT_TIMESTAMP
            WHERE account_id = ? AND idempotency_key = ?""";

    private static final String RELEASE = """
            DELETE FROM idempotency_keys
            WHERE account_id = ? AND idempotency_key = ? AND status = 'IN_PROGRESS'""";

    private static final String PURGE =
            "DELETE FROM idempotency_keys WHERE created_at < CURRENT_TIMESTAMP - make_interval(secs => ?)";

    private final JdbcTemplate jdbcTemplate;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;

    public IdempotencyService(JdbcTemplate jdbcTemplate,
                              Optional<StringRedisTemplate> redisTemplate,
                              ObjectMapper objectMapper,
                              LedgerMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Claims the key for this request, or reports what an earlier request with it did.
     *
     * @param requestHash fingerprint of the request, see {@link #fingerprint}
     */
    public Claim claim(String accountId, String idempotencyKey, String operation, String requestHash) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }
        if (idempotencyKey.length() > 255) {
            throw new IllegalArgumentException("Idempotency key is longer than 255 characters");
        }

        Optional<StoredResponse> cached = readCache(accountId, idempotencyKey);
        if (cached.isPresent()) {
            metrics.recordIdempotencyHit();
            return compare(cached.get(), requestHash);
        }

        int inserted = jdbcTemplate.update(CLAIM, idempotencyKey, accountId, operation, requestHash);
        if (inserted == 1) {
            metrics.recordIdempotencyMiss();
            log.debug("Claimed idempotency key {} for {}", idempotencyKey, operation);
            return Claim.claimed();
        }

        metrics.recordIdempotencyHit();
        List<StoredResponse> rows = jdbcTemplate.query(SELECT, (rs, rowNum) -> new StoredResponse(
                rs.getString("request_hash"),
                "COMPLETED".equals(rs.getString("status")),
                rs.getInt("response_status"),
                rs.getString("response_body")), accountId, idempotencyKey);
        if (rows.isEmpty()) {
            // released by a failed first request between our insert and select
            return Claim.inProgress();
        }

        StoredResponse stored = rows.get(0);
        if (stored.isCompleted()) {
            writeCache(accountId, idempotencyKey, stored);
        }
        return compare(stored, requestHash);
    }

    /**
     * Stores the outcome of the request that holds the claim.
     */
    public void complete(String accountId, String idempotencyKey, String requestHash, int status, String body) {
        jdbcTemplate.update(COMPLETE, status, body, accountId, idempotencyKey);
        writeCache(accountId, idempotencyKey, new StoredResponse(requestHash, true, status, body));
    }

    /**
     * Gives the key up so a retry of the same request runs again.
     */
    public void release(String accountId, String idempotencyKey) {
        jdbcTemplate.update(RELEASE, accountId, idempotencyKey);
    }

    @Scheduled(fixedRateString = "${wallet.idempotency.purge-interval-ms:3600000}")
    public void purgeExpired() {
        int removed = jdbcTemplate.update(PURGE, RETENTION.toSeconds());
        if (removed > 0) {
            log.info("Purged {} expired idempotency keys", removed);
        }
    }

    /**
     * SHA-256 of the request parts, so a key reused with a different body is detected.
     */
    public static String fingerprint(String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (String part : parts) {
                digest.update(String.valueOf(part).getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Claim compare(StoredResponse stored, String requestHash) {
        if (!stored.getRequestHash().equals(requestHash)) {
            return Claim.mismatch();
        }
        return stored.isCompleted() ? Claim.replay(stored) : Claim.inProgress();
    }

    private Optional<StoredResponse> readCache(String accountId, String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(redisKey(accountId, idempotencyKey));
            return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, StoredResponse.class));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String accountId, String idempotencyKey, StoredResponse stored) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(
                    redisKey(accountId, idempotencyKey), objectMapper.writeValueAsString(stored), RETENTION);
        } catch (JsonProcessingException | RuntimeException e) {
            // the table still has the outcome
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static String redisKey(String accountId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + accountId + ":" + idempotencyKey;
    }

    @Value
    public static class StoredResponse {
        String requestHash;
        boolean completed;
        int status;
        String body;
    }

    @Value
    public static class Claim {
        Status status;
        StoredResponse response;

        public enum Status {
            CLAIMED,
            REPLAY,
            IN_PROGRESS,
            MISMATCH
        }

        static Claim claimed() {
            return new Claim(Status.CLAIMED, null);
        }

        static Claim replay(StoredResponse response) {
            return new Claim(Status.REPLAY, response);
        }

        static Claim inProgress() {
            return new Claim(Status.IN_PROGRESS, null);
        }

        static Claim mismatch() {
            return new Claim(Status.MISMATCH, null);
        }
    }
}
