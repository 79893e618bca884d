package com.flagship.celebration_ledger.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed idempotency store with a Redis fast path for completed
 * results.
 *
 * The claim is a single {@code INSERT ... ON CONFLICT} against the
 * {@code (idempotency_key, outcome)} primary key. A claim older than
 * {@code settlement.claim-ttl} is treated as abandoned by a crashed consumer
 * and may be taken over; the row's claim token then changes, so the original
 * claimant can neither complete nor release it.
 *
 * Redis only ever holds completed results, which never change, so a stale
 * read is impossible; when Redis is down everything goes to the database.
 */
@Repository
@Slf4j
public class JdbcIdempotencyStore implements IdempotencyStore {

    private static final String REDIS_KEY_PREFIX = "settlement-result:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private static final String CLAIM_SQL =
            "INSERT INTO processed_settlements (idempotency_key, outcome, state, claim_token, claimed_at) "
            + "VALUES (?, ?, 'CLAIMED', ?, ?) "
            + "ON CONFLICT (idempotency_key, outcome) DO UPDATE "
            + "SET claim_token = EXCLUDED.claim_token, claimed_at = EXCLUDED.claimed_at "
            + "WHERE processed_settlements.state = 'CLAIMED' AND processed_settlements.claimed_at < ?";

    private static final String COMPLETE_SQL =
            "UPDATE processed_settlements SET state = 'COMPLETED', result = ?, completed_at = ? "
            + "WHERE idempotency_key = ? AND outcome = ? AND state = 'CLAIMED' AND claim_token = ?";

    private static final String RELEASE_SQL =
            "DELETE FROM processed_settlements "
            + "WHERE idempotency_key = ? AND outcome = ? AND state = 'CLAIMED' AND claim_token = ?";

    private static final String RESULT_SQL =
            "SELECT result FROM processed_settlements "
            + "WHERE idempotency_key = ? AND outcome = ? AND state = 'COMPLETED'";

    private final JdbcTemplate jdbcTemplate;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration claimTtl;

    public JdbcIdempotencyStore(JdbcTemplate jdbcTemplate,
                                Optional<StringRedisTemplate> redisTemplate,
                                ObjectMapper objectMapper,
                                Clock clock,
                                @Value("${settlement.claim-ttl:5m}") Duration claimTtl) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.claimTtl = claimTtl;
    }

    @Override
    public Optional<SettlementResult> getResult(DedupeKey key) {
        Optional<SettlementResult> cached = readFromRedis(key);
        if (cached.isPresent()) {
            return cached;
        }

        List<String> rows = jdbcTemplate.queryForList(RESULT_SQL, String.class, key.getKey(), key.getQualifier());
        if (rows.isEmpty() || rows.get(0) == null) {
            return Optional.empty();
        }
        String json = rows.get(0);
        writeToRedis(key, json);
        return Optional.of(fromJson(json));
    }

    @Override
    public Optional<Claim> tryClaim(DedupeKey key) {
        Instant now = clock.instant();
        Claim claim = Claim.newClaim(key);
        int updated = jdbcTemplate.update(CLAIM_SQL,
                key.getKey(), key.getQualifier(), claim.getToken(),
                Timestamp.from(now),
                Timestamp.from(now.minus(claimTtl)));
        boolean claimed = updated == 1;
        log.debug("Claim on {}: {}", key, claimed ? "acquired" : "held elsewhere");
        return claimed ? Optional.of(claim) : Optional.empty();
    }

    @Override
    public boolean complete(Claim claim, SettlementResult result) {
        DedupeKey key = claim.getKey();
        String json = toJson(result);
        int updated = jdbcTemplate.update(COMPLETE_SQL,
                json, Timestamp.from(clock.instant()), key.getKey(), key.getQualifier(), claim.getToken());
        if (updated != 1) {
            log.warn("Claim on {} was taken over before completion, result not stored", key);
            return false;
        }
        writeToRedis(key, json);
        return true;
    }

    @Override
    public void release(Claim claim) {
        DedupeKey key = claim.getKey();
        jdbcTemplate.update(RELEASE_SQL, key.getKey(), key.getQualifier(), claim.getToken());
    }

    private Optional<SettlementResult> readFromRedis(DedupeKey key) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(redisKey(key));
            return json != null ? Optional.of(fromJson(json)) : Optional.empty();
        } catch (Exception e) {
            log.warn("Redis lookup failed for {}, falling back to database: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeToRedis(DedupeKey key, String json) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(key), json, REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache settlement result in Redis: {}", e.getMessage());
        }
    }

    private static String redisKey(DedupeKey key) {
        return REDIS_KEY_PREFIX + key.getKey() + ":" + key.getQualifier();
    }

    private String toJson(SettlementResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settlement result", e);
        }
    }

    private SettlementResult fromJson(String json) {
        try {
            return objectMapper.readValue(json, SettlementResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize settlement result", e);
        }
    }
}
