package com.flagship.celebration_ledger.election;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last successfully fetched election dates per (jurisdiction, year).
 *
 * Strategy:
 * 1. In-process map (always available)
 * 2. Redis, shared across instances (best effort, can be down)
 *
 * Only live lookups write here, so an entry is always a real answer from the
 * election data source, possibly stale.
 */
@Component
@Slf4j
public class ElectionDateSnapshotCache {

    private static final String REDIS_KEY_PREFIX = "election-dates:";

    private final Map<String, ElectionDates> local = new ConcurrentHashMap<>();
    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public ElectionDateSnapshotCache(Optional<StringRedisTemplate> redisTemplate,
                                     ObjectMapper objectMapper,
                                     @Value("${election.snapshot.ttl:30d}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    public Optional<ElectionDates> get(String jurisdiction, int electionYear) {
        String key = key(jurisdiction, electionYear);
        ElectionDates cached = local.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }

        if (redisTemplate.isPresent()) {
            try {
                String json = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + key);
                if (json != null) {
                    ElectionDates dates = objectMapper.readValue(json, ElectionDates.class);
                    local.put(key, dates);
                    log.debug("Election dates for {} found in Redis snapshot", key);
                    return Optional.of(dates);
                }
            } catch (Exception e) {
                log.warn("Redis snapshot lookup failed for {}: {}", key, e.getMessage());
            }
        }
        return Optional.empty();
    }

    public void put(String jurisdiction, int electionYear, ElectionDates dates) {
        String key = key(jurisdiction, electionYear);
        local.put(key, dates);

        if (redisTemplate.isPresent()) {
            try {
                redisTemplate.get().opsForValue()
                        .set(REDIS_KEY_PREFIX + key, objectMapper.writeValueAsString(dates), ttl);
            } catch (JsonProcessingException e) {
                log.warn("Could not serialize election dates for {}: {}", key, e.getMessage());
            } catch (Exception e) {
                log.warn("Failed to write election snapshot to Redis for {}: {}", key, e.getMessage());
            }
        }
    }

    public int size() {
        return local.size();
    }

    private static String key(String jurisdiction, int electionYear) {
        return jurisdiction.toUpperCase() + ":" + electionYear;
    }
}
