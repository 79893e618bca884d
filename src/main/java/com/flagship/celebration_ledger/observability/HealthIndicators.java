package com.flagship.celebration_ledger.observability;

import com.flagship.celebration_ledger.election.DefaultElectionDateTable;
import com.flagship.celebration_ledger.election.ElectionCycleResolver;
import com.flagship.celebration_ledger.election.ElectionDateSnapshotCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Custom health indicators for the celebration ledger.
 */
public class HealthIndicators {

    /**
     * Election data availability. The service keeps answering from the
     * snapshot cache and the default table when the live source is down, so a
     * failing live source reports DEGRADED rather than DOWN.
     */
    @Component("electionDataHealth")
    public static class ElectionDataHealthIndicator implements HealthIndicator {

        private final ElectionCycleResolver resolver;
        private final ElectionDateSnapshotCache snapshotCache;
        private final DefaultElectionDateTable defaultTable;

        public ElectionDataHealthIndicator(ElectionCycleResolver resolver,
                                           ElectionDateSnapshotCache snapshotCache,
                                           DefaultElectionDateTable defaultTable) {
            this.resolver = resolver;
            this.snapshotCache = snapshotCache;
            this.defaultTable = defaultTable;
        }

        @Override
        public Health health() {
            Instant lastSuccess = resolver.getLastLiveSuccess().orElse(null);
            Instant lastFailure = resolver.getLastLiveFailure().orElse(null);
            boolean liveFailing = lastFailure != null && (lastSuccess == null || lastFailure.isAfter(lastSuccess));

            Health.Builder builder;
            if (defaultTable.size() == 0 && snapshotCache.size() == 0 && !resolver.isLiveSourceConfigured()) {
                builder = Health.down().withDetail("error", "No election date source available");
            } else if (liveFailing || !resolver.isLiveSourceConfigured()) {
                builder = Health.status("DEGRADED")
                        .withDetail("note", "Serving election dates from snapshot cache or default table");
            } else {
                builder = Health.up();
            }

            return builder
                    .withDetail("liveSourceConfigured", resolver.isLiveSourceConfigured())
                    .withDetail("lastLiveSuccess", lastSuccess != null ? lastSuccess.toString() : "never")
                    .withDetail("lastLiveFailure", lastFailure != null ? lastFailure.toString() : "never")
                    .withDetail("cachedSnapshots", snapshotCache.size())
                    .withDetail("defaultJurisdictions", defaultTable.size())
                    .build();
        }
    }

    /**
     * Redis connectivity. Used for the settlement idempotency fast path and the
     * shared election snapshot; both fall back when Redis is down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : degraded("Unexpected ping response: " + result);
                }
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "System can operate without Redis using DB and local fallbacks")
                    .build();
        }
    }
}
