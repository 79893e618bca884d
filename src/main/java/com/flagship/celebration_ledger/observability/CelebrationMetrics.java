package com.flagship.celebration_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the celebration lifecycle.
 *
 * Metrics exposed:
 * - celebration.transitions: status changes, tagged from/to/result
 * - celebration.transition.conflicts: optimistic append conflicts
 * - celebration.created: intake outcomes, tagged by tier and result
 * - settlement.dispositions: settlement/lifecycle event outcomes
 * - idempotency.cache: replay hits and misses, tagged by scope
 * - election.boundary.source: which date source answered
 * - compliance.limit.rejections: rejected contributions by reason
 * - celebration.latency: operation timings
 */
@Component
public class CelebrationMetrics {

    private final MeterRegistry registry;

    public CelebrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String from, String to, String result) {
        registry.counter("celebration.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordTransitionConflict() {
        registry.counter("celebration.transition.conflicts").increment();
    }

    public void recordCelebrationCreated(String tier, String result) {
        registry.counter("celebration.created",
                "tier", sanitizeTag(tier),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordSettlementDisposition(String eventFamily, String disposition) {
        registry.counter("settlement.dispositions",
                "family", sanitizeTag(eventFamily),
                "disposition", sanitizeTag(disposition)
        ).increment();
    }

    public void recordIdempotencyHit(String scope) {
        registry.counter("idempotency.cache", "scope", sanitizeTag(scope), "result", "hit").increment();
    }

    public void recordIdempotencyMiss(String scope) {
        registry.counter("idempotency.cache", "scope", sanitizeTag(scope), "result", "miss").increment();
    }

    public void recordBoundarySource(String source) {
        registry.counter("election.boundary.source", "source", sanitizeTag(source)).increment();
    }

    public void recordLiveLookupFailure(String cause) {
        registry.counter("election.live.failures", "cause", sanitizeTag(cause)).increment();
    }

    public void recordLimitRejection(String reason) {
        registry.counter("compliance.limit.rejections", "reason", sanitizeTag(reason)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("celebration.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
