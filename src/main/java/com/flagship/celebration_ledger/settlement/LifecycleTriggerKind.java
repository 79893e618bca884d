package com.flagship.celebration_ledger.settlement;

import com.flagship.celebration_ledger.celebration.CelebrationStatus;

/**
 * Lifecycle trigger kinds and the status each one moves a celebration to.
 *
 * Pause and reactivation requests are non-essential: they are skipped for a
 * contributor with nothing left to give. ADMIN_OVERRIDE carries its own target.
 */
public enum LifecycleTriggerKind {
    PAUSE_REQUESTED(CelebrationStatus.PAUSED, false),
    REACTIVATION_REQUESTED(CelebrationStatus.ACTIVE, false),
    CONDITION_RESOLVED(CelebrationStatus.RESOLVED, true),
    SESSION_ENDED(CelebrationStatus.DEFUNCT, true),
    ADMIN_OVERRIDE(null, true);

    private final CelebrationStatus defaultTarget;
    private final boolean essential;

    LifecycleTriggerKind(CelebrationStatus defaultTarget, boolean essential) {
        this.defaultTarget = defaultTarget;
        this.essential = essential;
    }

    public boolean isEssential() {
        return essential;
    }

    /**
     * @throws IllegalArgumentException if the requested target contradicts the kind,
     *         or an override names no target
     */
    public CelebrationStatus resolveTarget(CelebrationStatus requested) {
        if (defaultTarget == null) {
            if (requested == null) {
                throw new IllegalArgumentException(name() + " requires a target status");
            }
            return requested;
        }
        if (requested != null && requested != defaultTarget) {
            throw new IllegalArgumentException(
                    String.format("%s always targets %s, not %s", name(), defaultTarget, requested));
        }
        return defaultTarget;
    }
}
