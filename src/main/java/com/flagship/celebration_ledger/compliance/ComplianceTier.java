package com.flagship.celebration_ledger.compliance;

/**
 * Contributor compliance tiers, ordered from least to most information provided.
 *
 * BASE: anonymous-grade contributor, small calendar-year limits.
 * ELEVATED: full identity, address and employment on file, per-election limits.
 */
public enum ComplianceTier {
    BASE,
    ELEVATED;

    public boolean isAtLeast(ComplianceTier other) {
        return this.compareTo(other) >= 0;
    }

    public static ComplianceTier max(ComplianceTier a, ComplianceTier b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }
}
