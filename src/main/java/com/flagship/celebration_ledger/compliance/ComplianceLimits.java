package com.flagship.celebration_ledger.compliance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.ZoneOffset;

/**
 * Configured contribution caps and the reference offset for annual resets.
 */
@Value
@Builder
public class ComplianceLimits {
    BigDecimal minimumContribution;
    BigDecimal basePerContribution;
    BigDecimal baseAnnual;
    BigDecimal elevatedPerContribution;
    BigDecimal elevatedPerElection;
    BigDecimal tipAnnual;
    ZoneOffset referenceOffset;

    public static ComplianceLimits defaults() {
        return ComplianceLimits.builder()
                .minimumContribution(new BigDecimal("1.00"))
                .basePerContribution(new BigDecimal("50.00"))
                .baseAnnual(new BigDecimal("200.00"))
                .elevatedPerContribution(new BigDecimal("3500.00"))
                .elevatedPerElection(new BigDecimal("3500.00"))
                .tipAnnual(new BigDecimal("5000.00"))
                .referenceOffset(ZoneOffset.ofHours(-5))
                .build();
    }

    public BigDecimal perContributionCap(ComplianceTier tier) {
        return tier == ComplianceTier.ELEVATED ? elevatedPerContribution : basePerContribution;
    }

    public BigDecimal cumulativeCap(ComplianceTier tier) {
        return tier == ComplianceTier.ELEVATED ? elevatedPerElection : baseAnnual;
    }
}
