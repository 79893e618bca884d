package com.flagship.celebration_ledger.config;

import com.flagship.celebration_ledger.compliance.ComplianceLimits;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;

/**
 * Contribution caps and the clock every component reads "now" from.
 */
@Configuration
public class ComplianceConfig {

    @Value("${compliance.limits.minimum-contribution:1.00}")
    private BigDecimal minimumContribution;

    @Value("${compliance.limits.base-per-contribution:50.00}")
    private BigDecimal basePerContribution;

    @Value("${compliance.limits.base-annual:200.00}")
    private BigDecimal baseAnnual;

    @Value("${compliance.limits.elevated-per-contribution:3500.00}")
    private BigDecimal elevatedPerContribution;

    @Value("${compliance.limits.elevated-per-election:3500.00}")
    private BigDecimal elevatedPerElection;

    @Value("${compliance.limits.tip-annual:5000.00}")
    private BigDecimal tipAnnual;

    @Value("${compliance.reference-offset:-05:00}")
    private String referenceOffset;

    @Bean
    public ComplianceLimits complianceLimits() {
        return ComplianceLimits.builder()
                .minimumContribution(minimumContribution)
                .basePerContribution(basePerContribution)
                .baseAnnual(baseAnnual)
                .elevatedPerContribution(elevatedPerContribution)
                .elevatedPerElection(elevatedPerElection)
                .tipAnnual(tipAnnual)
                .referenceOffset(ZoneOffset.of(referenceOffset))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
