package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.compliance.ContributorProfile;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CreateCelebrationCommand {
    String idempotencyKey;
    String contributorId;
    String recipientId;
    String recipientJurisdiction;
    String conditionId;
    BigDecimal amount;
    BigDecimal tip;
    BigDecimal processingFee;
    ContributorProfile profile;
    TransitionTrigger trigger;
}
