package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.compliance.ComplianceTier;
import com.flagship.celebration_ledger.compliance.ContributorProfile;
import lombok.Value;

/**
 * Contributor profile and effective tier frozen when the contribution was
 * committed. Later profile edits never reach it.
 */
@Value
public class DonorSnapshot {
    ContributorProfile profile;
    ComplianceTier complianceTier;
}
