package com.flagship.celebration_ledger.compliance;

import lombok.Builder;
import lombok.Value;

/**
 * Identity, address and employment information a contributor has supplied.
 * Content validation (real addresses, real employers) happens upstream.
 */
@Value
@Builder(toBuilder = true)
public class ContributorProfile {
    String firstName;
    String lastName;
    String addressLine;
    String city;
    String state;
    String zip;
    String country;
    String passportNumber;
    EmploymentStatus employmentStatus;
    String occupation;
    String employer;

    public static ContributorProfile empty() {
        return ContributorProfile.builder().build();
    }
}
