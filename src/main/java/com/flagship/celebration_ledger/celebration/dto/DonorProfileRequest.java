package com.flagship.celebration_ledger.celebration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.celebration_ledger.compliance.ContributorProfile;
import com.flagship.celebration_ledger.compliance.EmploymentStatus;
import lombok.Value;

/**
 * Contributor details supplied with a new celebration. Every field is
 * optional; missing fields simply keep the contributor at the base tier.
 */
@Value
public class DonorProfileRequest {

    @JsonProperty("first_name")
    String firstName;

    @JsonProperty("last_name")
    String lastName;

    @JsonProperty("address_line")
    String addressLine;

    @JsonProperty("city")
    String city;

    @JsonProperty("state")
    String state;

    @JsonProperty("zip")
    String zip;

    @JsonProperty("country")
    String country;

    @JsonProperty("passport_number")
    String passportNumber;

    @JsonProperty("employment_status")
    EmploymentStatus employmentStatus;

    @JsonProperty("occupation")
    String occupation;

    @JsonProperty("employer")
    String employer;

    public ContributorProfile toProfile() {
        return ContributorProfile.builder()
                .firstName(firstName)
                .lastName(lastName)
                .addressLine(addressLine)
                .city(city)
                .state(state)
                .zip(zip)
                .country(country)
                .passportNumber(passportNumber)
                .employmentStatus(employmentStatus)
                .occupation(occupation)
                .employer(employer)
                .build();
    }
}
