package com.flagship.celebration_ledger.celebration;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Status-specific details attached to a ledger entry. Each variant belongs to
 * exactly one target status; attaching it to any other status is rejected.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ActivationDetails.class, name = "activation"),
    @JsonSubTypes.Type(value = PauseDetails.class, name = "pause"),
    @JsonSubTypes.Type(value = ResolutionDetails.class, name = "resolution"),
    @JsonSubTypes.Type(value = DefunctDetails.class, name = "defunct")
})
public sealed interface StatusMetadata
        permits ActivationDetails, PauseDetails, ResolutionDetails, DefunctDetails {

    CelebrationStatus appliesTo();

    String getNote();
}
