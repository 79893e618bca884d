package com.flagship.celebration_ledger.celebration.exception;

import com.flagship.celebration_ledger.celebration.CelebrationStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * The requested status change is not an edge of the transition table.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final UUID recordId;
    private final CelebrationStatus from;
    private final CelebrationStatus to;

    public InvalidTransitionException(UUID recordId, CelebrationStatus from, CelebrationStatus to) {
        super(String.format("Invalid celebration status transition for %s: %s -> %s", recordId, from, to));
        this.recordId = recordId;
        this.from = from;
        this.to = to;
    }
}
