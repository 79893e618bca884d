package com.flagship.celebration_ledger.celebration.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Another writer appended to the ledger between read and append.
 * Safe to retry from a fresh read.
 */
@Getter
public class ConcurrentLedgerModificationException extends RuntimeException {

    private final UUID recordId;
    private final int expectedVersion;

    public ConcurrentLedgerModificationException(UUID recordId, int expectedVersion) {
        super(String.format("Ledger for %s moved past version %d", recordId, expectedVersion));
        this.recordId = recordId;
        this.expectedVersion = expectedVersion;
    }

    public ConcurrentLedgerModificationException(UUID recordId, int expectedVersion, Throwable cause) {
        super(String.format("Ledger for %s moved past version %d", recordId, expectedVersion), cause);
        this.recordId = recordId;
        this.expectedVersion = expectedVersion;
    }
}
