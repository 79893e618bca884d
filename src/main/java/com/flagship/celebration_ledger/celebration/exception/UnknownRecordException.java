package com.flagship.celebration_ledger.celebration.exception;

import lombok.Getter;

@Getter
public class UnknownRecordException extends RuntimeException {

    private final String reference;

    public UnknownRecordException(String reference) {
        super("Celebration not found: " + reference);
        this.reference = reference;
    }
}
