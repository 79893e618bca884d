package com.flagship.celebration_ledger.celebration.exception;

import lombok.Getter;

@Getter
public class DuplicateIdempotencyKeyException extends RuntimeException {

    private final String idempotencyKey;

    public DuplicateIdempotencyKeyException(String idempotencyKey, Throwable cause) {
        super("Idempotency key already used: " + idempotencyKey, cause);
        this.idempotencyKey = idempotencyKey;
    }
}
