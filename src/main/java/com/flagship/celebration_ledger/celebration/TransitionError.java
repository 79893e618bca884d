package com.flagship.celebration_ledger.celebration;

public enum TransitionError {
    UNKNOWN_RECORD(false),
    INVALID_TRANSITION(false),
    CONCURRENT_MODIFICATION(true),
    LIMIT_UNDETERMINED(true),
    LIMIT_EXCEEDED(false);

    private final boolean retryable;

    TransitionError(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
