package com.flagship.celebration_ledger.celebration;

import lombok.Value;

/**
 * Outcome of a transition request: the updated record on success, otherwise
 * the error and a human-readable message.
 */
@Value
public class TransitionResult {
    ContributionRecord record;
    TransitionError error;
    String message;
    int attempts;

    public static TransitionResult success(ContributionRecord record, int attempts) {
        return new TransitionResult(record, null, null, attempts);
    }

    public static TransitionResult failure(TransitionError error, String message, int attempts) {
        return new TransitionResult(null, error, message, attempts);
    }

    public static TransitionResult failure(ContributionRecord current, TransitionError error, String message, int attempts) {
        return new TransitionResult(current, error, message, attempts);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
