package com.flagship.celebration_ledger.settlement;

/**
 * The event could not be applied now but may succeed on redelivery. The claim
 * on its dedupe key has been released.
 */
public class RetryableSettlementException extends RuntimeException {

    public RetryableSettlementException(String message) {
        super(message);
    }

    public RetryableSettlementException(String message, Throwable cause) {
        super(message, cause);
    }
}
