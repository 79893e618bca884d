package com.flagship.celebration_ledger.celebration;

public enum DefunctCause {
    SESSION_ENDED,
    PAYMENT_FAILED,
    ADMIN_OVERRIDE,
    CONDITION_WITHDRAWN
}
