package com.flagship.celebration_ledger.celebration;

import lombok.Value;

/**
 * Request context captured alongside a status change, when one exists.
 */
@Value
public class AuditTrail {
    String ipAddress;
    String userAgent;
    String sessionId;
}
