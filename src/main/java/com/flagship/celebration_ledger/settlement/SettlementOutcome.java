package com.flagship.celebration_ledger.settlement;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Payment provider outcome for an escrowed contribution. Lowercase on the wire.
 */
public enum SettlementOutcome {
    CAPTURED("captured"),
    FAILED("failed");

    private final String wireName;

    SettlementOutcome(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SettlementOutcome fromWireName(String value) {
        for (SettlementOutcome outcome : values()) {
            if (outcome.wireName.equalsIgnoreCase(value)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown settlement outcome: " + value);
    }
}
