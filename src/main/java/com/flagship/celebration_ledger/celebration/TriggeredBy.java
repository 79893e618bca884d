package com.flagship.celebration_ledger.celebration;

/**
 * Kind of actor that caused a status change.
 */
public enum TriggeredBy {
    SYSTEM,
    ADMIN,
    USER,
    API,
    /** A watched real-world condition, e.g. a congressional session ending or a bill vote. */
    SCHEDULED_CONDITION
}
