package com.flagship.celebration_ledger.election;

/**
 * Partition of time relative to one election cycle.
 */
public enum ElectionWindow {
    /** Before the previous cycle's general election closed. */
    PRIOR_CYCLE,
    /** From the previous general election up to and including primary day. */
    PRIMARY,
    /** After the primary (or the previous general, when no primary is known) through general election day. */
    GENERAL,
    /** After this cycle's general election. */
    NEXT_CYCLE
}
