package com.flagship.celebration_ledger.election;

/**
 * Where a reset boundary's election dates came from.
 */
public enum BoundarySource {
    LIVE,
    CACHE,
    DEFAULT
}
