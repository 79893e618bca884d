package com.flagship.celebration_ledger.election;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Calendar-year reset window evaluated in a fixed reference offset.
 * The offset is applied explicitly; no daylight-saving rules are involved.
 */
@Value
public class AnnualWindow {
    int year;
    Instant start;
    Instant end;

    public static AnnualWindow containing(Instant instant, ZoneOffset referenceOffset) {
        int year = instant.atOffset(referenceOffset).getYear();
        Instant start = LocalDate.of(year, 1, 1).atStartOfDay().toInstant(referenceOffset);
        Instant end = LocalDate.of(year + 1, 1, 1).atStartOfDay().toInstant(referenceOffset);
        return new AnnualWindow(year, start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
