package com.flagship.celebration_ledger.election;

import lombok.Value;

import java.time.LocalDate;

/**
 * Primary and general election dates for one jurisdiction and cycle year.
 * The primary date is optional; some sources only know the general date.
 */
@Value
public class ElectionDates {
    LocalDate primaryDate;
    LocalDate generalDate;

    public static ElectionDates of(LocalDate primaryDate, LocalDate generalDate) {
        if (generalDate == null) {
            throw new IllegalArgumentException("General election date is required");
        }
        if (primaryDate != null && !primaryDate.isBefore(generalDate)) {
            throw new IllegalArgumentException(
                String.format("Primary date %s must precede general date %s", primaryDate, generalDate));
        }
        return new ElectionDates(primaryDate, generalDate);
    }
}
