package com.flagship.celebration_ledger.election;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Election-cycle reset boundary for one jurisdiction.
 *
 * Window layout for a cycle:
 * <pre>
 *   PRIOR_CYCLE | PRIMARY          | GENERAL          | NEXT_CYCLE
 *               ^ previousGeneral  ^ primary          ^ general
 * </pre>
 * Each election day belongs to the window that ends with it. Without a primary
 * date the PRIMARY window is empty and GENERAL starts at the previous general.
 */
@Value
@Builder
public class ResetBoundary {
    String jurisdiction;
    int cycleYear;
    LocalDate primaryDate;
    LocalDate generalDate;
    LocalDate previousGeneralDate;
    BoundarySource source;
    ZoneOffset referenceOffset;

    public Instant cycleStart() {
        return StatutoryElectionCalendar.closeOf(previousGeneralDate, referenceOffset);
    }

    public Instant cycleEnd() {
        return StatutoryElectionCalendar.closeOf(generalDate, referenceOffset);
    }

    /**
     * Classifies an instant into the window it falls in for this cycle.
     */
    public ElectionWindow windowOf(Instant instant) {
        if (instant.isBefore(cycleStart())) {
            return ElectionWindow.PRIOR_CYCLE;
        }
        if (primaryDate != null
                && instant.isBefore(StatutoryElectionCalendar.closeOf(primaryDate, referenceOffset))) {
            return ElectionWindow.PRIMARY;
        }
        if (instant.isBefore(cycleEnd())) {
            return ElectionWindow.GENERAL;
        }
        return ElectionWindow.NEXT_CYCLE;
    }

    /**
     * Inclusive start of a window that lies inside this cycle.
     */
    public Instant windowStart(ElectionWindow window) {
        return switch (window) {
            case PRIMARY -> cycleStart();
            case GENERAL -> primaryDate != null
                    ? StatutoryElectionCalendar.closeOf(primaryDate, referenceOffset)
                    : cycleStart();
            default -> throw new IllegalArgumentException("Window " + window + " is outside cycle " + cycleYear);
        };
    }

    /**
     * Exclusive end of a window that lies inside this cycle.
     */
    public Instant windowEnd(ElectionWindow window) {
        return switch (window) {
            case PRIMARY -> primaryDate != null
                    ? StatutoryElectionCalendar.closeOf(primaryDate, referenceOffset)
                    : cycleStart();
            case GENERAL -> cycleEnd();
            default -> throw new IllegalArgumentException("Window " + window + " is outside cycle " + cycleYear);
        };
    }
}
