package com.flagship.celebration_ledger.election;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * Federal election calendar arithmetic.
 *
 * Federal general elections are held on the Tuesday after the first Monday
 * in November of even-numbered years (2 U.S.C. 7). Everything here is pure
 * date math and needs no external data.
 */
public final class StatutoryElectionCalendar {

    private StatutoryElectionCalendar() {
        // Utility class
    }

    /**
     * Returns the statutory general election date for the given year.
     */
    public static LocalDate generalElectionDate(int year) {
        LocalDate firstMonday = LocalDate.of(year, Month.NOVEMBER, 1)
                .with(TemporalAdjusters.firstInMonth(DayOfWeek.MONDAY));
        return firstMonday.plusDays(1);
    }

    /**
     * Returns the election cycle year for a calendar year: the year itself when
     * even, otherwise the following year.
     */
    public static int cycleYearFor(int calendarYear) {
        return calendarYear % 2 == 0 ? calendarYear : calendarYear + 1;
    }

    /**
     * First instant after the given election day, in the reference offset.
     * Contributions made on election day still count toward that election.
     */
    public static Instant closeOf(LocalDate electionDay, ZoneOffset referenceOffset) {
        return electionDay.plusDays(1).atStartOfDay().toInstant(referenceOffset);
    }
}
