package com.flagship.amortization.schedule;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Spacing between consecutive due dates.
 *
 * Dates are always derived from the first due date and the installment index,
 * never from the previous (possibly adjusted) date, so month-end clamping does
 * not drift: Jan 31 monthly gives Feb 28, Mar 31, Apr 30.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Periodicity {

    public enum Kind {
        /**
         * Fixed number of calendar days between due dates.
         */
        FIXED_DAYS,

        /**
         * Same day of month as the first due date, clamped to the month's last day.
         */
        MONTHLY,

        /**
         * Last day of each month.
         */
        END_OF_MONTH,

        /**
         * The n-th given weekday of each month (second Sunday, fourth Friday).
         * A fifth occurrence falls back to the last one in months that have only four.
         */
        NTH_WEEKDAY
    }

    Kind kind;
    int days;
    int ordinal;
    DayOfWeek dayOfWeek;

    public static Periodicity everyDays(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Period length in days must be positive: " + days);
        }
        return new Periodicity(Kind.FIXED_DAYS, days, 0, null);
    }

    public static Periodicity monthly() {
        return new Periodicity(Kind.MONTHLY, 0, 0, null);
    }

    public static Periodicity endOfMonth() {
        return new Periodicity(Kind.END_OF_MONTH, 0, 0, null);
    }

    /**
     * The {@code ordinal}-th {@code dayOfWeek} of each month, starting with the
     * month of the first due date. The day of month of the first due date is
     * not used.
     *
     * @param ordinal 1 to 5; 5 means the last occurrence when a month has only four
     */
    public static Periodicity nthWeekday(int ordinal, DayOfWeek dayOfWeek) {
        if (ordinal < 1 || ordinal > 5) {
            throw new IllegalArgumentException("Weekday ordinal must be between 1 and 5: " + ordinal);
        }
        Objects.requireNonNull(dayOfWeek, "Day of week is required");
        return new Periodicity(Kind.NTH_WEEKDAY, 0, ordinal, dayOfWeek);
    }

    /**
     * Nominal (unadjusted) due date of the installment at a zero-based index.
     */
    public LocalDate dueDate(LocalDate firstDueDate, int index) {
        return switch (kind) {
            case FIXED_DAYS -> firstDueDate.plusDays((long) days * index);
            case MONTHLY -> {
                YearMonth month = YearMonth.from(firstDueDate).plusMonths(index);
                int day = Math.min(firstDueDate.getDayOfMonth(), month.lengthOfMonth());
                yield month.atDay(day);
            }
            case END_OF_MONTH -> YearMonth.from(firstDueDate).plusMonths(index).atEndOfMonth();
            case NTH_WEEKDAY -> {
                YearMonth month = YearMonth.from(firstDueDate).plusMonths(index);
                LocalDate date = month.atDay(1).with(TemporalAdjusters.dayOfWeekInMonth(ordinal, dayOfWeek));
                yield YearMonth.from(date).equals(month) ? date : date.minusWeeks(1);
            }
        };
    }
}
