package com.flagship.amortization.calendar;

import java.time.LocalDate;

/**
 * Holidays whose date is an offset in days from Easter Sunday.
 */
public enum MoveableHoliday {
    CARNIVAL_TUESDAY(-47),
    GOOD_FRIDAY(-2),
    CORPUS_CHRISTI(60);

    private final int offsetFromEaster;

    MoveableHoliday(int offsetFromEaster) {
        this.offsetFromEaster = offsetFromEaster;
    }

    public int getOffsetFromEaster() {
        return offsetFromEaster;
    }

    public LocalDate dateFor(LocalDate easterSunday) {
        return easterSunday.plusDays(offsetFromEaster);
    }
}
