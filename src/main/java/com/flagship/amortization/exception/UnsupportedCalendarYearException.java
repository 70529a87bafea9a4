package com.flagship.amortization.exception;

import lombok.Getter;

/**
 * Raised when a calendar lookup is asked for a year outside the range the
 * Easter computation is valid for.
 */
@Getter
public class UnsupportedCalendarYearException extends IllegalArgumentException {

    private final int year;

    public UnsupportedCalendarYearException(int year, int minYear, int maxYear) {
        super(String.format("Calendar year %d is not supported. Supported range is %d..%d.",
            year, minYear, maxYear));
        this.year = year;
    }
}
