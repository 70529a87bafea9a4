package com.flagship.amortization.calendar;

import com.flagship.amortization.exception.UnsupportedCalendarYearException;

import java.time.LocalDate;

/**
 * Gregorian Easter Sunday using the anonymous Gauss / Butcher-Meeus algorithm.
 *
 * Integer arithmetic only. Valid from the first Gregorian Easter (1583) up to
 * 4099, beyond which the published tables stop.
 */
public final class EasterCalculator {

    public static final int MIN_YEAR = 1583;
    public static final int MAX_YEAR = 4099;

    private EasterCalculator() {
        // Utility class
    }

    public static LocalDate easterSunday(int year) {
        requireSupported(year);

        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;

        return LocalDate.of(year, month, day);
    }

    public static boolean isSupported(int year) {
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }

    static void requireSupported(int year) {
        if (!isSupported(year)) {
            throw new UnsupportedCalendarYearException(year, MIN_YEAR, MAX_YEAR);
        }
    }
}
