package com.flagship.amortization.calendar;

import lombok.Value;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Holidays of a single year: fixed month/day holidays plus the Easter-derived ones.
 *
 * Built once per year and never mutated.
 */
@Value
public class CalendarYear {
    int year;
    LocalDate easterSunday;
    Map<LocalDate, String> holidays;

    public static CalendarYear of(int year, Collection<MonthDay> fixedHolidays,
                                  Collection<MoveableHoliday> moveableHolidays) {
        LocalDate easter = EasterCalculator.easterSunday(year);
        TreeMap<LocalDate, String> holidays = new TreeMap<>();

        for (MonthDay fixed : fixedHolidays) {
            if (fixed.isValidYear(year)) {
                holidays.put(fixed.atYear(year), "FIXED " + fixed);
            }
        }
        for (MoveableHoliday moveable : moveableHolidays) {
            holidays.put(moveable.dateFor(easter), moveable.name());
        }

        return new CalendarYear(year, easter, Collections.unmodifiableMap(holidays));
    }

    public Set<LocalDate> dates() {
        return holidays.keySet();
    }

    public boolean isHoliday(LocalDate date) {
        return holidays.containsKey(date);
    }
}
