package com.flagship.amortization.calendar;

import com.flagship.amortization.exception.InvalidDateRangeException;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Business-day calendar built from a fixed holiday list and a set of
 * Easter-relative holidays.
 *
 * Key principles:
 * - Weekends (Saturday, Sunday) and holidays are non-business days
 * - Holiday sets are computed lazily per year and cached; cached values are immutable
 * - Adjusting an existing business day returns it unchanged
 */
@Slf4j
public class HolidayCalendar {

    private final List<MonthDay> fixedHolidays;
    private final EnumSet<MoveableHoliday> moveableHolidays;
    private final Map<Integer, CalendarYear> years = new ConcurrentHashMap<>();

    public HolidayCalendar(List<MonthDay> fixedHolidays, Set<MoveableHoliday> moveableHolidays) {
        Objects.requireNonNull(fixedHolidays, "Fixed holidays are required");
        Objects.requireNonNull(moveableHolidays, "Moveable holidays are required");
        this.fixedHolidays = List.copyOf(fixedHolidays);
        this.moveableHolidays = moveableHolidays.isEmpty()
            ? EnumSet.noneOf(MoveableHoliday.class)
            : EnumSet.copyOf(moveableHolidays);
    }

    /**
     * Calendar with the Brazilian national holidays: eight fixed dates plus
     * Carnival Tuesday, Good Friday and Corpus Christi.
     */
    public static HolidayCalendar brazilianNational() {
        return new HolidayCalendar(
            List.of(
                MonthDay.of(1, 1),    // Confraternizacao Universal
                MonthDay.of(4, 21),   // Tiradentes
                MonthDay.of(5, 1),    // Dia do Trabalho
                MonthDay.of(9, 7),    // Independencia
                MonthDay.of(10, 12),  // Nossa Senhora Aparecida
                MonthDay.of(11, 2),   // Finados
                MonthDay.of(11, 15),  // Proclamacao da Republica
                MonthDay.of(12, 25)   // Natal
            ),
            EnumSet.allOf(MoveableHoliday.class)
        );
    }

    /**
     * Returns the holiday set for a year.
     *
     * @throws com.flagship.amortization.exception.UnsupportedCalendarYearException
     *         if the year is outside the supported Easter range
     */
    public Set<LocalDate> holidaysFor(int year) {
        return calendarYear(year).dates();
    }

    public CalendarYear calendarYear(int year) {
        EasterCalculator.requireSupported(year);
        return years.computeIfAbsent(year, y -> {
            CalendarYear built = CalendarYear.of(y, fixedHolidays, moveableHolidays);
            log.debug("Built holiday calendar: year={}, easter={}, holidays={}",
                y, built.getEasterSunday(), built.dates().size());
            return built;
        });
    }

    public boolean isHoliday(LocalDate date) {
        return calendarYear(date.getYear()).isHoliday(date);
    }

    public boolean isBusinessDay(LocalDate date) {
        Objects.requireNonNull(date, "Date is required");
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        if (dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY) {
            return false;
        }
        return !isHoliday(date);
    }

    /**
     * Moves a date to the nearest business day in the given direction.
     * A date that already is a business day is returned unchanged.
     */
    public LocalDate adjust(LocalDate date, AdjustmentDirection direction) {
        Objects.requireNonNull(direction, "Adjustment direction is required");
        LocalDate adjusted = date;
        while (!isBusinessDay(adjusted)) {
            adjusted = adjusted.plusDays(direction.step());
        }
        if (!adjusted.equals(date)) {
            log.debug("Adjusted non-business day: from={}, to={}, direction={}", date, adjusted, direction);
        }
        return adjusted;
    }

    /**
     * Counts business days in the inclusive range [from, to].
     *
     * @throws InvalidDateRangeException if to is before from
     */
    public int businessDaysBetween(LocalDate from, LocalDate to) {
        Objects.requireNonNull(from, "From date is required");
        Objects.requireNonNull(to, "To date is required");
        if (to.isBefore(from)) {
            throw new InvalidDateRangeException(
                String.format("Invalid date range: %s is before %s", to, from));
        }
        int count = 0;
        for (LocalDate current = from; !current.isAfter(to); current = current.plusDays(1)) {
            if (isBusinessDay(current)) {
                count++;
            }
        }
        return count;
    }

    public List<MonthDay> getFixedHolidays() {
        return fixedHolidays;
    }

    public Set<MoveableHoliday> getMoveableHolidays() {
        return EnumSet.copyOf(moveableHolidays);
    }
}
