package com.flagship.amortization.config;

import com.flagship.amortization.accrual.BillableDaysConvention;
import com.flagship.amortization.calendar.HolidayCalendar;
import com.flagship.amortization.calendar.MoveableHoliday;
import com.flagship.amortization.schedule.DueDateAdjustment;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.RoundingMode;
import java.time.Month;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Externalized engine options, bound from {@code amortization.*}.
 *
 * Example:
 * <pre>
 * amortization:
 *   rounding-mode: HALF_UP
 *   due-date-adjustment: NEXT_BUSINESS_DAY
 *   billable-days-convention: FULL_DAYS_LATE
 *   calendar:
 *     fixed-holidays: ["01-01", "04-21"]
 *     moveable-holidays: [GOOD_FRIDAY]
 * </pre>
 *
 * Services never read this class directly; it is converted once into
 * {@link EngineSettings} and a {@link HolidayCalendar}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "amortization")
public class EngineProperties {

    @NotNull
    private RoundingMode roundingMode;

    @NotNull
    private DueDateAdjustment dueDateAdjustment;

    @NotNull
    private BillableDaysConvention billableDaysConvention;

    @Valid
    @NotNull
    private CalendarProperties calendar = new CalendarProperties();

    @Data
    public static class CalendarProperties {

        static final String MONTH_DAY_PATTERN = "(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])";

        /**
         * Fixed holidays as MM-dd.
         */
        @NotNull
        private List<@Pattern(regexp = MONTH_DAY_PATTERN) String> fixedHolidays = new ArrayList<>();

        @NotNull
        private Set<MoveableHoliday> moveableHolidays = EnumSet.noneOf(MoveableHoliday.class);

        /**
         * Well-formed values must also exist in a leap year: 02-29 passes, 02-30 and 04-31 do not.
         * Malformed values are left to the pattern constraint.
         */
        @AssertTrue(message = "fixed holidays must be days that exist in the calendar")
        public boolean isFixedHolidaysInCalendar() {
            if (fixedHolidays == null) {
                return true;
            }
            return fixedHolidays.stream()
                .filter(value -> value != null && value.matches(MONTH_DAY_PATTERN))
                .allMatch(value -> Integer.parseInt(value.substring(3))
                    <= Month.of(Integer.parseInt(value.substring(0, 2))).maxLength());
        }
    }

    public EngineSettings toSettings() {
        return EngineSettings.builder()
            .roundingMode(roundingMode)
            .dueDateAdjustment(dueDateAdjustment)
            .billableDaysConvention(billableDaysConvention)
            .build();
    }

    public HolidayCalendar toCalendar() {
        List<MonthDay> fixed = calendar.getFixedHolidays().stream()
            .map(value -> MonthDay.parse("--" + value))
            .toList();
        return new HolidayCalendar(fixed, calendar.getMoveableHolidays());
    }
}
