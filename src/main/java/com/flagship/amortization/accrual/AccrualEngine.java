package com.flagship.amortization.accrual;

import com.flagship.amortization.calendar.HolidayCalendar;
import com.flagship.amortization.config.EngineSettings;
import com.flagship.amortization.money.MoneyRounding;
import com.flagship.amortization.schedule.Installment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes penalty, interest and early-payment discount for an installment.
 *
 * Rules:
 * - on or before the due date: only the early-payment discount can apply
 * - late but within the tolerance window: nothing accrues
 * - beyond the tolerance window: one-time penalty plus daily interest over the
 *   billable days chosen by the configured {@link BillableDaysConvention}
 *
 * Billable days are grouped into periods of equal rate (tier changes in
 * PROGRESSIVE mode, dated rate changes). SIMPLE interest sums
 * amount * rate * days per period; COMPOUND carries the grown principal into
 * the next period. Values are rounded once, at the end.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccrualEngine {

    private final EngineSettings settings;

    public AccrualBreakdown accrue(Installment installment, LocalDate asOfDate, InterestPolicy policy) {
        return accrue(installment, asOfDate, policy, null);
    }

    /**
     * Computes what accrued on an installment at {@code asOfDate}.
     *
     * @param calendar Required when the policy counts business days, otherwise may be null
     * @throws com.flagship.amortization.exception.PolicyTierGapException if no tier covers a billable day
     */
    public AccrualBreakdown accrue(Installment installment, LocalDate asOfDate, InterestPolicy policy,
                                   HolidayCalendar calendar) {
        Objects.requireNonNull(installment, "Installment is required");
        Objects.requireNonNull(asOfDate, "As-of date is required");
        Objects.requireNonNull(policy, "Interest policy is required");

        BigDecimal amount = MoneyRounding.requireNonNegative(installment.getAmount(), "Installment amount");
        LocalDate dueDate = Objects.requireNonNull(installment.getDueDate(), "Installment due date is required");
        MoneyRounding rounding = settings.rounding();

        long daysLate = ChronoUnit.DAYS.between(dueDate, asOfDate);
        if (daysLate <= 0) {
            return earlyOrOnTime(amount, -daysLate, policy, rounding);
        }

        if (daysLate <= policy.getToleranceDays()) {
            log.debug("Within tolerance: installment={}, daysLate={}, toleranceDays={}",
                installment.getId(), daysLate, policy.getToleranceDays());
            return AccrualBreakdown.builder()
                .penalty(MoneyRounding.zero())
                .interest(MoneyRounding.zero())
                .discount(MoneyRounding.zero())
                .daysLate(daysLate)
                .withinTolerance(true)
                .build();
        }

        if (policy.getDayCountBasis() == DayCountBasis.BUSINESS_DAYS && calendar == null) {
            throw new IllegalArgumentException("A holiday calendar is required to count business days late");
        }

        List<RatePeriod> periods = ratePeriods(dueDate, asOfDate, daysLate, policy, calendar);
        long billableDays = periods.stream().mapToLong(RatePeriod::getDays).sum();

        BigDecimal interest = switch (policy.getAccrualModel()) {
            case SIMPLE -> simpleInterest(amount, periods);
            case COMPOUND -> compoundInterest(amount, periods);
        };
        BigDecimal penalty = policy.penalty()
            .map(amount::multiply)
            .orElse(BigDecimal.ZERO);

        AccrualBreakdown breakdown = AccrualBreakdown.builder()
            .penalty(rounding.round(penalty))
            .interest(rounding.round(interest))
            .discount(MoneyRounding.zero())
            .daysLate(daysLate)
            .billableDays(billableDays)
            .withinTolerance(false)
            .build();

        log.debug("Accrued late charges: installment={}, daysLate={}, billableDays={}, periods={}, penalty={}, interest={}",
            installment.getId(), daysLate, billableDays, periods.size(), breakdown.getPenalty(), breakdown.getInterest());

        return breakdown;
    }

    public BigDecimal amountDue(Installment installment, LocalDate asOfDate, InterestPolicy policy) {
        return amountDue(installment, asOfDate, policy, null);
    }

    /**
     * Principal plus accrued charges minus discount at {@code asOfDate}.
     */
    public BigDecimal amountDue(Installment installment, LocalDate asOfDate, InterestPolicy policy,
                                HolidayCalendar calendar) {
        AccrualBreakdown breakdown = accrue(installment, asOfDate, policy, calendar);
        return installment.getAmount().add(breakdown.netAdjustment());
    }

    private AccrualBreakdown earlyOrOnTime(BigDecimal amount, long daysEarly, InterestPolicy policy,
                                           MoneyRounding rounding) {
        BigDecimal discount = MoneyRounding.zero();
        if (daysEarly > 0 && policy.earlyPaymentDiscount().isPresent()) {
            BigDecimal raw = amount
                .multiply(policy.getEarlyPaymentDiscountRate())
                .multiply(BigDecimal.valueOf(daysEarly));
            discount = rounding.round(raw.min(amount)).min(amount);
        }
        return AccrualBreakdown.builder()
            .penalty(MoneyRounding.zero())
            .interest(MoneyRounding.zero())
            .discount(discount)
            .daysEarly(daysEarly)
            .build();
    }

    private List<RatePeriod> ratePeriods(LocalDate dueDate, LocalDate asOfDate, long daysLate,
                                         InterestPolicy policy, HolidayCalendar calendar) {
        LocalDate windowStart = switch (settings.getBillableDaysConvention()) {
            case FULL_DAYS_LATE -> dueDate;
            case DAYS_BEYOND_TOLERANCE -> dueDate.plusDays(policy.getToleranceDays());
        };
        boolean businessDaysOnly = policy.getDayCountBasis() == DayCountBasis.BUSINESS_DAYS;
        BigDecimal flatRate = policy.getTierMode() == TierMode.FLAT
            ? policy.tierFor(daysLate).getDailyRate()
            : null;

        List<RatePeriod> periods = new ArrayList<>();
        RatePeriod current = null;
        for (LocalDate day = windowStart.plusDays(1); !day.isAfter(asOfDate); day = day.plusDays(1)) {
            if (businessDaysOnly && !calendar.isBusinessDay(day)) {
                continue;
            }
            BigDecimal rate = rateFor(day, dueDate, flatRate, policy);
            if (current != null && current.getRate().compareTo(rate) == 0) {
                current.addDay();
            } else {
                current = new RatePeriod(rate);
                periods.add(current);
            }
        }
        return periods;
    }

    private BigDecimal rateFor(LocalDate day, LocalDate dueDate, BigDecimal flatRate, InterestPolicy policy) {
        BigDecimal tierRate = flatRate != null
            ? flatRate
            : policy.tierFor(ChronoUnit.DAYS.between(dueDate, day)).getDailyRate();
        return policy.rateChangeFor(day)
            .map(RateChange::getDailyRate)
            .orElse(tierRate);
    }

    private BigDecimal simpleInterest(BigDecimal amount, List<RatePeriod> periods) {
        BigDecimal interest = BigDecimal.ZERO;
        for (RatePeriod period : periods) {
            interest = interest.add(amount
                .multiply(period.getRate())
                .multiply(BigDecimal.valueOf(period.getDays())));
        }
        return interest;
    }

    private BigDecimal compoundInterest(BigDecimal amount, List<RatePeriod> periods) {
        BigDecimal principal = amount;
        for (RatePeriod period : periods) {
            BigDecimal growth = BigDecimal.ONE.add(period.getRate())
                .pow(Math.toIntExact(period.getDays()), MoneyRounding.CALCULATION_CONTEXT);
            principal = principal.multiply(growth, MoneyRounding.CALCULATION_CONTEXT);
        }
        return principal.subtract(amount);
    }

    /**
     * Run of consecutive billable days sharing one daily rate.
     */
    private static final class RatePeriod {
        private final BigDecimal rate;
        private long days = 1;

        private RatePeriod(BigDecimal rate) {
            this.rate = rate;
        }

        BigDecimal getRate() {
            return rate;
        }

        long getDays() {
            return days;
        }

        void addDay() {
            days++;
        }
    }
}
