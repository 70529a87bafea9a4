package com.flagship.amortization.schedule;

import com.flagship.amortization.calendar.HolidayCalendar;
import com.flagship.amortization.config.EngineSettings;
import com.flagship.amortization.exception.InvalidInstallmentCountException;
import com.flagship.amortization.exception.NegativeAmountException;
import com.flagship.amortization.exception.PlanConsistencyException;
import com.flagship.amortization.money.MoneyRounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Splits totals into installments and proportional parts, and builds stepped schedules.
 *
 * Rounding rule: every installment but the last gets {@code round(total / n)}
 * with the configured rounding mode; the last one gets whatever is left, so the
 * installments always add up to the total exactly. If rounding up would leave
 * the last installment negative the base is truncated instead, so no
 * installment is ever below zero.
 *
 * Due dates follow the periodicity from the first due date. When a calendar is
 * supplied each date is moved according to the configured
 * {@link DueDateAdjustment}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AmortizationScheduler {

    private final EngineSettings settings;

    /**
     * Splits a total into installments without business-day adjustment.
     */
    public AmortizationPlan split(BigDecimal totalAmount, int installmentCount,
                                  LocalDate firstDueDate, Periodicity periodicity) {
        return split(totalAmount, installmentCount, firstDueDate, periodicity, null);
    }

    /**
     * Splits a total into installments.
     *
     * @param totalAmount Amount to split, positive, at most two decimals
     * @param installmentCount Number of installments, at least 1
     * @param firstDueDate Nominal due date of the first installment
     * @param periodicity Spacing of the following due dates
     * @param calendar Calendar used to move dates off weekends and holidays, may be null
     * @return New plan whose installments sum to totalAmount exactly; when the count
     *         exceeds the total in cents some installments are 0.00
     * @throws InvalidInstallmentCountException if the count is not positive
     * @throws NegativeAmountException if the total is not positive
     */
    public AmortizationPlan split(BigDecimal totalAmount, int installmentCount, LocalDate firstDueDate,
                                  Periodicity periodicity, HolidayCalendar calendar) {
        if (installmentCount <= 0) {
            throw new InvalidInstallmentCountException(
                "Installment count must be at least 1: " + installmentCount);
        }
        BigDecimal total = MoneyRounding.requirePositive(totalAmount, "Total amount");
        Objects.requireNonNull(firstDueDate, "First due date is required");
        Objects.requireNonNull(periodicity, "Periodicity is required");

        MoneyRounding rounding = settings.rounding();
        BigDecimal base = rounding.divide(total, installmentCount);
        BigDecimal last = lastInstallment(total, base, installmentCount);

        if (last.signum() < 0) {
            // rounding up overshot the total, e.g. 1.00 / 200 under HALF_UP
            BigDecimal truncated = total.divide(
                BigDecimal.valueOf(installmentCount), MoneyRounding.SCALE, RoundingMode.DOWN);
            log.debug("Rounded base {} leaves a negative last installment for {} / {}, truncating to {}",
                base, total, installmentCount, truncated);
            base = truncated;
            last = lastInstallment(total, base, installmentCount);
        }

        UUID planId = UUID.randomUUID();
        List<Installment> installments = new ArrayList<>(installmentCount);
        for (int index = 0; index < installmentCount; index++) {
            BigDecimal amount = index == installmentCount - 1 ? last : base;
            LocalDate dueDate = placeDueDate(periodicity.dueDate(firstDueDate, index), calendar);
            installments.add(Installment.pending(planId, index + 1, amount, dueDate));
        }

        log.debug("Split plan: planId={}, total={}, installments={}, base={}, last={}",
            planId, total, installmentCount, base, last);

        return new AmortizationPlan(planId, total, installmentCount, firstDueDate, periodicity, installments);
    }

    public AmortizationPlan stepped(BigDecimal initialAmount, int installmentCount, StepRule rule,
                                    LocalDate firstDueDate, Periodicity periodicity) {
        return stepped(initialAmount, installmentCount, rule, firstDueDate, periodicity, null);
    }

    /**
     * Builds a schedule whose installments step up or down from an initial amount.
     *
     * The plan total is the sum of the generated installments, so the
     * conservation check of {@link #validatePlan} holds for stepped plans too.
     *
     * @param initialAmount Amount of the first installment, positive
     * @param rule Increment or growth rate, with optional floor and cap
     * @throws InvalidInstallmentCountException if the count is not positive
     * @throws NegativeAmountException if a step would take an installment below zero
     */
    public AmortizationPlan stepped(BigDecimal initialAmount, int installmentCount, StepRule rule,
                                    LocalDate firstDueDate, Periodicity periodicity, HolidayCalendar calendar) {
        if (installmentCount <= 0) {
            throw new InvalidInstallmentCountException(
                "Installment count must be at least 1: " + installmentCount);
        }
        BigDecimal initial = MoneyRounding.requirePositive(initialAmount, "Initial amount");
        Objects.requireNonNull(rule, "Step rule is required");
        Objects.requireNonNull(firstDueDate, "First due date is required");
        Objects.requireNonNull(periodicity, "Periodicity is required");

        UUID planId = UUID.randomUUID();
        List<Installment> installments = new ArrayList<>(installmentCount);
        BigDecimal total = MoneyRounding.zero();
        BigDecimal unbounded = initial;
        for (int index = 0; index < installmentCount; index++) {
            if (index > 0) {
                unbounded = rule.next(unbounded, settings.getRoundingMode());
            }
            BigDecimal amount = rule.bound(unbounded);
            if (amount.signum() < 0) {
                throw new NegativeAmountException(String.format(
                    "Stepped installment %d would be negative: %s", index + 1, amount.toPlainString()));
            }
            LocalDate dueDate = placeDueDate(periodicity.dueDate(firstDueDate, index), calendar);
            installments.add(Installment.pending(planId, index + 1, amount, dueDate));
            total = total.add(amount);
        }

        log.debug("Stepped plan: planId={}, initial={}, rule={}, installments={}, total={}",
            planId, initial, rule.getKind(), installmentCount, total);

        return new AmortizationPlan(planId, total, installmentCount, firstDueDate, periodicity, installments);
    }

    /**
     * Allocates a total across parts by percentage (rateio).
     *
     * Each part is rounded with the configured mode; the last part absorbs the
     * rounding difference so the parts add up to the total exactly.
     *
     * @param totalAmount Amount to allocate
     * @param shares Fractions of the total, non-negative, summing to exactly 1
     * @return One amount per share, in the same order
     */
    public List<BigDecimal> allocate(BigDecimal totalAmount, List<BigDecimal> shares) {
        BigDecimal total = MoneyRounding.requireNonNegative(totalAmount, "Total amount");
        if (shares == null || shares.isEmpty()) {
            throw new InvalidInstallmentCountException("At least one share is required");
        }
        BigDecimal shareSum = BigDecimal.ZERO;
        for (BigDecimal share : shares) {
            Objects.requireNonNull(share, "Share is required");
            if (share.signum() < 0) {
                throw new NegativeAmountException("Allocation shares cannot be negative: " + share.toPlainString());
            }
            shareSum = shareSum.add(share);
        }
        if (shareSum.compareTo(BigDecimal.ONE) != 0) {
            throw new IllegalArgumentException(
                "Allocation shares must add up to 100%, found " + shareSum.movePointRight(2).toPlainString() + "%");
        }

        MoneyRounding rounding = settings.rounding();
        List<BigDecimal> parts = new ArrayList<>(shares.size());
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < shares.size() - 1; i++) {
            BigDecimal part = rounding.round(total.multiply(shares.get(i)));
            parts.add(part);
            allocated = allocated.add(part);
        }
        BigDecimal remainder = total.subtract(allocated);
        if (remainder.signum() < 0) {
            throw new IllegalArgumentException(
                "Rounded allocation exceeds total " + total.toPlainString() + " by " + remainder.negate().toPlainString());
        }
        parts.add(remainder);
        return parts;
    }

    /**
     * Checks the conservation invariant and numbering of a plan.
     *
     * Residual installments are ignored: they carry balances of their parents,
     * not new principal.
     *
     * @throws PlanConsistencyException if amounts do not add up or numbers repeat
     */
    public void validatePlan(AmortizationPlan plan) {
        Objects.requireNonNull(plan, "Plan is required");
        Set<Integer> seen = new HashSet<>();
        BigDecimal sum = BigDecimal.ZERO;
        for (Installment installment : plan.getInstallments()) {
            if (installment.isResidual()) {
                continue;
            }
            if (!seen.add(installment.getSequenceNumber())) {
                throw new PlanConsistencyException(
                    "Duplicate installment number " + installment.getSequenceNumber() + " in plan " + plan.getId());
            }
            sum = sum.add(installment.getAmount());
        }
        if (sum.compareTo(plan.getTotalAmount()) != 0) {
            throw new PlanConsistencyException(String.format(
                "Installments of plan %s add up to %s but the plan total is %s",
                plan.getId(), sum.toPlainString(), plan.getTotalAmount().toPlainString()));
        }
    }

    private static BigDecimal lastInstallment(BigDecimal total, BigDecimal base, int installmentCount) {
        return total.subtract(base.multiply(BigDecimal.valueOf(installmentCount - 1L)));
    }

    private LocalDate placeDueDate(LocalDate nominal, HolidayCalendar calendar) {
        if (calendar == null) {
            return nominal;
        }
        return settings.getDueDateAdjustment().direction()
            .map(direction -> calendar.adjust(nominal, direction))
            .orElse(nominal);
    }
}
