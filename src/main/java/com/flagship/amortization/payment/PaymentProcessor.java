package com.flagship.amortization.payment;

import com.flagship.amortization.accrual.AccrualBreakdown;
import com.flagship.amortization.accrual.AccrualEngine;
import com.flagship.amortization.accrual.InterestPolicy;
import com.flagship.amortization.calendar.HolidayCalendar;
import com.flagship.amortization.exception.TerminalStateViolationException;
import com.flagship.amortization.money.MoneyRounding;
import com.flagship.amortization.schedule.Installment;
import com.flagship.amortization.schedule.InstallmentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Applies payment and cancellation events to installments.
 *
 * State machine:
 * - PENDING / OVERDUE → PAID when the payment covers the amount due
 * - PENDING / OVERDUE → PARTIALLY_PAID otherwise, with a PENDING residual for the balance
 * - PARTIALLY_PAID → PAID once the payments received cover the amount due,
 *   PARTIALLY_PAID again while they fall short
 * - any non-terminal status → CANCELLED
 * - PAID and CANCELLED are terminal
 *
 * OVERDUE is derived by {@link #statusAsOf}; it is not a stored transition.
 *
 * The processor holds no state. Concurrent payments against the same
 * installment must be serialized by the caller's storage layer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentProcessor {

    private final AccrualEngine accrualEngine;

    public PaymentResult pay(Installment installment, PaymentEvent event, InterestPolicy policy) {
        return pay(installment, event, policy, null);
    }

    /**
     * Applies a payment to an installment.
     *
     * 1. Rejects PAID and CANCELLED installments
     * 2. Accrues penalty, interest and discount at the payment date
     * 3. amountDue = amount + penalty + interest - discount, and the
     *    outstanding balance is amountDue minus what earlier partial payments
     *    already brought in
     * 4. A payment covering the outstanding balance marks PAID; a short one
     *    marks PARTIALLY_PAID and emits a residual installment for what is
     *    still owed, same due date
     *
     * Paying a PARTIALLY_PAID installment directly settles the balance its
     * earlier residual was carrying. That residual is superseded by the
     * result and the caller cancels it.
     *
     * @param calendar Needed only when the policy counts business days
     * @return Updated installment, optional residual and the accrual used
     * @throws TerminalStateViolationException if the installment is PAID or CANCELLED
     * @throws com.flagship.amortization.exception.NegativeAmountException if the amount paid is not positive
     */
    public PaymentResult pay(Installment installment, PaymentEvent event, InterestPolicy policy,
                             HolidayCalendar calendar) {
        Objects.requireNonNull(installment, "Installment is required");
        Objects.requireNonNull(event, "Payment event is required");

        if (installment.isTerminal()) {
            log.warn("Rejected payment on terminal installment: installmentId={}, status={}",
                installment.getId(), installment.getStatus());
            throw new TerminalStateViolationException(installment.getId(), installment.getStatus(), "pay");
        }
        if (!installment.getId().equals(event.getInstallmentId())) {
            throw new IllegalArgumentException(String.format(
                "Payment event references installment %s but was applied to %s",
                event.getInstallmentId(), installment.getId()));
        }
        BigDecimal amountPaid = MoneyRounding.requirePositive(event.getAmountPaid(), "Amount paid");
        LocalDate paymentDate = Objects.requireNonNull(event.getPaymentDate(), "Payment date is required");

        AccrualBreakdown accrual = accrualEngine.accrue(installment, paymentDate, policy, calendar);
        BigDecimal amountDue = installment.getAmount().add(accrual.netAdjustment());
        BigDecimal previouslyPaid = installment.paidSoFar();
        BigDecimal outstanding = amountDue.subtract(previouslyPaid).max(MoneyRounding.zero());

        if (amountPaid.compareTo(outstanding) >= 0) {
            Installment paid = installment.markPaid(previouslyPaid.add(outstanding), paymentDate);
            BigDecimal overpayment = amountPaid.subtract(outstanding);
            log.info("Installment paid: installmentId={}, label={}, amountDue={}, previouslyPaid={}, overpayment={}",
                paid.getId(), paid.label(), amountDue, previouslyPaid, overpayment);
            return PaymentResult.builder()
                .installment(paid)
                .accrual(accrual)
                .amountDue(amountDue)
                .overpayment(overpayment)
                .build();
        }

        Installment partiallyPaid = installment.markPartiallyPaid(previouslyPaid.add(amountPaid), paymentDate);
        Installment residual = partiallyPaid.residual(outstanding.subtract(amountPaid));
        log.info("Installment partially paid: installmentId={}, label={}, paid={}, totalPaid={}, residualId={}, residualAmount={}",
            partiallyPaid.getId(), partiallyPaid.label(), amountPaid, partiallyPaid.getPaidAmount(),
            residual.getId(), residual.getAmount());

        return PaymentResult.builder()
            .installment(partiallyPaid)
            .residual(residual)
            .accrual(accrual)
            .amountDue(amountDue)
            .overpayment(MoneyRounding.zero())
            .build();
    }

    /**
     * Cancels an installment.
     *
     * @throws TerminalStateViolationException if the installment is PAID or already CANCELLED
     * @throws IllegalArgumentException if the reason is blank
     */
    public Installment cancel(Installment installment, String reason) {
        Objects.requireNonNull(installment, "Installment is required");
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Cancellation reason is required");
        }
        if (installment.isTerminal()) {
            log.warn("Rejected cancellation of terminal installment: installmentId={}, status={}",
                installment.getId(), installment.getStatus());
            throw new TerminalStateViolationException(installment.getId(), installment.getStatus(), "cancel");
        }
        Installment cancelled = installment.cancel(reason);
        log.info("Installment cancelled: installmentId={}, label={}, reason={}",
            cancelled.getId(), cancelled.label(), reason);
        return cancelled;
    }

    /**
     * Status as seen on {@code date}: a PENDING installment past its tolerance
     * window reads as OVERDUE. Other statuses are returned as stored.
     */
    public InstallmentStatus statusAsOf(Installment installment, LocalDate date, InterestPolicy policy) {
        Objects.requireNonNull(installment, "Installment is required");
        Objects.requireNonNull(date, "Date is required");
        Objects.requireNonNull(policy, "Interest policy is required");
        if (installment.getStatus() != InstallmentStatus.PENDING) {
            return installment.getStatus();
        }
        long daysLate = ChronoUnit.DAYS.between(installment.getDueDate(), date);
        return daysLate > policy.getToleranceDays() ? InstallmentStatus.OVERDUE : InstallmentStatus.PENDING;
    }
}
