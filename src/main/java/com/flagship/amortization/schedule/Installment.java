package com.flagship.amortization.schedule;

import com.flagship.amortization.exception.InvalidStateTransitionException;
import com.flagship.amortization.exception.TerminalStateViolationException;
import com.flagship.amortization.money.MoneyRounding;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.UUID;

/**
 * One scheduled obligation of an amortization plan.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Invalid transitions are rejected
 * - State changes are immutable (each transition returns a new Installment)
 * - Installments are never deleted; cancellation is a terminal status
 *
 * A residual installment keeps its parent's sequence number, increments
 * {@code residualIndex} and points back through {@code parentId}.
 */
@Value
@Builder(toBuilder = true)
public class Installment {

    public static final Comparator<Installment> SCHEDULE_ORDER = Comparator
        .comparingInt(Installment::getSequenceNumber)
        .thenComparingInt(Installment::getResidualIndex);

    UUID id;
    UUID planId;
    int sequenceNumber;
    int residualIndex;
    UUID parentId;
    BigDecimal amount;
    LocalDate dueDate;
    BigDecimal paidAmount;
    LocalDate paidDate;
    InstallmentStatus status;
    String cancellationReason;

    /**
     * Creates a new installment in PENDING status.
     */
    public static Installment pending(UUID planId, int sequenceNumber, BigDecimal amount, LocalDate dueDate) {
        return Installment.builder()
            .id(UUID.randomUUID())
            .planId(planId)
            .sequenceNumber(sequenceNumber)
            .residualIndex(0)
            .amount(amount)
            .dueDate(dueDate)
            .status(InstallmentStatus.PENDING)
            .build();
    }

    /**
     * Transitions the installment to PAID.
     *
     * @param paidAmount Cumulative amount received, including earlier partial payments
     * @throws TerminalStateViolationException if already PAID or CANCELLED
     */
    public Installment markPaid(BigDecimal paidAmount, LocalDate paidDate) {
        requireTransition(InstallmentStatus.PAID, "pay");
        return toBuilder()
            .paidAmount(paidAmount)
            .paidDate(paidDate)
            .status(InstallmentStatus.PAID)
            .build();
    }

    /**
     * Transitions the installment to PARTIALLY_PAID.
     *
     * @param paidAmount Cumulative amount received so far
     */
    public Installment markPartiallyPaid(BigDecimal paidAmount, LocalDate paidDate) {
        requireTransition(InstallmentStatus.PARTIALLY_PAID, "pay");
        return toBuilder()
            .paidAmount(paidAmount)
            .paidDate(paidDate)
            .status(InstallmentStatus.PARTIALLY_PAID)
            .build();
    }

    /**
     * Transitions the installment to CANCELLED.
     *
     * @throws TerminalStateViolationException if already PAID or CANCELLED
     */
    public Installment cancel(String reason) {
        requireTransition(InstallmentStatus.CANCELLED, "cancel");
        return toBuilder()
            .status(InstallmentStatus.CANCELLED)
            .cancellationReason(reason)
            .build();
    }

    /**
     * Creates the PENDING residual that carries an unpaid balance forward.
     */
    public Installment residual(BigDecimal balance) {
        return Installment.builder()
            .id(UUID.randomUUID())
            .planId(this.planId)
            .sequenceNumber(this.sequenceNumber)
            .residualIndex(this.residualIndex + 1)
            .parentId(this.id)
            .amount(balance)
            .dueDate(this.dueDate)
            .status(InstallmentStatus.PENDING)
            .build();
    }

    /**
     * Checks if the installment is in a terminal state (no further transitions allowed).
     */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Amount received so far, zero when nothing was paid.
     */
    public BigDecimal paidSoFar() {
        return paidAmount == null ? MoneyRounding.zero() : paidAmount;
    }

    public boolean isResidual() {
        return residualIndex > 0;
    }

    /**
     * Human readable position: "3" for an original installment, "3.1" for its first residual.
     */
    public String label() {
        return residualIndex == 0 ? Integer.toString(sequenceNumber) : sequenceNumber + "." + residualIndex;
    }

    /**
     * Checks if a transition from current status to target status is allowed.
     */
    public boolean canTransitionTo(InstallmentStatus targetStatus) {
        return switch (this.status) {
            case PENDING -> true;
            case OVERDUE, PARTIALLY_PAID -> targetStatus != InstallmentStatus.PENDING;
            case PAID, CANCELLED -> false;
        };
    }

    private void requireTransition(InstallmentStatus target, String operation) {
        if (status.isTerminal()) {
            throw new TerminalStateViolationException(id, status, operation);
        }
        if (!canTransitionTo(target)) {
            throw new InvalidStateTransitionException(
                String.format("Cannot %s installment %s: %s cannot move to %s",
                    operation, label(), status, target));
        }
    }
}
