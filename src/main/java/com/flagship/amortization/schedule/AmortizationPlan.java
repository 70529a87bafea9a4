package com.flagship.amortization.schedule;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A total split into installments.
 *
 * Immutable once its installments are materialized; regenerating a schedule
 * creates a new plan with a new id.
 *
 * Invariant: sum of installment amounts equals totalAmount exactly.
 */
@Value
public class AmortizationPlan {
    UUID id;
    BigDecimal totalAmount;
    int installmentCount;
    LocalDate firstDueDate;
    Periodicity periodicity;
    List<Installment> installments;

    public AmortizationPlan(UUID id, BigDecimal totalAmount, int installmentCount, LocalDate firstDueDate,
                            Periodicity periodicity, List<Installment> installments) {
        this.id = id;
        this.totalAmount = totalAmount;
        this.installmentCount = installmentCount;
        this.firstDueDate = firstDueDate;
        this.periodicity = periodicity;
        this.installments = List.copyOf(installments);
    }

    public BigDecimal installmentTotal() {
        return installments.stream()
            .map(Installment::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Installment installment(int sequenceNumber) {
        return installments.stream()
            .filter(installment -> installment.getSequenceNumber() == sequenceNumber && !installment.isResidual())
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Installment not found: " + sequenceNumber));
    }
}
