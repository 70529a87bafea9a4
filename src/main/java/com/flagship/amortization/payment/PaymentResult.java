package com.flagship.amortization.payment;

import com.flagship.amortization.accrual.AccrualBreakdown;
import com.flagship.amortization.schedule.Installment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Outcome of applying a payment: the updated installment, the residual
 * carrying any unpaid balance, and the accrual the amount due was based on.
 */
@Value
@Builder
public class PaymentResult {
    Installment installment;
    Installment residual;
    AccrualBreakdown accrual;
    BigDecimal amountDue;

    /**
     * Amount received above what was due; zero unless the payer overpaid.
     */
    BigDecimal overpayment;

    public Optional<Installment> residual() {
        return Optional.ofNullable(residual);
    }

    public boolean isFullyPaid() {
        return residual == null;
    }
}
