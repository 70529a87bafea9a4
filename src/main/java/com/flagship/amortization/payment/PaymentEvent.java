package com.flagship.amortization.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A payment received against one installment. Consumed once.
 */
@Value
public class PaymentEvent {
    UUID installmentId;
    BigDecimal amountPaid;
    LocalDate paymentDate;

    public static PaymentEvent of(UUID installmentId, BigDecimal amountPaid, LocalDate paymentDate) {
        return new PaymentEvent(installmentId, amountPaid, paymentDate);
    }
}
