package com.flagship.amortization.cashflow;

import java.math.BigDecimal;

/**
 * Direction of a cash-flow entry.
 */
public enum EntryType {
    /**
     * Money in (receita).
     */
    RECEITA,

    /**
     * Money out (despesa).
     */
    DESPESA;

    /**
     * Amount with the sign it has on a balance: positive for RECEITA, negative for DESPESA.
     */
    public BigDecimal signed(BigDecimal amount) {
        return this == RECEITA ? amount : amount.negate();
    }
}
