package com.flagship.amortization.cashflow;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Pair of entries moving money between two accounts: a DESPESA on the source
 * and a RECEITA of the same amount on the destination.
 */
@Value
public class Transfer {
    LedgerEntry outgoing;
    LedgerEntry incoming;

    public List<LedgerEntry> entries() {
        return List.of(outgoing, incoming);
    }

    /**
     * Always zero; a transfer moves balance without creating or destroying it.
     */
    public BigDecimal net() {
        return outgoing.signedAmount().add(incoming.signedAmount());
    }
}
