package com.flagship.amortization.cashflow;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Synthetic entry that equalizes a computed balance with an observed one.
 *
 * Owned by the caller's ledger once emitted.
 */
@Value
public class AdjustmentEntry {
    EntryType type;
    BigDecimal amount;
    LocalDate date;
    String reason;

    public LedgerEntry toLedgerEntry(UUID id, String account) {
        return LedgerEntry.builder()
            .id(id)
            .type(type)
            .amount(amount)
            .date(date)
            .category("RECONCILIATION")
            .account(account)
            .description(reason)
            .reconciled(true)
            .build();
    }
}
