package com.flagship.amortization.cashflow;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A dated cash movement as handed to the projector by the caller's ledger.
 *
 * Amounts are always positive; the direction comes from {@link EntryType}.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntry {
    UUID id;
    EntryType type;
    BigDecimal amount;
    LocalDate date;
    String category;
    String costCenter;
    String account;
    String description;
    boolean reconciled;

    public BigDecimal signedAmount() {
        return type.signed(amount);
    }
}
