package com.flagship.amortization.cashflow;

import com.flagship.amortization.schedule.Periodicity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Template of an entry that repeats (rent, payroll, subscriptions).
 *
 * Occurrences are dated by {@link Periodicity} from {@code firstDate}; dates
 * before {@code firstDate} or after {@code lastDate} are never produced.
 */
@Value
@Builder
public class RecurringEntry {
    UUID id;
    EntryType type;
    BigDecimal amount;
    LocalDate firstDate;
    Periodicity periodicity;

    /**
     * Last day an occurrence may fall on; null for open-ended templates.
     */
    LocalDate lastDate;

    String category;
    String costCenter;
    String account;
    String description;

    /**
     * Projected occurrence on {@code date}, with a fresh id.
     */
    public LedgerEntry occurrenceOn(LocalDate date) {
        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .type(type)
            .amount(amount)
            .date(date)
            .category(category)
            .costCenter(costCenter)
            .account(account)
            .description(description)
            .build();
    }
}
