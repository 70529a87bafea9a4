package com.flagship.amortization.cashflow;

import java.util.function.Function;

/**
 * Attribute of a ledger entry used to group totals.
 */
public enum GroupingDimension {
    CATEGORY(LedgerEntry::getCategory),
    COST_CENTER(LedgerEntry::getCostCenter),
    ACCOUNT(LedgerEntry::getAccount);

    public static final String UNASSIGNED = "UNASSIGNED";

    private final Function<LedgerEntry, String> extractor;

    GroupingDimension(Function<LedgerEntry, String> extractor) {
        this.extractor = extractor;
    }

    public String keyOf(LedgerEntry entry) {
        String key = extractor.apply(entry);
        return key == null || key.isBlank() ? UNASSIGNED : key;
    }
}
