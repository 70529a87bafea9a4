package com.flagship.amortization.cashflow;

import com.flagship.amortization.config.EngineSettings;
import com.flagship.amortization.exception.InvalidDateRangeException;
import com.flagship.amortization.money.MoneyRounding;
import com.flagship.amortization.schedule.Installment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Aggregates ledger entries into dated buckets and balances, forecasts
 * balances with recurring entries, books transfers between accounts and turns
 * balance divergences into adjustment entries.
 *
 * Balances are derived from entries, never stored. All sums are exact; the
 * only rounded figure is the group share.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashflowProjector {

    static final int SHARE_SCALE = 4;
    static final String BANK_RECONCILIATION = "Bank statement reconciliation";
    static final String TRANSFER = "TRANSFER";

    private final EngineSettings settings;

    /**
     * Daily projection over [from, to].
     *
     * One row per date that has entries, in date order. The running balance
     * starts from {@code openingBalance}; entries outside the range are ignored.
     *
     * @throws InvalidDateRangeException if to is before from
     */
    public List<CashflowDay> project(List<LedgerEntry> entries, LocalDate from, LocalDate to,
                                     BigDecimal openingBalance) {
        requireRange(from, to);
        BigDecimal running = MoneyRounding.normalize(openingBalance, "Opening balance");

        TreeMap<LocalDate, BigDecimal[]> buckets = new TreeMap<>();
        for (LedgerEntry entry : validated(entries)) {
            if (entry.getDate().isBefore(from) || entry.getDate().isAfter(to)) {
                continue;
            }
            BigDecimal[] totals = buckets.computeIfAbsent(entry.getDate(),
                date -> new BigDecimal[] {MoneyRounding.zero(), MoneyRounding.zero()});
            int slot = entry.getType() == EntryType.RECEITA ? 0 : 1;
            totals[slot] = totals[slot].add(entry.getAmount());
        }

        List<CashflowDay> days = new ArrayList<>(buckets.size());
        for (Map.Entry<LocalDate, BigDecimal[]> bucket : buckets.entrySet()) {
            BigDecimal inflow = bucket.getValue()[0];
            BigDecimal outflow = bucket.getValue()[1];
            BigDecimal daily = inflow.subtract(outflow);
            running = running.add(daily);
            days.add(new CashflowDay(bucket.getKey(), inflow, outflow, daily, running));
        }

        log.debug("Projected cash flow: from={}, to={}, days={}, closingBalance={}", from, to, days.size(), running);
        return days;
    }

    /**
     * Compares the balance the ledger computes with the bank statement.
     *
     * @return RECEITA adjustment when the statement is higher, DESPESA when lower,
     *         empty when both match
     */
    public Optional<AdjustmentEntry> reconcile(BigDecimal computedBalance, BigDecimal statementBalance,
                                               LocalDate date) {
        BigDecimal computed = MoneyRounding.normalize(computedBalance, "Computed balance");
        BigDecimal statement = MoneyRounding.normalize(statementBalance, "Statement balance");
        Objects.requireNonNull(date, "Reconciliation date is required");

        BigDecimal divergence = statement.subtract(computed);
        if (divergence.signum() == 0) {
            return Optional.empty();
        }
        EntryType type = divergence.signum() > 0 ? EntryType.RECEITA : EntryType.DESPESA;
        log.info("Balance divergence found: computed={}, statement={}, adjustment={} {}",
            computed, statement, type, divergence.abs());
        return Optional.of(new AdjustmentEntry(type, divergence.abs(), date, BANK_RECONCILIATION));
    }

    /**
     * Balance over the entries already matched against the bank.
     */
    public BigDecimal reconciledBalance(BigDecimal openingBalance, List<LedgerEntry> entries) {
        BigDecimal balance = MoneyRounding.normalize(openingBalance, "Opening balance");
        for (LedgerEntry entry : validated(entries)) {
            if (entry.isReconciled()) {
                balance = balance.add(entry.signedAmount());
            }
        }
        return balance;
    }

    /**
     * Adjustment for an entry that settled for a different amount than expected.
     *
     * A receipt that came in lower produces a DESPESA for the shortfall, higher
     * a RECEITA for the surplus. For expenses the directions are reversed.
     */
    public Optional<AdjustmentEntry> reconcileEntry(LedgerEntry entry, BigDecimal actualAmount, LocalDate date) {
        Objects.requireNonNull(entry, "Entry is required");
        Objects.requireNonNull(date, "Reconciliation date is required");
        BigDecimal actual = MoneyRounding.requireNonNegative(actualAmount, "Actual amount");

        BigDecimal difference = actual.subtract(entry.getAmount());
        if (difference.signum() == 0) {
            return Optional.empty();
        }
        boolean higher = difference.signum() > 0;
        EntryType type = higher == (entry.getType() == EntryType.RECEITA) ? EntryType.RECEITA : EntryType.DESPESA;
        String reason = String.format("Reconciliation of entry %s: settled %s than expected",
            entry.getId(), higher ? "higher" : "lower");
        return Optional.of(new AdjustmentEntry(type, difference.abs(), date, reason));
    }

    /**
     * Totals per category, cost center or account, largest movement first.
     */
    public List<GroupSummary> groupBy(List<LedgerEntry> entries, GroupingDimension dimension) {
        Objects.requireNonNull(dimension, "Grouping dimension is required");

        Map<String, BigDecimal[]> totals = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        BigDecimal totalMovement = BigDecimal.ZERO;
        for (LedgerEntry entry : validated(entries)) {
            String key = dimension.keyOf(entry);
            BigDecimal[] sums = totals.computeIfAbsent(key,
                k -> new BigDecimal[] {MoneyRounding.zero(), MoneyRounding.zero()});
            int slot = entry.getType() == EntryType.RECEITA ? 0 : 1;
            sums[slot] = sums[slot].add(entry.getAmount());
            counts.merge(key, 1, Integer::sum);
            totalMovement = totalMovement.add(entry.getAmount());
        }

        List<GroupSummary> groups = new ArrayList<>(totals.size());
        for (Map.Entry<String, BigDecimal[]> group : totals.entrySet()) {
            BigDecimal inflow = group.getValue()[0];
            BigDecimal outflow = group.getValue()[1];
            BigDecimal movement = inflow.add(outflow);
            BigDecimal share = totalMovement.signum() == 0
                ? BigDecimal.ZERO.setScale(SHARE_SCALE)
                : movement.divide(totalMovement, SHARE_SCALE, settings.getRoundingMode());
            groups.add(new GroupSummary(group.getKey(), inflow, outflow, inflow.subtract(outflow), share,
                counts.get(group.getKey())));
        }
        groups.sort(Comparator.comparing(GroupSummary::movement).reversed()
            .thenComparing(GroupSummary::getKey));
        return groups;
    }

    /**
     * Month by month receipts and expenses; each month opens with the previous month's closing balance.
     */
    public List<MonthlySummary> monthly(List<LedgerEntry> entries, BigDecimal openingBalance) {
        BigDecimal balance = MoneyRounding.normalize(openingBalance, "Opening balance");

        TreeMap<YearMonth, BigDecimal[]> months = new TreeMap<>();
        for (LedgerEntry entry : validated(entries)) {
            BigDecimal[] sums = months.computeIfAbsent(YearMonth.from(entry.getDate()),
                month -> new BigDecimal[] {MoneyRounding.zero(), MoneyRounding.zero()});
            int slot = entry.getType() == EntryType.RECEITA ? 0 : 1;
            sums[slot] = sums[slot].add(entry.getAmount());
        }

        List<MonthlySummary> summaries = new ArrayList<>(months.size());
        for (Map.Entry<YearMonth, BigDecimal[]> month : months.entrySet()) {
            BigDecimal inflow = month.getValue()[0];
            BigDecimal outflow = month.getValue()[1];
            BigDecimal closing = balance.add(inflow).subtract(outflow);
            summaries.add(new MonthlySummary(month.getKey(), balance, inflow, outflow, closing));
            balance = closing;
        }
        return summaries;
    }

    /**
     * Ledger entries for the installments still open, dated at their due dates.
     *
     * Paid, cancelled and partially paid installments are skipped; the balance
     * of a partial payment is represented by its residual.
     */
    public List<LedgerEntry> fromInstallments(List<Installment> installments, EntryType type, String category) {
        Objects.requireNonNull(installments, "Installments are required");
        Objects.requireNonNull(type, "Entry type is required");

        return installments.stream()
            .filter(installment -> installment.getStatus().isOpen())
            .sorted(Comparator.comparing(Installment::getDueDate).thenComparing(Installment.SCHEDULE_ORDER))
            .map(installment -> LedgerEntry.builder()
                .id(installment.getId())
                .type(type)
                .amount(installment.getAmount())
                .date(installment.getDueDate())
                .category(category)
                .description("Installment " + installment.label())
                .build())
            .toList();
    }

    /**
     * Occurrences of a recurring entry that fall within [from, to].
     *
     * @throws InvalidDateRangeException if to is before from
     */
    public List<LedgerEntry> occurrences(RecurringEntry recurring, LocalDate from, LocalDate to) {
        Objects.requireNonNull(recurring, "Recurring entry is required");
        requireRange(from, to);
        Objects.requireNonNull(recurring.getType(), "Entry type is required");
        Objects.requireNonNull(recurring.getFirstDate(), "First date is required");
        Objects.requireNonNull(recurring.getPeriodicity(), "Periodicity is required");
        MoneyRounding.requirePositive(recurring.getAmount(), "Recurring amount");

        LocalDate end = recurring.getLastDate() == null || recurring.getLastDate().isAfter(to)
            ? to
            : recurring.getLastDate();
        List<LedgerEntry> occurrences = new ArrayList<>();
        for (int index = 0; ; index++) {
            LocalDate date = recurring.getPeriodicity().dueDate(recurring.getFirstDate(), index);
            if (date.isAfter(end)) {
                break;
            }
            if (!date.isBefore(from) && !date.isBefore(recurring.getFirstDate())) {
                occurrences.add(recurring.occurrenceOn(date));
            }
        }
        return occurrences;
    }

    /**
     * Balance forecast over [from, to]: the entries dated in the range plus
     * every occurrence of the recurring templates.
     *
     * @throws InvalidDateRangeException if to is before from
     */
    public BalanceForecast forecast(List<LedgerEntry> entries, List<RecurringEntry> recurring,
                                    LocalDate from, LocalDate to, BigDecimal openingBalance) {
        requireRange(from, to);
        Objects.requireNonNull(recurring, "Recurring entries are required");
        BigDecimal opening = MoneyRounding.normalize(openingBalance, "Opening balance");

        List<LedgerEntry> inRange = new ArrayList<>();
        for (LedgerEntry entry : validated(entries)) {
            if (!entry.getDate().isBefore(from) && !entry.getDate().isAfter(to)) {
                inRange.add(entry);
            }
        }
        for (RecurringEntry template : recurring) {
            inRange.addAll(occurrences(template, from, to));
        }

        BigDecimal inflow = MoneyRounding.zero();
        BigDecimal outflow = MoneyRounding.zero();
        for (LedgerEntry entry : inRange) {
            if (entry.getType() == EntryType.RECEITA) {
                inflow = inflow.add(entry.getAmount());
            } else {
                outflow = outflow.add(entry.getAmount());
            }
        }
        BigDecimal closing = opening.add(inflow).subtract(outflow);

        log.debug("Balance forecast: from={}, to={}, entries={}, recurring={}, inflow={}, outflow={}, closing={}",
            from, to, inRange.size(), recurring.size(), inflow, outflow, closing);
        return new BalanceForecast(from, to, opening, inflow, outflow, closing, inRange.size());
    }

    /**
     * Moves {@code amount} from one account to another.
     *
     * Both entries share the TRANSFER category so grouping by category nets
     * them to zero; grouping by account shows the movement.
     *
     * @throws IllegalArgumentException if an account is blank or both are the same
     */
    public Transfer transfer(String fromAccount, String toAccount, BigDecimal amount, LocalDate date) {
        if (fromAccount == null || fromAccount.isBlank() || toAccount == null || toAccount.isBlank()) {
            throw new IllegalArgumentException("Both transfer accounts are required");
        }
        if (fromAccount.equals(toAccount)) {
            throw new IllegalArgumentException("Cannot transfer from account " + fromAccount + " to itself");
        }
        BigDecimal value = MoneyRounding.requirePositive(amount, "Transfer amount");
        Objects.requireNonNull(date, "Transfer date is required");

        LedgerEntry outgoing = LedgerEntry.builder()
            .id(UUID.randomUUID())
            .type(EntryType.DESPESA)
            .amount(value)
            .date(date)
            .category(TRANSFER)
            .account(fromAccount)
            .description("Transfer to " + toAccount)
            .build();
        LedgerEntry incoming = outgoing.toBuilder()
            .id(UUID.randomUUID())
            .type(EntryType.RECEITA)
            .account(toAccount)
            .description("Transfer from " + fromAccount)
            .build();

        log.info("Transfer recorded: from={}, to={}, amount={}, date={}", fromAccount, toAccount, value, date);
        return new Transfer(outgoing, incoming);
    }

    /**
     * Balance per account: opening balance plus every entry booked to it.
     *
     * Accounts with entries but no opening balance start at zero; entries
     * without an account are booked under {@link GroupingDimension#UNASSIGNED}.
     */
    public Map<String, BigDecimal> balanceByAccount(Map<String, BigDecimal> openingBalances,
                                                    List<LedgerEntry> entries) {
        Objects.requireNonNull(openingBalances, "Opening balances are required");
        Map<String, BigDecimal> balances = new TreeMap<>();
        openingBalances.forEach((account, balance) ->
            balances.put(account, MoneyRounding.normalize(balance, "Opening balance of " + account)));
        for (LedgerEntry entry : validated(entries)) {
            balances.merge(GroupingDimension.ACCOUNT.keyOf(entry), entry.signedAmount(), BigDecimal::add);
        }
        return balances;
    }

    private static void requireRange(LocalDate from, LocalDate to) {
        Objects.requireNonNull(from, "From date is required");
        Objects.requireNonNull(to, "To date is required");
        if (to.isBefore(from)) {
            throw new InvalidDateRangeException(
                String.format("Invalid projection range: %s is before %s", to, from));
        }
    }

    private List<LedgerEntry> validated(List<LedgerEntry> entries) {
        Objects.requireNonNull(entries, "Entries are required");
        for (LedgerEntry entry : entries) {
            Objects.requireNonNull(entry.getType(), "Entry type is required");
            Objects.requireNonNull(entry.getDate(), "Entry date is required");
            MoneyRounding.requireNonNegative(entry.getAmount(), "Entry amount");
        }
        return entries;
    }
}
