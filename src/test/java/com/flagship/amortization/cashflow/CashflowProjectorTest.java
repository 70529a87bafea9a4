package com.flagship.amortization.cashflow;

import com.flagship.amortization.accrual.BillableDaysConvention;
import com.flagship.amortization.config.EngineSettings;
import com.flagship.amortization.exception.InvalidDateRangeException;
import com.flagship.amortization.exception.NegativeAmountException;
import com.flagship.amortization.schedule.DueDateAdjustment;
import com.flagship.amortization.schedule.Installment;
import com.flagship.amortization.schedule.Periodicity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cash-flow projection, grouping and reconciliation.
 *
 * These tests verify that:
 * - Running balances chain from the opening balance day after day
 * - Divergences turn into RECEITA or DESPESA adjustments of the right size
 * - Group totals and shares cover every entry
 * - Forecasts include recurring entries and transfers net to zero
 */
class CashflowProjectorTest {

    private CashflowProjector projector;
    private List<LedgerEntry> entries;

    @BeforeEach
    void setUp() {
        projector = new CashflowProjector(EngineSettings.builder()
            .roundingMode(RoundingMode.HALF_UP)
            .dueDateAdjustment(DueDateAdjustment.NONE)
            .billableDaysConvention(BillableDaysConvention.FULL_DAYS_LATE)
            .build());

        entries = List.of(
            entry(EntryType.RECEITA, "1000.00", LocalDate.of(2023, 3, 1), "Sales", "Commercial", true),
            entry(EntryType.DESPESA, "200.00", LocalDate.of(2023, 3, 1), "Rent", "Admin", true),
            entry(EntryType.DESPESA, "300.00", LocalDate.of(2023, 3, 5), "Payroll", null, false),
            entry(EntryType.RECEITA, "500.00", LocalDate.of(2023, 3, 10), "Sales", "Commercial", false),
            entry(EntryType.DESPESA, "100.00", LocalDate.of(2023, 4, 2), "Rent", "Admin", false)
        );
    }

    private static LedgerEntry entry(EntryType type, String amount, LocalDate date, String category,
                                     String costCenter, boolean reconciled) {
        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .type(type)
            .amount(new BigDecimal(amount))
            .date(date)
            .category(category)
            .costCenter(costCenter)
            .account("Checking")
            .reconciled(reconciled)
            .build();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @Test
    @DisplayName("Daily projection chains running balances from the opening balance")
    void testProject() {
        printTestHeader("Daily Projection");

        LocalDate from = LocalDate.of(2023, 3, 1);
        LocalDate to = LocalDate.of(2023, 3, 31);
        printInput("Range", from + " .. " + to);
        printInput("Opening balance", "100.00");

        List<CashflowDay> days = projector.project(entries, from, to, new BigDecimal("100.00"));
        days.forEach(day -> printOutput(day.getDate().toString(), day));

        assertEquals(3, days.size());
        assertEquals(List.of(LocalDate.of(2023, 3, 1), LocalDate.of(2023, 3, 5), LocalDate.of(2023, 3, 10)),
            days.stream().map(CashflowDay::getDate).toList());

        CashflowDay first = days.get(0);
        assertEquals(new BigDecimal("1000.00"), first.getInflow());
        assertEquals(new BigDecimal("200.00"), first.getOutflow());
        assertEquals(new BigDecimal("800.00"), first.getDailyBalance());
        assertEquals(new BigDecimal("900.00"), first.getRunningBalance());

        CashflowDay second = days.get(1);
        assertEquals(new BigDecimal("0.00"), second.getInflow());
        assertEquals(new BigDecimal("-300.00"), second.getDailyBalance());
        assertEquals(new BigDecimal("600.00"), second.getRunningBalance());

        assertEquals(new BigDecimal("1100.00"), days.get(2).getRunningBalance());
        for (int i = 1; i < days.size(); i++) {
            assertEquals(days.get(i - 1).getRunningBalance().add(days.get(i).getDailyBalance()),
                days.get(i).getRunningBalance());
        }
        printSuccess("April entry left out of the March projection");
    }

    @Test
    @DisplayName("Projection over a range without entries is empty")
    void testProjectEmptyRange() {
        printTestHeader("Empty Projection");

        List<CashflowDay> days = projector.project(entries, LocalDate.of(2023, 6, 1), LocalDate.of(2023, 6, 30),
            BigDecimal.ZERO);

        assertTrue(days.isEmpty());
        assertTrue(projector.project(List.of(), LocalDate.of(2023, 6, 1), LocalDate.of(2023, 6, 1), BigDecimal.ZERO)
            .isEmpty());
    }

    @Test
    @DisplayName("Reversed projection range is rejected")
    void testProjectReversedRange() {
        printTestHeader("Reversed Range");

        InvalidDateRangeException exception = assertThrows(InvalidDateRangeException.class,
            () -> projector.project(entries, LocalDate.of(2023, 3, 31), LocalDate.of(2023, 3, 1), BigDecimal.ZERO));
        printExpectedException("InvalidDateRangeException", exception.getMessage());
    }

    @Test
    @DisplayName("Negative entry amounts are rejected")
    void testNegativeEntry() {
        printTestHeader("Negative Entry");

        List<LedgerEntry> invalid = List.of(
            entry(EntryType.RECEITA, "-10.00", LocalDate.of(2023, 3, 1), "Sales", null, false));

        assertThrows(NegativeAmountException.class,
            () -> projector.project(invalid, LocalDate.of(2023, 3, 1), LocalDate.of(2023, 3, 31), BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Statement above the computed balance yields a RECEITA adjustment")
    void testReconcile() {
        printTestHeader("Bank Reconciliation");

        LocalDate date = LocalDate.of(2023, 3, 31);
        printInput("Computed", "1000.00");
        printInput("Statement", "1050.00");

        AdjustmentEntry receipt = projector.reconcile(new BigDecimal("1000.00"), new BigDecimal("1050.00"), date)
            .orElseThrow();
        AdjustmentEntry expense = projector.reconcile(new BigDecimal("1000.00"), new BigDecimal("950.00"), date)
            .orElseThrow();
        printOutput("Adjustment", receipt);

        assertEquals(EntryType.RECEITA, receipt.getType());
        assertEquals(new BigDecimal("50.00"), receipt.getAmount());
        assertEquals(date, receipt.getDate());
        assertEquals(EntryType.DESPESA, expense.getType());
        assertEquals(new BigDecimal("50.00"), expense.getAmount());
        assertTrue(projector.reconcile(new BigDecimal("1000.00"), new BigDecimal("1000"), date).isEmpty());

        BigDecimal adjusted = new BigDecimal("1000.00").add(expense.toLedgerEntry(UUID.randomUUID(), "Checking").signedAmount());
        assertEquals(new BigDecimal("950.00"), adjusted);
        printSuccess("Applying the adjustment closes the gap");
    }

    @Test
    @DisplayName("Reconciled balance counts only matched entries")
    void testReconciledBalance() {
        printTestHeader("Reconciled Balance");

        BigDecimal balance = projector.reconciledBalance(new BigDecimal("100.00"), entries);
        printOutput("Reconciled balance", balance);

        assertEquals(new BigDecimal("900.00"), balance);
    }

    @Test
    @DisplayName("Entry settled for a different amount produces an adjustment in the right direction")
    void testReconcileEntry() {
        printTestHeader("Entry Reconciliation");

        LedgerEntry receipt = entries.get(0);
        LedgerEntry expense = entries.get(2);
        LocalDate date = LocalDate.of(2023, 3, 31);

        Optional<AdjustmentEntry> shortReceipt = projector.reconcileEntry(receipt, new BigDecimal("950.00"), date);
        Optional<AdjustmentEntry> extraReceipt = projector.reconcileEntry(receipt, new BigDecimal("1010.00"), date);
        Optional<AdjustmentEntry> higherExpense = projector.reconcileEntry(expense, new BigDecimal("320.00"), date);
        Optional<AdjustmentEntry> lowerExpense = projector.reconcileEntry(expense, new BigDecimal("280.00"), date);
        printOutput("Short receipt", shortReceipt);
        printOutput("Higher expense", higherExpense);

        assertEquals(EntryType.DESPESA, shortReceipt.orElseThrow().getType());
        assertEquals(new BigDecimal("50.00"), shortReceipt.orElseThrow().getAmount());
        assertEquals(EntryType.RECEITA, extraReceipt.orElseThrow().getType());
        assertEquals(new BigDecimal("10.00"), extraReceipt.orElseThrow().getAmount());
        assertEquals(EntryType.DESPESA, higherExpense.orElseThrow().getType());
        assertEquals(new BigDecimal("20.00"), higherExpense.orElseThrow().getAmount());
        assertEquals(EntryType.RECEITA, lowerExpense.orElseThrow().getType());
        assertTrue(projector.reconcileEntry(receipt, new BigDecimal("1000.00"), date).isEmpty());
        printSuccess("Directions reversed for expenses");
    }

    @Test
    @DisplayName("Grouping by category sorts by movement and computes shares")
    void testGroupByCategory() {
        printTestHeader("Group By Category");

        List<GroupSummary> groups = projector.groupBy(entries, GroupingDimension.CATEGORY);
        groups.forEach(group -> printOutput(group.getKey(), group));

        assertEquals(List.of("Sales", "Payroll", "Rent"), groups.stream().map(GroupSummary::getKey).toList());

        GroupSummary sales = groups.get(0);
        assertEquals(new BigDecimal("1500.00"), sales.getInflow());
        assertEquals(new BigDecimal("1500.00"), sales.getNet());
        assertEquals(new BigDecimal("0.7143"), sales.getShare());
        assertEquals(2, sales.getEntryCount());

        GroupSummary rent = groups.get(2);
        assertEquals(new BigDecimal("300.00"), rent.getOutflow());
        assertEquals(new BigDecimal("-300.00"), rent.getNet());
        assertEquals(new BigDecimal("0.1429"), rent.getShare());
        printSuccess("Three categories, largest first");
    }

    @Test
    @DisplayName("Entries without a cost center are grouped as UNASSIGNED")
    void testGroupByCostCenter() {
        printTestHeader("Group By Cost Center");

        List<GroupSummary> groups = projector.groupBy(entries, GroupingDimension.COST_CENTER);
        groups.forEach(group -> printOutput(group.getKey(), group));

        assertEquals(List.of("Commercial", "Admin", GroupingDimension.UNASSIGNED),
            groups.stream().map(GroupSummary::getKey).toList());
        assertEquals(5, groups.stream().mapToInt(GroupSummary::getEntryCount).sum());
        assertEquals(1, projector.groupBy(entries, GroupingDimension.ACCOUNT).size());
    }

    @Test
    @DisplayName("Monthly summary chains closing balances into the next month")
    void testMonthly() {
        printTestHeader("Monthly Summary");

        List<MonthlySummary> months = projector.monthly(entries, new BigDecimal("100.00"));
        months.forEach(month -> printOutput(month.getMonth().toString(), month));

        assertEquals(2, months.size());
        MonthlySummary march = months.get(0);
        assertEquals(YearMonth.of(2023, 3), march.getMonth());
        assertEquals(new BigDecimal("100.00"), march.getOpeningBalance());
        assertEquals(new BigDecimal("1500.00"), march.getInflow());
        assertEquals(new BigDecimal("500.00"), march.getOutflow());
        assertEquals(new BigDecimal("1100.00"), march.getClosingBalance());

        MonthlySummary april = months.get(1);
        assertEquals(march.getClosingBalance(), april.getOpeningBalance());
        assertEquals(new BigDecimal("1000.00"), april.getClosingBalance());
        printSuccess("April opens with March's closing balance");
    }

    @Test
    @DisplayName("Only open installments become projected entries")
    void testFromInstallments() {
        printTestHeader("Entries From Installments");

        UUID planId = UUID.randomUUID();
        Installment paid = Installment.pending(planId, 1, new BigDecimal("100.00"), LocalDate.of(2023, 3, 10))
            .markPaid(new BigDecimal("100.00"), LocalDate.of(2023, 3, 10));
        Installment partiallyPaid = Installment.pending(planId, 2, new BigDecimal("100.00"), LocalDate.of(2023, 4, 10))
            .markPartiallyPaid(new BigDecimal("60.00"), LocalDate.of(2023, 4, 10));
        Installment residual = partiallyPaid.residual(new BigDecimal("40.00"));
        Installment pending = Installment.pending(planId, 3, new BigDecimal("100.00"), LocalDate.of(2023, 5, 10));
        Installment cancelled = Installment.pending(planId, 4, new BigDecimal("100.00"), LocalDate.of(2023, 6, 10))
            .cancel("Renegotiated");

        List<LedgerEntry> projected = projector.fromInstallments(
            List.of(pending, cancelled, residual, paid, partiallyPaid), EntryType.RECEITA, "Receivables");
        projected.forEach(entry -> printOutput(entry.getDescription(), entry.getAmount() + " on " + entry.getDate()));

        assertEquals(2, projected.size());
        assertEquals(residual.getId(), projected.get(0).getId());
        assertEquals(new BigDecimal("40.00"), projected.get(0).getAmount());
        assertEquals("Installment 2.1", projected.get(0).getDescription());
        assertEquals(LocalDate.of(2023, 5, 10), projected.get(1).getDate());
        assertEquals("Receivables", projected.get(1).getCategory());

        List<CashflowDay> days = projector.project(projected, LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31),
            BigDecimal.ZERO);
        assertEquals(new BigDecimal("140.00"), days.get(days.size() - 1).getRunningBalance());
        printSuccess("Receivables projected at their due dates");
    }

    private static RecurringEntry monthlyTemplate(EntryType type, String amount, LocalDate firstDate,
                                                  String description) {
        return RecurringEntry.builder()
            .id(UUID.randomUUID())
            .type(type)
            .amount(new BigDecimal(amount))
            .firstDate(firstDate)
            .periodicity(Periodicity.monthly())
            .account("Checking")
            .description(description)
            .build();
    }

    @Test
    @DisplayName("Balance forecast adds recurring entries projected into the month")
    void testForecastWithRecurringEntries() {
        printTestHeader("Forecast With Recurring Entries");

        LocalDate from = LocalDate.of(2023, 5, 1);
        LocalDate to = LocalDate.of(2023, 5, 31);
        List<LedgerEntry> scheduled = List.of(
            entry(EntryType.RECEITA, "1500.00", from.plusDays(10), "Sales", null, false),
            entry(EntryType.DESPESA, "800.00", from.plusDays(15), "Suppliers", null, false),
            entry(EntryType.RECEITA, "9999.00", LocalDate.of(2023, 6, 2), "Sales", null, false));
        List<RecurringEntry> recurring = List.of(
            monthlyTemplate(EntryType.RECEITA, "2000.00", LocalDate.of(2023, 1, 20), "Rent received"),
            monthlyTemplate(EntryType.DESPESA, "1200.00", LocalDate.of(2023, 1, 5), "Salary"));
        printInput("Range", from + " .. " + to);

        BalanceForecast forecast = projector.forecast(scheduled, recurring, from, to, BigDecimal.ZERO);
        printOutput("Inflow", forecast.getInflow());
        printOutput("Outflow", forecast.getOutflow());
        printOutput("Net", forecast.net());

        assertEquals(new BigDecimal("3500.00"), forecast.getInflow());
        assertEquals(new BigDecimal("2000.00"), forecast.getOutflow());
        assertEquals(new BigDecimal("1500.00"), forecast.net());
        assertEquals(new BigDecimal("1500.00"), forecast.getClosingBalance());
        assertEquals(4, forecast.getEntryCount());

        BalanceForecast quarter = projector.forecast(List.of(), recurring,
            LocalDate.of(2023, 4, 1), LocalDate.of(2023, 6, 30), new BigDecimal("100.00"));
        assertEquals(new BigDecimal("6000.00"), quarter.getInflow());
        assertEquals(new BigDecimal("3600.00"), quarter.getOutflow());
        assertEquals(new BigDecimal("2500.00"), quarter.getClosingBalance());
        printSuccess("1500 + 2000 in, 800 + 1200 out");
    }

    @Test
    @DisplayName("Recurring occurrences respect the first and last dates of the template")
    void testRecurringOccurrences() {
        printTestHeader("Recurring Occurrences");

        RecurringEntry subscription = monthlyTemplate(EntryType.DESPESA, "49.90", LocalDate.of(2023, 1, 31),
            "Subscription");
        List<LedgerEntry> occurrences = projector.occurrences(subscription,
            LocalDate.of(2022, 12, 1), LocalDate.of(2023, 4, 30));
        printOutput("Dates", occurrences.stream().map(LedgerEntry::getDate).toList());

        assertEquals(List.of(LocalDate.of(2023, 1, 31), LocalDate.of(2023, 2, 28),
            LocalDate.of(2023, 3, 31), LocalDate.of(2023, 4, 30)),
            occurrences.stream().map(LedgerEntry::getDate).toList());
        occurrences.forEach(occurrence -> {
            assertEquals(EntryType.DESPESA, occurrence.getType());
            assertEquals(new BigDecimal("49.90"), occurrence.getAmount());
            assertEquals("Subscription", occurrence.getDescription());
        });

        RecurringEntry secondSunday = RecurringEntry.builder()
            .type(EntryType.DESPESA)
            .amount(new BigDecimal("500.00"))
            .firstDate(LocalDate.of(2023, 1, 15))
            .lastDate(LocalDate.of(2023, 3, 31))
            .periodicity(Periodicity.nthWeekday(2, DayOfWeek.SUNDAY))
            .build();
        assertEquals(List.of(LocalDate.of(2023, 2, 12), LocalDate.of(2023, 3, 12)),
            projector.occurrences(secondSunday, LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31)).stream()
                .map(LedgerEntry::getDate).toList());

        assertThrows(InvalidDateRangeException.class,
            () -> projector.occurrences(subscription, LocalDate.of(2023, 2, 1), LocalDate.of(2023, 1, 1)));
        printSuccess("Month-end clamped, nothing before the first date or after the last");
    }

    @Test
    @DisplayName("Transfer moves balance between accounts and nets to zero")
    void testTransferBetweenAccounts() {
        printTestHeader("Transfer Between Accounts");

        Map<String, BigDecimal> opening = Map.of(
            "Checking", new BigDecimal("5000.00"),
            "Investments", new BigDecimal("10000.00"));
        printInput("Opening balances", opening);
        printInput("Transfer", "2000.00 Checking -> Investments");

        Transfer transfer = projector.transfer("Checking", "Investments", new BigDecimal("2000.00"),
            LocalDate.of(2023, 5, 10));
        Map<String, BigDecimal> balances = projector.balanceByAccount(opening, transfer.entries());
        printOutput("Balances", balances);

        assertEquals(EntryType.DESPESA, transfer.getOutgoing().getType());
        assertEquals("Checking", transfer.getOutgoing().getAccount());
        assertEquals(EntryType.RECEITA, transfer.getIncoming().getType());
        assertEquals("Investments", transfer.getIncoming().getAccount());
        assertEquals(new BigDecimal("2000.00"), transfer.getIncoming().getAmount());
        assertEquals(0, transfer.net().signum());

        assertEquals(new BigDecimal("3000.00"), balances.get("Checking"));
        assertEquals(new BigDecimal("12000.00"), balances.get("Investments"));
        assertEquals(new BigDecimal("15000.00"),
            balances.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add));

        List<GroupSummary> byCategory = projector.groupBy(transfer.entries(), GroupingDimension.CATEGORY);
        assertEquals(1, byCategory.size());
        assertEquals(0, byCategory.get(0).getNet().signum());
        printSuccess("Source down, destination up, total unchanged");
    }

    @Test
    @DisplayName("Transfers need two distinct accounts and a positive amount")
    void testInvalidTransfers() {
        printTestHeader("Invalid Transfers");

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> projector.transfer("Checking", "Checking", new BigDecimal("10.00"), LocalDate.of(2023, 5, 10)));
        printExpectedException("IllegalArgumentException", exception.getMessage());

        assertThrows(IllegalArgumentException.class,
            () -> projector.transfer(" ", "Savings", new BigDecimal("10.00"), LocalDate.of(2023, 5, 10)));
        assertThrows(NegativeAmountException.class,
            () -> projector.transfer("Checking", "Savings", BigDecimal.ZERO, LocalDate.of(2023, 5, 10)));
    }
}
