package com.jay.forecast.model.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Historical line items the engine reads, keyed by the labels used in the
 * exported statement CSVs. Expense and outflow lines are often stored negative,
 * so consumers read them as magnitudes.
 */
public enum LineItem {

    // ── Income statement ──────────────────────────────────────────────────────
    TOTAL_REVENUE(Statement.INCOME_STATEMENT, false, "Total Revenue", "Operating Revenue"),
    COST_OF_REVENUE(Statement.INCOME_STATEMENT, true, "Cost Of Revenue", "Reconciled Cost Of Revenue"),
    GROSS_PROFIT(Statement.INCOME_STATEMENT, false, "Gross Profit"),
    SGA(Statement.INCOME_STATEMENT, true, "Selling General And Administration"),
    DEPRECIATION(Statement.INCOME_STATEMENT, true, "Reconciled Depreciation",
        "Depreciation And Amortization In Income Statement"),
    OPERATING_INCOME(Statement.INCOME_STATEMENT, false, "Operating Income", "EBIT"),
    INTEREST_EXPENSE(Statement.INCOME_STATEMENT, true, "Interest Expense",
        "Interest Expense Non Operating"),
    INTEREST_INCOME(Statement.INCOME_STATEMENT, false, "Interest Income",
        "Interest Income Non Operating"),
    PRETAX_INCOME(Statement.INCOME_STATEMENT, false, "Pretax Income"),
    TAX_PROVISION(Statement.INCOME_STATEMENT, true, "Tax Provision"),
    NET_INCOME(Statement.INCOME_STATEMENT, false, "Net Income",
        "Net Income Common Stockholders"),

    // ── Balance sheet ─────────────────────────────────────────────────────────
    CASH(Statement.BALANCE_SHEET, false, "Cash And Cash Equivalents",
        "Cash Cash Equivalents And Short Term Investments"),
    ACCOUNTS_RECEIVABLE(Statement.BALANCE_SHEET, false, "Accounts Receivable", "Receivables"),
    INVENTORY(Statement.BALANCE_SHEET, false, "Inventory"),
    CURRENT_ASSETS(Statement.BALANCE_SHEET, false, "Current Assets"),
    GROSS_PPE(Statement.BALANCE_SHEET, false, "Gross PPE"),
    ACCUMULATED_DEPRECIATION(Statement.BALANCE_SHEET, true, "Accumulated Depreciation"),
    NET_PPE(Statement.BALANCE_SHEET, false, "Net PPE"),
    GOODWILL(Statement.BALANCE_SHEET, false, "Goodwill"),
    OTHER_INTANGIBLES(Statement.BALANCE_SHEET, false, "Other Intangible Assets"),
    TOTAL_ASSETS(Statement.BALANCE_SHEET, false, "Total Assets"),
    ACCOUNTS_PAYABLE(Statement.BALANCE_SHEET, false, "Accounts Payable", "Payables"),
    CURRENT_DEBT(Statement.BALANCE_SHEET, false, "Current Debt",
        "Current Debt And Capital Lease Obligation"),
    CURRENT_LIABILITIES(Statement.BALANCE_SHEET, false, "Current Liabilities"),
    LONG_TERM_DEBT(Statement.BALANCE_SHEET, false, "Long Term Debt",
        "Long Term Debt And Capital Lease Obligation"),
    TOTAL_LIABILITIES(Statement.BALANCE_SHEET, false, "Total Liabilities Net Minority Interest"),
    STOCKHOLDERS_EQUITY(Statement.BALANCE_SHEET, false, "Stockholders Equity"),
    RETAINED_EARNINGS(Statement.BALANCE_SHEET, false, "Retained Earnings"),
    MINORITY_INTEREST(Statement.BALANCE_SHEET, false, "Minority Interest"),

    // ── Cash flow ─────────────────────────────────────────────────────────────
    OPERATING_CASH_FLOW(Statement.CASH_FLOW, false, "Operating Cash Flow"),
    CAPITAL_EXPENDITURE(Statement.CASH_FLOW, true, "Capital Expenditure"),
    DIVIDENDS_PAID(Statement.CASH_FLOW, true, "Cash Dividends Paid", "Common Stock Dividend Paid"),
    STOCK_REPURCHASE(Statement.CASH_FLOW, true, "Common Stock Payments", "Repurchase Of Capital Stock");

    private final Statement statement;
    private final boolean expense;
    private final List<String> labels;

    LineItem(Statement statement, boolean expense, String... labels) {
        this.statement = statement;
        this.expense = expense;
        this.labels = List.of(labels);
    }

    public Statement statement() { return statement; }
    public boolean isExpense()   { return expense; }
    public String label()        { return labels.get(0); }

    /**
     * Finds the line item for a CSV row label within one statement.
     * The first label is the primary one; the others are accepted aliases.
     */
    public static Optional<LineItem> fromLabel(Statement statement, String label) {
        if (label == null) return Optional.empty();
        String trimmed = label.trim();
        return Arrays.stream(values())
            .filter(item -> item.statement == statement)
            .filter(item -> item.labels.stream().anyMatch(l -> l.equalsIgnoreCase(trimmed)))
            .findFirst();
    }

    /** True when {@code label} is this item's primary label rather than an alias. */
    public boolean isPrimaryLabel(String label) {
        return label != null && label().equalsIgnoreCase(label.trim());
    }
}
