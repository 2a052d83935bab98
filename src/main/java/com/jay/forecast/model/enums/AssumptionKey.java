package com.jay.forecast.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every assumption the projection consumes. Resolution fills all of them
 * before the first forecast period is computed.
 */
public enum AssumptionKey {
    REVENUE_GROWTH("revenue_growth", Kind.GROWTH),
    COGS_PCT_REVENUE("cogs_pct_revenue", Kind.RATIO),
    SGA_PCT_REVENUE("sga_pct_revenue", Kind.RATIO),
    DEPRECIATION_RATE("depreciation_rate", Kind.RATIO),
    TAX_RATE("tax_rate", Kind.RATIO),
    DSO_DAYS("dso_days", Kind.RATIO),
    DIO_DAYS("dio_days", Kind.RATIO),
    DPO_DAYS("dpo_days", Kind.RATIO),
    CAPEX_PCT_REVENUE("capex_pct_revenue", Kind.RATIO),
    COST_OF_DEBT("cost_of_debt", Kind.RATIO),
    RETURN_ON_CASH("return_on_cash", Kind.RATIO),
    PAYOUT_RATIO("payout_ratio", Kind.RATIO),
    REPURCHASE_PCT_NET_INCOME("repurchase_pct_net_income", Kind.RATIO),
    MIN_CASH_PCT_REVENUE("min_cash_pct_revenue", Kind.RATIO),
    MIN_CASH_FLOOR("min_cash_floor", Kind.POLICY),
    PCT_FINANCING_WITH_DEBT("pct_financing_with_debt", Kind.POLICY),
    LT_LOAN_YEARS("lt_loan_years", Kind.POLICY),
    ST_INVESTMENT_RETURN("st_investment_return", Kind.POLICY),
    ST_INVESTMENT_PCT_EXCESS("st_investment_pct_excess", Kind.POLICY);

    public enum Kind { GROWTH, RATIO, POLICY }

    private final String configName;
    private final Kind kind;

    AssumptionKey(String configName, Kind kind) {
        this.configName = configName;
        this.kind = kind;
    }

    public String configName() { return configName; }
    public Kind kind()         { return kind; }

    public static Optional<AssumptionKey> fromConfigName(String name) {
        return Arrays.stream(values())
            .filter(k -> k.configName.equalsIgnoreCase(name))
            .findFirst();
    }
}
