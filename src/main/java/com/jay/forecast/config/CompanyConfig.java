package com.jay.forecast.config;

import com.jay.forecast.exception.InvalidConfigurationException;
import com.jay.forecast.model.HistoricalFinancials;
import com.jay.forecast.model.enums.AssumptionKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated per-company settings for one forecast run.
 * A null {@code baseYear} means the latest year in the loaded history; null
 * {@code bounds} or {@code fallbacks} mean the model-wide sections apply.
 */
@Value
@Builder
public class CompanyConfig {
    String key;
    String name;
    String ticker;
    Integer baseYear;

    @Builder.Default int forecastYears = 2;
    @Builder.Default int inputYears = 3;
    @Builder.Default int ltLoanYears = 10;
    @Builder.Default double pctFinancingWithDebt = 0.70;
    @Builder.Default double minimumCashThreshold = 0.0;
    @Builder.Default double stInvestmentReturn = nominalReturn(0.02, 0.025, -0.01);
    @Builder.Default double stInvestmentPctExcess = 0.50;

    ForecastConfig.Bounds bounds;
    ForecastConfig.Fallbacks fallbacks;

    @Singular Map<AssumptionKey, Double> overrides;

    public Optional<Double> override(AssumptionKey key) {
        return Optional.ofNullable(overrides.get(key));
    }

    /** Nominal risk-free rate from the real rate and inflation, plus the investment's premium. */
    public static double nominalReturn(double realInterestRate, double inflationRate, double riskPremium) {
        return (1 + realInterestRate) * (1 + inflationRate) - 1 + riskPremium;
    }

    public int resolveBaseYear(HistoricalFinancials history) {
        return baseYear != null ? baseYear : history.latestYear();
    }

    /** Backtest mode: the base year precedes the latest year with actuals. */
    public boolean isBacktest(HistoricalFinancials history) {
        return resolveBaseYear(history) < history.latestYear();
    }

    /**
     * Checks the horizon and the financing policy. Policy values set through
     * {@code overrides} are held to the same ranges as the top-level fields.
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        if (forecastYears <= 0) problems.add("n_forecast_years must be > 0 (was " + forecastYears + ")");
        if (inputYears <= 0)    problems.add("n_input_years must be > 0 (was " + inputYears + ")");
        overrides.forEach((k, v) -> {
            if (v == null || !Double.isFinite(v)) problems.add("override " + k.configName() + " is not a number");
        });

        checkPolicy(problems, AssumptionKey.LT_LOAN_YEARS, "lt_loan_years", ltLoanYears, 1, Double.MAX_VALUE);
        checkPolicy(problems, AssumptionKey.PCT_FINANCING_WITH_DEBT, "pct_financing_with_debt",
            pctFinancingWithDebt, 0, 1);
        checkPolicy(problems, AssumptionKey.MIN_CASH_FLOOR, "minimum_cash_threshold",
            minimumCashThreshold, 0, Double.MAX_VALUE);
        checkPolicy(problems, AssumptionKey.ST_INVESTMENT_PCT_EXCESS, "st_investment_pct_excess",
            stInvestmentPctExcess, 0, 1);
        override(AssumptionKey.MIN_CASH_PCT_REVENUE)
            .filter(v -> Double.isFinite(v) && v < 0)
            .ifPresent(v -> problems.add("override min_cash_pct_revenue must be >= 0 (was " + v + ")"));

        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException("Invalid configuration for " + key + ": "
                + String.join("; ", problems));
        }
    }

    /** The effective value is the override when one is set, otherwise the configured field. */
    private void checkPolicy(List<String> problems, AssumptionKey k, String field, double configured,
                             double min, double max) {
        Optional<Double> override = override(k).filter(Double::isFinite);
        double value = override.orElse(configured);
        if (value < min || value > max) {
            String name = override.isPresent() ? "override " + k.configName() : field;
            String range = max == Double.MAX_VALUE ? ">= " + fmt(min) : "within [" + fmt(min) + ", " + fmt(max) + "]";
            problems.add(name + " must be " + range + " (was " + fmt(value) + ")");
        }
    }

    private static String fmt(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
