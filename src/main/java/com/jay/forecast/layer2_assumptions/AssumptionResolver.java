package com.jay.forecast.layer2_assumptions;

import com.jay.forecast.config.CompanyConfig;
import com.jay.forecast.config.ForecastConfig;
import com.jay.forecast.config.ForecastSettings;
import com.jay.forecast.exception.InsufficientHistoryException;
import com.jay.forecast.model.FinancialYear;
import com.jay.forecast.model.ForecastAssumptions;
import com.jay.forecast.model.HistoricalFinancials;
import com.jay.forecast.model.ResolvedAssumption;
import com.jay.forecast.model.enums.AssumptionKey;
import com.jay.forecast.model.enums.LineItem;
import com.jay.forecast.model.enums.Provenance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

import static com.jay.forecast.layer2_assumptions.HistoricalRatios.magnitudeOver;
import static com.jay.forecast.layer2_assumptions.HistoricalRatios.magnitudeOverPositive;
import static com.jay.forecast.layer2_assumptions.HistoricalRatios.signedOver;

/**
 * Layer 2 — Assumption Resolver.
 * Produces a complete {@link ForecastAssumptions} from history and company overrides.
 * Precedence per assumption: company override, then the trailing-window historical
 * average (clipped to the configured bounds), then the configured fallback.
 *
 * Pure function of its inputs; all resolution happens before the first period is projected.
 */
@Slf4j
@Component
public class AssumptionResolver {

    private static final double DAYS_PER_YEAR = 365.0;

    public ForecastAssumptions resolve(HistoricalFinancials history, int baseYear,
                                       CompanyConfig company, ForecastSettings settings) {
        List<FinancialYear> window = history.window(baseYear, company.getInputYears());
        HistoricalRatios ratios = new HistoricalRatios(window);
        ForecastConfig.Bounds b = settings.bounds();
        ForecastConfig.Fallbacks f = settings.fallbacks();
        Ctx ctx = new Ctx(company, ratios, settings);

        Map<AssumptionKey, ResolvedAssumption> out = new EnumMap<>(AssumptionKey.class);

        // ── Growth ────────────────────────────────────────────────────────────
        out.put(AssumptionKey.REVENUE_GROWTH, ctx.derive(AssumptionKey.REVENUE_GROWTH,
            r -> r.growth(LineItem.TOTAL_REVENUE),
            b.getMinRevenueGrowth(), b.getMaxRevenueGrowth(), f.getRevenueGrowth()));

        // ── Margins ───────────────────────────────────────────────────────────
        out.put(AssumptionKey.COGS_PCT_REVENUE, ctx.deriveRatio(AssumptionKey.COGS_PCT_REVENUE,
            fy -> magnitudeOver(fy, LineItem.COST_OF_REVENUE, LineItem.TOTAL_REVENUE),
            0.0, 1.0, f.getCogsPctRevenue()));
        out.put(AssumptionKey.SGA_PCT_REVENUE, ctx.deriveRatio(AssumptionKey.SGA_PCT_REVENUE,
            fy -> magnitudeOver(fy, LineItem.SGA, LineItem.TOTAL_REVENUE),
            0.0, 1.0, f.getSgaPctRevenue()));
        out.put(AssumptionKey.DEPRECIATION_RATE, ctx.deriveRatio(AssumptionKey.DEPRECIATION_RATE,
            fy -> magnitudeOver(fy, LineItem.DEPRECIATION, LineItem.NET_PPE),
            1.0 / b.getMaxDepreciationLife(), 1.0 / b.getMinDepreciationLife(),
            1.0 / f.getDepreciationLife()));
        out.put(AssumptionKey.TAX_RATE, ctx.deriveRatio(AssumptionKey.TAX_RATE,
            fy -> magnitudeOverPositive(fy, LineItem.TAX_PROVISION, LineItem.PRETAX_INCOME),
            b.getMinTaxRate(), b.getMaxTaxRate(), f.getTaxRate()));

        // ── Working capital (days) ────────────────────────────────────────────
        out.put(AssumptionKey.DSO_DAYS, ctx.deriveRatio(AssumptionKey.DSO_DAYS,
            fy -> days(magnitudeOver(fy, LineItem.ACCOUNTS_RECEIVABLE, LineItem.TOTAL_REVENUE)),
            0.0, DAYS_PER_YEAR, f.getArPctRevenue() * DAYS_PER_YEAR));
        out.put(AssumptionKey.DIO_DAYS, ctx.deriveRatio(AssumptionKey.DIO_DAYS,
            fy -> days(magnitudeOver(fy, LineItem.INVENTORY, LineItem.COST_OF_REVENUE)),
            0.0, DAYS_PER_YEAR, f.getInventoryPctCogs() * DAYS_PER_YEAR));
        out.put(AssumptionKey.DPO_DAYS, ctx.deriveRatio(AssumptionKey.DPO_DAYS,
            fy -> days(magnitudeOver(fy, LineItem.ACCOUNTS_PAYABLE, LineItem.COST_OF_REVENUE)),
            0.0, DAYS_PER_YEAR, f.getApPctCogs() * DAYS_PER_YEAR));

        // ── Investment and cash ───────────────────────────────────────────────
        out.put(AssumptionKey.CAPEX_PCT_REVENUE, ctx.deriveRatio(AssumptionKey.CAPEX_PCT_REVENUE,
            fy -> magnitudeOver(fy, LineItem.CAPITAL_EXPENDITURE, LineItem.TOTAL_REVENUE),
            0.0, 1.0, f.getCapexPctRevenue()));
        out.put(AssumptionKey.MIN_CASH_PCT_REVENUE, ctx.deriveRatio(AssumptionKey.MIN_CASH_PCT_REVENUE,
            fy -> magnitudeOver(fy, LineItem.CASH, LineItem.TOTAL_REVENUE),
            0.0, Double.MAX_VALUE, f.getMinCashPctRevenue()));
        out.put(AssumptionKey.COST_OF_DEBT, ctx.deriveRatio(AssumptionKey.COST_OF_DEBT,
            AssumptionResolver::costOfDebt,
            b.getMinCostOfDebt(), b.getMaxCostOfDebt(), f.getCostOfDebt()));
        out.put(AssumptionKey.RETURN_ON_CASH, ctx.deriveRatio(AssumptionKey.RETURN_ON_CASH,
            fy -> signedOver(fy, LineItem.INTEREST_INCOME, LineItem.CASH),
            b.getMinReturnOnCash(), b.getMaxReturnOnCash(), f.getReturnOnCash()));

        // ── Owner distributions ───────────────────────────────────────────────
        out.put(AssumptionKey.PAYOUT_RATIO, ctx.deriveRatio(AssumptionKey.PAYOUT_RATIO,
            fy -> magnitudeOverPositive(fy, LineItem.DIVIDENDS_PAID, LineItem.NET_INCOME),
            b.getMinPayoutRatio(), b.getMaxPayoutRatio(), f.getPayoutRatio()));
        out.put(AssumptionKey.REPURCHASE_PCT_NET_INCOME, ctx.deriveRatio(AssumptionKey.REPURCHASE_PCT_NET_INCOME,
            fy -> magnitudeOverPositive(fy, LineItem.STOCK_REPURCHASE, LineItem.NET_INCOME),
            0.0, 1.0, f.getRepurchasePctNetIncome()));

        // ── Financing policy ──────────────────────────────────────────────────
        out.put(AssumptionKey.MIN_CASH_FLOOR, ctx.policy(AssumptionKey.MIN_CASH_FLOOR,
            company.getMinimumCashThreshold()));
        out.put(AssumptionKey.PCT_FINANCING_WITH_DEBT, ctx.policy(AssumptionKey.PCT_FINANCING_WITH_DEBT,
            company.getPctFinancingWithDebt()));
        out.put(AssumptionKey.LT_LOAN_YEARS, ctx.policy(AssumptionKey.LT_LOAN_YEARS,
            company.getLtLoanYears()));

        // ── Short-term investment of excess cash ──────────────────────────────
        out.put(AssumptionKey.ST_INVESTMENT_RETURN, ctx.policy(AssumptionKey.ST_INVESTMENT_RETURN,
            company.getStInvestmentReturn()));
        out.put(AssumptionKey.ST_INVESTMENT_PCT_EXCESS, ctx.policy(AssumptionKey.ST_INVESTMENT_PCT_EXCESS,
            company.getStInvestmentPctExcess()));

        ForecastAssumptions assumptions = new ForecastAssumptions(out);
        log.info("Resolved {} assumptions for {} (base {}, {} input years): {} overridden, {} fallback",
            out.size(), company.getKey(), baseYear, window.size(),
            count(out, Provenance.OVERRIDDEN),
            count(out, Provenance.FALLBACK));
        return assumptions;
    }

    private static OptionalDouble costOfDebt(FinancialYear fy) {
        if (!fy.has(LineItem.INTEREST_EXPENSE)) return OptionalDouble.empty();
        double debt = fy.magnitude(LineItem.CURRENT_DEBT) + fy.magnitude(LineItem.LONG_TERM_DEBT);
        if (debt <= 0) return OptionalDouble.empty();
        return OptionalDouble.of(fy.magnitude(LineItem.INTEREST_EXPENSE) / debt);
    }

    private static OptionalDouble days(OptionalDouble pct) {
        return pct.isPresent() ? OptionalDouble.of(pct.getAsDouble() * DAYS_PER_YEAR) : pct;
    }

    private static long count(Map<AssumptionKey, ResolvedAssumption> out,
                              Provenance provenance) {
        return out.values().stream().filter(r -> r.provenance() == provenance).count();
    }

    /** Per-call resolution state, so the component itself stays stateless. */
    private record Ctx(CompanyConfig company, HistoricalRatios ratios, ForecastSettings settings) {

        ResolvedAssumption deriveRatio(AssumptionKey key, Function<FinancialYear, OptionalDouble> observation,
                                       double lo, double hi, double fallback) {
            return derive(key, r -> r.average(observation), lo, hi, fallback);
        }

        ResolvedAssumption derive(AssumptionKey key, Function<HistoricalRatios, Optional<HistoricalRatios.Average>> derivation,
                                  double lo, double hi, double fallback) {
            Optional<Double> override = company.override(key);
            if (override.isPresent()) {
                return ResolvedAssumption.overridden(key, override.get());
            }

            int required = key.kind() == AssumptionKey.Kind.GROWTH
                ? settings.history().getMinGrowthYears()
                : settings.history().getMinRatioYears();
            if (ratios.years() < required) {
                throw new InsufficientHistoryException(key, required, ratios.years());
            }

            Optional<HistoricalRatios.Average> avg = derivation.apply(ratios);
            if (avg.isEmpty()) {
                log.debug("{}: no usable history for {}, using fallback {}", company.getKey(), key.configName(), fallback);
                return ResolvedAssumption.fallback(key, fallback);
            }
            double raw = avg.get().value();
            double clipped = Math.max(lo, Math.min(hi, raw));
            String source = avg.get().describe();
            if (clipped != raw) {
                source += String.format(", clipped from %.4f", raw);
            }
            return ResolvedAssumption.derived(key, clipped, source);
        }

        ResolvedAssumption policy(AssumptionKey key, double configured) {
            return company.override(key)
                .map(v -> ResolvedAssumption.overridden(key, v))
                .orElseGet(() -> ResolvedAssumption.policy(key, configured));
        }
    }
}
