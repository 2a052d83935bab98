package com.jay.forecast.engine;

import com.jay.forecast.config.CompanyConfig;
import com.jay.forecast.config.ForecastSettings;
import com.jay.forecast.layer1_data.HistoricalDataValidator;
import com.jay.forecast.layer2_assumptions.AssumptionResolver;
import com.jay.forecast.layer3_income.IncomeStatementProjector;
import com.jay.forecast.layer4_cash.CashBudgetCalculator;
import com.jay.forecast.layer4_cash.CashBudgetDraft;
import com.jay.forecast.layer5_debt.DebtScheduleManager;
import com.jay.forecast.layer5_debt.FinancingDecision;
import com.jay.forecast.layer6_balance.BalanceChecker;
import com.jay.forecast.layer6_balance.BalanceSheetAssembler;
import com.jay.forecast.layer7_backtest.BacktestComparator;
import com.jay.forecast.model.BalanceCheckFailure;
import com.jay.forecast.model.BalanceCheckResult;
import com.jay.forecast.model.BalanceSheetPeriod;
import com.jay.forecast.model.BaseYearSnapshot;
import com.jay.forecast.model.CashBudgetPeriod;
import com.jay.forecast.model.DebtScheduleState;
import com.jay.forecast.model.ForecastAssumptions;
import com.jay.forecast.model.ForecastPeriod;
import com.jay.forecast.model.ForecastResult;
import com.jay.forecast.model.HistoricalFinancials;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.enums.AssumptionKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * The forecasting pipeline.
 *
 * Structural problems (bad config, missing fields, too little history) are raised before
 * the first period. Each period is then computed in a fixed order, so no value reads
 * one that is computed later:
 *   interest on beginning balances → income statement → cash budget draft →
 *   financing decision → closed cash budget → balance sheet → balance check.
 * A period is only published once all of its statements exist. Per-period anomalies
 * are collected on the result rather than aborting the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastEngine {

    private final HistoricalDataValidator validator;
    private final AssumptionResolver assumptionResolver;
    private final BaseYearSnapshotFactory baseYearFactory;
    private final IncomeStatementProjector incomeStatementProjector;
    private final CashBudgetCalculator cashBudgetCalculator;
    private final DebtScheduleManager debtScheduleManager;
    private final BalanceSheetAssembler balanceSheetAssembler;
    private final BalanceChecker balanceChecker;
    private final BacktestComparator backtestComparator;

    public ForecastResult run(ForecastContext ctx) {
        CompanyConfig company = ctx.company();
        ForecastSettings settings = ctx.settings();
        HistoricalFinancials history = ctx.history();

        // ── Preconditions: fatal, nothing computed yet ────────────────────────
        company.validate();
        int baseYear = company.resolveBaseYear(history);
        validator.validate(history, baseYear, settings.balanceTolerance());
        HistoricalFinancials known = history.upTo(baseYear);
        ForecastAssumptions assumptions = assumptionResolver.resolve(known, baseYear, company, settings);
        boolean backtest = company.isBacktest(history);

        log.info("Forecasting {} from base {} for {} year(s){}", company.getKey(), baseYear,
            company.getForecastYears(), backtest ? " (backtest)" : "");

        BaseYearSnapshot base = baseYearFactory.build(known, baseYear, assumptions);
        ForecastResult.ForecastResultBuilder result = ForecastResult.builder()
            .companyKey(company.getKey())
            .companyName(company.getName())
            .baseYear(baseYear)
            .forecastYears(company.getForecastYears())
            .backtest(backtest)
            .assumptions(assumptions)
            .base(base);

        // ── Period loop ───────────────────────────────────────────────────────
        List<ForecastPeriod> periods = new ArrayList<>();
        IncomeStatementPeriod priorIs = base.incomeStatement();
        BalanceSheetPeriod priorBs = base.balanceSheet();
        DebtScheduleState priorDebt = base.debtSchedule();

        for (int t = 1; t <= company.getForecastYears(); t++) {
            ForecastPeriod period = projectPeriod(t, priorIs, priorBs, priorDebt, assumptions, settings,
                base.reportedResidual());
            periods.add(period);
            result.period(period);

            period.debtSchedule().getAnomalies().forEach(result::debtAnomaly);
            if (!period.balanceCheck().passed()) {
                result.balanceCheckFailure(BalanceCheckFailure.of(period.balanceCheck()));
            }

            priorIs = period.incomeStatement();
            priorBs = period.balanceSheet();
            priorDebt = period.debtSchedule();
        }

        if (backtest) {
            result.backtestResults(backtestComparator.compare(periods, history));
        }

        ForecastResult out = result.build();
        log.info("Forecast {} complete: {} period(s), balanced={}, debt anomalies={}",
            company.getKey(), periods.size(), out.isBalanced(), out.getDebtAnomalies().size());
        return out;
    }

    private ForecastPeriod projectPeriod(int t, IncomeStatementPeriod priorIs, BalanceSheetPeriod priorBs,
                                         DebtScheduleState priorDebt, ForecastAssumptions a,
                                         ForecastSettings settings, double carriedResidual) {
        // 1. Interest from beginning balances only
        double interestExpense = debtScheduleManager.interestExpense(priorDebt, a);
        double interestIncome = priorBs.getCash() * a.get(AssumptionKey.RETURN_ON_CASH);
        double investmentIncome = priorBs.getShortTermInvestments() * a.get(AssumptionKey.ST_INVESTMENT_RETURN);

        // 2. Income statement
        IncomeStatementPeriod is = incomeStatementProjector.project(priorIs, priorBs, a, t,
            settings.revenueGrowthDecay(), interestExpense, interestIncome, investmentIncome);

        // 3. Cash budget before debt, 4. financing decision, 5. ending cash
        CashBudgetDraft draft = cashBudgetCalculator.draft(is, priorIs, priorBs, a);
        FinancingDecision decision = debtScheduleManager.decide(priorDebt, draft, a);
        CashBudgetPeriod cb = cashBudgetCalculator.close(draft, decision);

        // 6. Balance sheet and check
        BalanceSheetPeriod bs = balanceSheetAssembler.assemble(priorBs, is, cb, decision.state());
        BalanceCheckResult check = balanceChecker.check(bs, settings.balanceTolerance(), carriedResidual);

        log.info("{}: revenue {} NI {} cash {} (min {}) ST debt {} LT debt {} residual {}",
            is.getYear(), fmt(is.getRevenue()), fmt(is.getNetIncome()), fmt(cb.getEndingCash()),
            fmt(cb.getMinimumCash()), fmt(bs.getShortTermDebt()), fmt(bs.getLongTermDebt()),
            String.format("%.4f", check.residual()));
        return new ForecastPeriod(is.getYear(), is, cb, decision.state(), bs, check);
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }
}
