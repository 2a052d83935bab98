package com.jay.forecast.engine;

import com.jay.forecast.TestFixtures;
import com.jay.forecast.config.CompanyConfig;
import com.jay.forecast.config.ForecastSettings;
import com.jay.forecast.exception.InsufficientHistoryException;
import com.jay.forecast.exception.InvalidConfigurationException;
import com.jay.forecast.exception.MissingDataException;
import com.jay.forecast.model.BacktestResult;
import com.jay.forecast.model.CashBudgetPeriod;
import com.jay.forecast.model.DebtScheduleState;
import com.jay.forecast.model.ForecastPeriod;
import com.jay.forecast.model.ForecastResult;
import com.jay.forecast.model.HistoricalFinancials;
import com.jay.forecast.model.LineItemVariance;
import com.jay.forecast.model.enums.AssumptionKey;
import com.jay.forecast.model.enums.LineItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the pipeline on the sample company. Expected figures were worked
 * by hand from the fixture: revenue growth averages (10% + 9.09%) / 2, cost of debt
 * clips to its 3% floor, depreciation clips to a 25-year life.
 */
class ForecastEngineTest {

    private static final double TOLERANCE = 0.01;

    private ForecastEngine engine;

    @BeforeEach
    void setUp() {
        engine = TestFixtures.engine();
    }

    private ForecastResult run(CompanyConfig company) {
        return engine.run(TestFixtures.context(company));
    }

    private CompanyConfig sample() {
        return TestFixtures.sampleCompany().override(AssumptionKey.TAX_RATE, 0.25).build();
    }

    @Test
    void testProducesOnePeriodPerForecastYear() {
        ForecastResult result = run(sample());

        assertEquals(2023, result.getBaseYear());
        assertEquals(3, result.getPeriods().size());
        assertEquals(2024, result.getPeriods().get(0).year());
        assertEquals(2026, result.getPeriods().get(2).year());
        assertFalse(result.isBacktest(), "Base year is the latest year, so no backtest");
        assertTrue(result.getBacktestResults().isEmpty());
    }

    @Test
    void testFirstYearFigures() {
        ForecastPeriod y1 = run(sample()).getPeriods().get(0);

        assertEquals(131.4545, y1.incomeStatement().getRevenue(), 1e-4);
        assertEquals(8.0, y1.incomeStatement().getDepreciation(), 1e-9, "200 net PPE at 4%");
        // (10 ST + 100 LT) at the 3% floor
        assertEquals(3.3, y1.incomeStatement().getInterestExpense(), 1e-9);
        assertEquals(21.4648, y1.incomeStatement().getNetIncome(), 1e-4);
        assertEquals(10.0, y1.debtSchedule().getLongTermAmortization(), 1e-9, "100 over 10 years");
        assertEquals(9.1116, y1.debtSchedule().getShortTermDraw(), 1e-4);
        assertEquals(14.6393, y1.cashBudget().getEndingCash(), 1e-4);
    }

    @Test
    void testBalanceSheetCashIsCashBudgetEndingCash() {
        for (ForecastPeriod p : run(sample()).getPeriods()) {
            assertEquals(p.cashBudget().getEndingCash(), p.balanceSheet().getCash(),
                "Cash must be taken verbatim from the cash budget in " + p.year());
        }
    }

    @Test
    void testEveryPeriodBalances() {
        ForecastResult result = run(sample());

        assertTrue(result.isBalanced());
        for (ForecastPeriod p : result.getPeriods()) {
            assertTrue(Math.abs(p.balanceCheck().residual()) <= TOLERANCE,
                "Residual " + p.balanceCheck().residual() + " in " + p.year());
        }
    }

    @Test
    void testCashBudgetIdentityHolds() {
        for (ForecastPeriod p : run(sample()).getPeriods()) {
            CashBudgetPeriod cb = p.cashBudget();
            double expected = cb.getBeginningCash() + cb.getOperatingCashFlow() + cb.getInvestingCashFlow()
                + cb.getFinancingCashFlow() + cb.getExternalCashFlow() + cb.getDiscretionaryCashFlow()
                + cb.getShortTermInvestmentCashFlow();
            assertEquals(expected, cb.getEndingCash(), 1e-9);
        }
    }

    @Test
    void testEndingCashOfOneYearIsBeginningCashOfTheNext() {
        ForecastResult result = run(sample());
        assertEquals(15.0, result.cashBudgets().get(0).getBeginningCash(), 1e-9);
        for (int i = 1; i < result.getPeriods().size(); i++) {
            assertEquals(result.cashBudgets().get(i - 1).getEndingCash(),
                result.cashBudgets().get(i).getBeginningCash());
        }
    }

    @Test
    void testDebtBalancesNeverNegativeAndCashNeverBelowThreshold() {
        ForecastResult result = run(sample());
        for (ForecastPeriod p : result.getPeriods()) {
            DebtScheduleState d = p.debtSchedule();
            assertTrue(d.getShortTermEnding() >= 0, "ST debt negative in " + p.year());
            assertTrue(d.getLongTermEnding() >= 0, "LT debt negative in " + p.year());
            assertTrue(p.cashBudget().getEndingCash() >= p.cashBudget().getMinimumCash() - TOLERANCE);
        }
    }

    @Test
    void testInterestUsesPriorYearClosingDebt() {
        ForecastResult result = run(sample());
        for (int i = 1; i < result.getPeriods().size(); i++) {
            DebtScheduleState prior = result.debtSchedules().get(i - 1);
            ForecastPeriod p = result.getPeriods().get(i);
            double expected = prior.totalDebt() * result.getAssumptions().get(AssumptionKey.COST_OF_DEBT);
            assertEquals(expected, p.incomeStatement().getInterestExpense(), 1e-9);
            assertEquals(expected, p.debtSchedule().getInterestExpense(), 1e-9);
        }
    }

    @Test
    void testRunsAreIdempotent() {
        ForecastResult first = run(sample());
        ForecastResult second = run(sample());

        assertEquals(first.getAssumptions(), second.getAssumptions());
        assertEquals(first.getPeriods(), second.getPeriods(), "Identical inputs must give identical periods");
    }

    @Test
    void testMinimumCashThresholdIsRestoredExactly() {
        CompanyConfig company = TestFixtures.sampleCompany()
            .minimumCashThreshold(50)
            .override(AssumptionKey.MIN_CASH_PCT_REVENUE, 0.0)
            .build();

        ForecastResult result = run(company);
        CashBudgetPeriod first = result.cashBudgets().get(0);
        assertTrue(first.getPreFinancingCash() < 50.0, "15 of opening cash cannot cover a floor of 50");
        assertEquals(50.0 - first.getPreFinancingCash(), first.getShortTermDraw(), 1e-9);
        assertEquals(50.0, first.getEndingCash(), 1e-9);

        for (CashBudgetPeriod cb : result.cashBudgets()) {
            assertEquals(50.0, cb.getMinimumCash(), 1e-9);
            assertTrue(cb.getEndingCash() >= 50.0 - 1e-9, "Cash below floor in " + cb.getYear());
        }
    }

    @Test
    void testInvestmentBeyondOperatingCashIsFundedByDebtAndEquityMix() {
        CompanyConfig company = TestFixtures.sampleCompany()
            .override(AssumptionKey.CAPEX_PCT_REVENUE, 0.5)
            .build();

        ForecastResult result = run(company);
        CashBudgetPeriod cb = result.cashBudgets().get(0);

        assertTrue(cb.getInvestmentFundingNeed() > 0);
        assertEquals(cb.getInvestmentFundingNeed() * 0.70, cb.getLongTermDraw(), 1e-9);
        assertEquals(cb.getInvestmentFundingNeed() * 0.30, cb.getEquityIssued(), 1e-9);
        assertTrue(result.isBalanced(), "Equity issuance and new tranches must keep the sheet balanced");
    }

    @Test
    void testSurplusRepaysShortTermDebtBeforeAccumulatingCash() {
        CompanyConfig company = TestFixtures.sampleCompany()
            .override(AssumptionKey.CAPEX_PCT_REVENUE, 0.0)
            .override(AssumptionKey.MIN_CASH_PCT_REVENUE, 0.0)
            .build();

        ForecastPeriod y1 = run(company).getPeriods().get(0);

        assertEquals(10.0, y1.debtSchedule().getShortTermRepayment(), 1e-9, "Full 10 of ST debt repaid");
        assertEquals(0.0, y1.debtSchedule().getShortTermEnding(), 1e-9);
        assertEquals(0.0, y1.debtSchedule().getLongTermDraw(), 1e-9, "No new LT borrowing while in surplus");
        double leftAfterRepayment = y1.cashBudget().getPreFinancingCash() - 10.0;
        assertEquals(leftAfterRepayment * 0.5, y1.cashBudget().getShortTermInvestment(), 1e-9,
            "Half of what is left above a zero threshold is invested");
        assertEquals(leftAfterRepayment * 0.5, y1.cashBudget().getEndingCash(), 1e-9);
    }

    @Test
    void testInvestedCashIsRedeemedWithReturnNextYear() {
        CompanyConfig company = TestFixtures.sampleCompany()
            .override(AssumptionKey.CAPEX_PCT_REVENUE, 0.0)
            .override(AssumptionKey.MIN_CASH_PCT_REVENUE, 0.0)
            .stInvestmentReturn(0.04)
            .build();

        ForecastResult result = run(company);
        ForecastPeriod y1 = result.getPeriods().get(0);
        ForecastPeriod y2 = result.getPeriods().get(1);
        double placed = y1.cashBudget().getShortTermInvestment();

        assertTrue(placed > 0);
        assertEquals(placed, y1.balanceSheet().getShortTermInvestments(), 1e-9);
        assertEquals(0.0, y1.incomeStatement().getInvestmentIncome(), 1e-9, "Nothing invested before the base year");
        assertEquals(placed, y2.cashBudget().getShortTermInvestmentRedemption(), 1e-9);
        assertEquals(placed * 0.04, y2.incomeStatement().getInvestmentIncome(), 1e-9);
        assertTrue(result.isBalanced());
    }

    @Test
    void testNoInvestmentInAYearThatBorrowsShortTerm() {
        ForecastPeriod y1 = run(sample()).getPeriods().get(0);

        assertTrue(y1.debtSchedule().getShortTermDraw() > 0);
        assertEquals(0.0, y1.cashBudget().getShortTermInvestment());
        assertEquals(0.0, y1.balanceSheet().getShortTermInvestments());
    }

    @Test
    void testThreeYearLoanTermAmortisesWithoutAnomalies() {
        CompanyConfig company = TestFixtures.sampleCompany().ltLoanYears(3).forecastYears(3).build();

        ForecastResult result = run(company);

        assertTrue(result.getDebtAnomalies().isEmpty(), "Unexpected anomalies: " + result.getDebtAnomalies());
        double baseTrancheRepaid = 0;
        for (DebtScheduleState d : result.debtSchedules()) {
            assertTrue(d.getAnomalies().isEmpty());
            baseTrancheRepaid += d.getLongTermAmortization();
        }
        assertTrue(baseTrancheRepaid >= 100.0 - 1e-9, "The 100 of opening LT debt is fully repaid");
    }

    @Test
    void testReportedBaseYearImbalanceIsNotReportedAsFailure() {
        HistoricalFinancials offByFive = TestFixtures.sampleHistoryBuilder()
            .put(2023, LineItem.TOTAL_ASSETS, 305)
            .build();
        ForecastContext ctx = new ForecastContext(sample(), offByFive, ForecastSettings.defaults());

        ForecastResult result = engine.run(ctx);

        assertEquals(5.0, result.getBase().reportedResidual(), 1e-9);
        assertTrue(result.isBalanced());
        assertTrue(result.getBalanceCheckFailures().isEmpty());
        for (ForecastPeriod p : result.getPeriods()) {
            assertEquals(5.0, p.balanceCheck().residual(), 1e-6, "Reported gap is carried as-is");
            assertEquals(0.0, p.balanceCheck().modelResidual(), 1e-6);
        }
    }

    @Test
    void testBacktestComparesAgainstLaterActuals() {
        CompanyConfig company = TestFixtures.sampleCompany().baseYear(2022).forecastYears(1).build();

        ForecastResult result = run(company);

        assertTrue(result.isBacktest());
        assertEquals(1, result.getBacktestResults().size());
        BacktestResult bt = result.getBacktestResults().get(0);
        assertEquals(2023, bt.year());
        LineItemVariance revenue = bt.variance(LineItem.TOTAL_REVENUE).orElseThrow();
        assertEquals(121.0, revenue.forecast(), 1e-9, "110 grown at 10%");
        assertEquals(120.0, revenue.actual(), 1e-9);
        assertEquals(1.0, revenue.variance(), 1e-9);
        assertEquals(100.0 / 120.0, revenue.percentVariance(), 1e-9);
    }

    @Test
    void testBacktestUsesOnlyHistoryUpToBaseYear() {
        CompanyConfig company = TestFixtures.sampleCompany().baseYear(2022).forecastYears(1).build();

        ForecastResult result = run(company);

        assertEquals(0.10, result.getAssumptions().get(AssumptionKey.REVENUE_GROWTH), 1e-12,
            "2023 actuals must not leak into the assumptions");
    }

    @Test
    void testInsufficientHistoryAbortsBeforeAnyPeriod() {
        CompanyConfig company = TestFixtures.sampleCompany().inputYears(1).build();

        InsufficientHistoryException e = assertThrows(InsufficientHistoryException.class, () -> run(company));
        assertEquals(AssumptionKey.REVENUE_GROWTH, e.getAssumption());
        assertEquals(2, e.getRequiredYears());
        assertEquals(1, e.getAvailableYears());
    }

    @Test
    void testMissingBaseYearFieldAbortsRun() {
        HistoricalFinancials.Builder b = HistoricalFinancials.builder("Thin");
        b.put(2023, LineItem.TOTAL_REVENUE, 100).put(2023, LineItem.NET_INCOME, 10);
        ForecastContext ctx = new ForecastContext(TestFixtures.sampleCompany().build(), b.build(),
            ForecastSettings.defaults());

        MissingDataException e = assertThrows(MissingDataException.class, () -> engine.run(ctx));
        assertTrue(e.getMessage().contains("Cash And Cash Equivalents"));
    }

    @Test
    void testUnknownBaseYearIsMissingData() {
        CompanyConfig company = TestFixtures.sampleCompany().baseYear(2019).build();
        assertThrows(MissingDataException.class, () -> run(company));
    }

    @Test
    void testInvalidHorizonIsRejected() {
        CompanyConfig company = TestFixtures.sampleCompany().forecastYears(0).build();
        assertThrows(InvalidConfigurationException.class, () -> run(company));
    }

    @Test
    void testGrowthFadesEachYear() {
        ForecastResult result = run(sample());
        double g = result.getAssumptions().get(AssumptionKey.REVENUE_GROWTH);

        assertEquals(g, result.incomeStatements().get(0).getRevenueGrowth(), 1e-12);
        assertEquals(g * 0.95, result.incomeStatements().get(1).getRevenueGrowth(), 1e-12);
        assertEquals(g * 0.90, result.incomeStatements().get(2).getRevenueGrowth(), 1e-12);
    }
}
