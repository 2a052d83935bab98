package com.jay.forecast.layer7_backtest;

import com.jay.forecast.model.BacktestResult;
import com.jay.forecast.model.BalanceSheetPeriod;
import com.jay.forecast.model.ForecastPeriod;
import com.jay.forecast.model.HistoricalFinancials;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.LineItemVariance;
import com.jay.forecast.model.enums.AccuracyRating;
import com.jay.forecast.model.enums.LineItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BacktestComparatorTest {

    private BacktestComparator comparator;
    private ForecastPeriod period2024;

    @BeforeEach
    void setUp() {
        comparator = new BacktestComparator();
        IncomeStatementPeriod is = IncomeStatementPeriod.builder()
            .year(2024).revenue(102).costOfRevenue(61).netIncome(5).build();
        BalanceSheetPeriod bs = BalanceSheetPeriod.builder().year(2024).cash(30).build();
        period2024 = new ForecastPeriod(2024, is, null, null, bs, null);
    }

    @Test
    void testVarianceIsForecastMinusActual() {
        HistoricalFinancials actuals = HistoricalFinancials.builder("X")
            .put(2024, LineItem.TOTAL_REVENUE, 100)
            .build();

        List<BacktestResult> results = comparator.compare(List.of(period2024), actuals);

        assertEquals(1, results.size());
        LineItemVariance v = results.get(0).variance(LineItem.TOTAL_REVENUE).orElseThrow();
        assertEquals(2.0, v.variance(), 1e-9);
        assertEquals(2.0, v.percentVariance(), 1e-9);
        assertEquals(AccuracyRating.GOOD, v.rating());
    }

    @Test
    void testZeroActualHasNoPercentage() {
        HistoricalFinancials actuals = HistoricalFinancials.builder("X")
            .put(2024, LineItem.NET_INCOME, 0)
            .build();

        LineItemVariance v = comparator.compare(List.of(period2024), actuals).get(0)
            .variance(LineItem.NET_INCOME).orElseThrow();

        assertEquals(5.0, v.variance(), 1e-9);
        assertNull(v.percentVariance(), "Percentage is undefined against a zero actual");
        assertEquals(AccuracyRating.NOT_RATED, v.rating());
    }

    @Test
    void testNegativeExpenseActualsComparedAsMagnitudes() {
        HistoricalFinancials actuals = HistoricalFinancials.builder("X")
            .put(2024, LineItem.COST_OF_REVENUE, -60)
            .build();

        LineItemVariance v = comparator.compare(List.of(period2024), actuals).get(0)
            .variance(LineItem.COST_OF_REVENUE).orElseThrow();

        assertEquals(60.0, v.actual(), 1e-9);
        assertEquals(1.0, v.variance(), 1e-9);
    }

    @Test
    void testYearsWithoutActualsAreSkipped() {
        HistoricalFinancials actuals = HistoricalFinancials.builder("X")
            .put(2023, LineItem.TOTAL_REVENUE, 100)
            .build();

        assertTrue(comparator.compare(List.of(period2024), actuals).isEmpty());
    }

    @Test
    void testLinesMissingFromActualsAreLeftOut() {
        HistoricalFinancials actuals = HistoricalFinancials.builder("X")
            .put(2024, LineItem.TOTAL_REVENUE, 100)
            .put(2024, LineItem.CASH, 40)
            .build();

        BacktestResult result = comparator.compare(List.of(period2024), actuals).get(0);

        assertEquals(2, result.variances().size());
        assertTrue(result.variance(LineItem.SGA).isEmpty());
        // |2%| and |-25%|
        assertEquals(13.5, result.meanAbsolutePercentVariance(), 1e-9);
    }

    @Test
    void testAccuracyBands() {
        assertEquals(AccuracyRating.EXCELLENT, AccuracyRating.of(-0.5));
        assertEquals(AccuracyRating.GOOD, AccuracyRating.of(4.99));
        assertEquals(AccuracyRating.ACCEPTABLE, AccuracyRating.of(-7.0));
        assertEquals(AccuracyRating.NEEDS_IMPROVEMENT, AccuracyRating.of(10.0));
        assertEquals(AccuracyRating.NOT_RATED, AccuracyRating.of(null));
    }
}
