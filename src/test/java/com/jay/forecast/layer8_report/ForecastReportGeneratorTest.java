package com.jay.forecast.layer8_report;

import com.jay.forecast.TestFixtures;
import com.jay.forecast.engine.ForecastEngine;
import com.jay.forecast.model.ForecastResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ForecastReportGeneratorTest {

    private ForecastEngine engine;
    private ForecastReportGenerator generator;

    @BeforeEach
    void setUp() {
        engine = TestFixtures.engine();
        generator = new ForecastReportGenerator();
    }

    @Test
    void testForecastReportSections() {
        ForecastResult result = engine.run(TestFixtures.context(TestFixtures.sampleCompany().build()));

        String report = generator.generate(result);

        assertTrue(report.contains("Sample Company (SampleCo)"));
        assertTrue(report.contains("MODE              :  FORECAST"));
        assertTrue(report.contains("BALANCED          :  YES"));
        for (String section : new String[] {"ASSUMPTIONS", "INCOME STATEMENT", "CASH BUDGET",
                "DEBT SCHEDULE", "BALANCE SHEET", "BALANCE CHECK"}) {
            assertTrue(report.contains(section), "Missing section " + section);
        }
        assertTrue(report.contains("revenue_growth"));
        assertTrue(report.contains("2026"), "Last forecast year has a column");
        assertFalse(report.contains("BACKTEST"));
        assertFalse(report.contains("WARNINGS"));
    }

    @Test
    void testBacktestSectionWhenActualsExist() {
        ForecastResult result = engine.run(TestFixtures.context(
            TestFixtures.sampleCompany().baseYear(2022).forecastYears(1).build()));

        String report = generator.generate(result);

        assertTrue(report.contains("MODE              :  BACKTEST"));
        assertTrue(report.contains("BACKTEST (forecast vs actual)"));
        assertTrue(report.contains("Total Revenue"));
        assertTrue(report.contains("0.83%"), "121 forecast vs 120 actual");
    }
}
