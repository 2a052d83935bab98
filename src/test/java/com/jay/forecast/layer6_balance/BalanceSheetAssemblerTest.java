package com.jay.forecast.layer6_balance;

import com.jay.forecast.model.BalanceCheckResult;
import com.jay.forecast.model.BalanceSheetPeriod;
import com.jay.forecast.model.CashBudgetPeriod;
import com.jay.forecast.model.DebtScheduleState;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.WorkingCapitalPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BalanceSheetAssemblerTest {

    private BalanceSheetAssembler assembler;
    private BalanceSheetPeriod prior;

    @BeforeEach
    void setUp() {
        assembler = new BalanceSheetAssembler();
        // assets 20 + 10 + 5 + 2 + 60 + 3 = 100; liabilities 8 + 5 + 1 + 30 + 6 = 50; equity 40 + 10
        prior = BalanceSheetPeriod.builder()
            .year(2023)
            .cash(20).accountsReceivable(10).inventory(5).otherCurrentAssets(2)
            .grossPpe(80).accumulatedDepreciation(20).netPpe(60).otherNonCurrentAssets(3)
            .accountsPayable(8).shortTermDebt(5).otherCurrentLiabilities(1).longTermDebt(30)
            .otherNonCurrentLiabilities(6)
            .retainedEarnings(40).otherEquity(10)
            .build();
    }

    @Test
    void testRollForwardBalances() {
        IncomeStatementPeriod is = IncomeStatementPeriod.builder().year(2024).depreciation(6).netIncome(12).build();
        // cash: 20 + operating (12 + 6 - 2) - capex 9 + debt (-3 + 1) + owners (2 - 5 - 1) = 21
        CashBudgetPeriod cb = CashBudgetPeriod.builder()
            .year(2024).beginningCash(20).endingCash(21).capitalExpenditure(9)
            .workingCapital(new WorkingCapitalPosition(12, 6, 9))
            .dividendsPaid(5).stockRepurchase(1).equityIssued(2)
            .build();
        DebtScheduleState debt = DebtScheduleState.builder()
            .year(2024).shortTermEnding(2).longTermEnding(31).build();

        BalanceSheetPeriod bs = assembler.assemble(prior, is, cb, debt);

        assertEquals(21.0, bs.getCash(), "Cash comes straight from the cash budget");
        assertEquals(89.0, bs.getGrossPpe(), 1e-9);
        assertEquals(26.0, bs.getAccumulatedDepreciation(), 1e-9);
        assertEquals(63.0, bs.getNetPpe(), 1e-9);
        assertEquals(47.0, bs.getRetainedEarnings(), 1e-9);
        assertEquals(11.0, bs.getOtherEquity(), 1e-9);
        assertEquals(2.0, bs.getOtherCurrentAssets());
        assertEquals(6.0, bs.getOtherNonCurrentLiabilities());
        assertEquals(bs.getTotalAssets(), bs.getTotalLiabilitiesAndEquity(), 1e-9);

        BalanceCheckResult check = new BalanceChecker().check(bs, 0.01);
        assertTrue(check.passed());
    }

    @Test
    void testShortTermInvestmentsAreACurrentAsset() {
        IncomeStatementPeriod is = IncomeStatementPeriod.builder().year(2024).netIncome(0).build();
        // 8 of cash moved into short-term investments, nothing else changes
        CashBudgetPeriod cb = CashBudgetPeriod.builder()
            .year(2024).beginningCash(20).endingCash(12)
            .shortTermInvestment(8).shortTermInvestmentEnding(8)
            .workingCapital(new WorkingCapitalPosition(10, 5, 8))
            .build();
        DebtScheduleState debt = DebtScheduleState.builder()
            .year(2024).shortTermEnding(5).longTermEnding(30).build();

        BalanceSheetPeriod bs = assembler.assemble(prior, is, cb, debt);

        assertEquals(8.0, bs.getShortTermInvestments(), 1e-9);
        assertEquals(prior.getCurrentAssets(), bs.getCurrentAssets(), 1e-9);
        assertTrue(new BalanceChecker().check(bs, 0.01).passed());
    }
}
