package com.jay.forecast.layer6_balance;

import com.jay.forecast.model.BalanceCheckResult;
import com.jay.forecast.model.BalanceSheetPeriod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assets − (liabilities + equity) per period. A residual beyond the tolerance is logged
 * and reported; it points at a wiring defect, not at bad input, so the run continues.
 * An imbalance already in the reported base year is passed in and excluded.
 */
@Slf4j
@Component
public class BalanceChecker {

    public BalanceCheckResult check(BalanceSheetPeriod bs, double tolerance) {
        return check(bs, tolerance, 0.0);
    }

    public BalanceCheckResult check(BalanceSheetPeriod bs, double tolerance, double carriedResidual) {
        double assets = bs.getTotalAssets();
        double liabilitiesAndEquity = bs.getTotalLiabilitiesAndEquity();
        BalanceCheckResult result = new BalanceCheckResult(bs.getYear(), assets, liabilitiesAndEquity,
            assets - liabilitiesAndEquity, carriedResidual, tolerance);
        if (!result.passed()) {
            log.warn("Balance check failed for {}: assets {} vs liabilities+equity {} (residual {}, {} carried from base year)",
                bs.getYear(), String.format("%.2f", assets), String.format("%.2f", liabilitiesAndEquity),
                String.format("%.4f", result.residual()), String.format("%.4f", carriedResidual));
        }
        return result;
    }
}
