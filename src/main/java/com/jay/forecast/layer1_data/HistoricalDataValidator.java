package com.jay.forecast.layer1_data;

import com.jay.forecast.exception.MissingDataException;
import com.jay.forecast.model.FinancialYear;
import com.jay.forecast.model.HistoricalFinancials;
import com.jay.forecast.model.enums.LineItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks that the base year carries every field the projection cannot default.
 * Runs before any assumption is resolved.
 */
@Slf4j
@Component
public class HistoricalDataValidator {

    public static final List<LineItem> REQUIRED_BASE_YEAR_FIELDS = List.of(
        LineItem.TOTAL_REVENUE,
        LineItem.COST_OF_REVENUE,
        LineItem.NET_INCOME,
        LineItem.CASH,
        LineItem.TOTAL_ASSETS,
        LineItem.TOTAL_LIABILITIES,
        LineItem.STOCKHOLDERS_EQUITY
    );

    public void validate(HistoricalFinancials history, int baseYear, double tolerance) {
        if (history.isEmpty()) {
            throw new MissingDataException("No historical data loaded for " + history.getCompanyKey());
        }
        FinancialYear base = history.year(baseYear);

        List<String> missing = REQUIRED_BASE_YEAR_FIELDS.stream()
            .filter(item -> !base.has(item))
            .map(LineItem::label)
            .toList();
        if (!missing.isEmpty()) {
            throw new MissingDataException(String.format("%s base year %d is missing required fields: %s",
                history.getCompanyKey(), baseYear, String.join(", ", missing)));
        }

        double residual = reportedResidual(base);
        if (Math.abs(residual) > tolerance) {
            log.warn("{} reported balance sheet for {} is off by {} before forecasting; "
                + "the difference carries into every forecast year and is netted out of its balance check",
                history.getCompanyKey(), baseYear,
                String.format("%.2f", residual));
        }
    }

    /** Total assets − (total liabilities + stockholders' equity + minority interest) as reported. */
    public static double reportedResidual(FinancialYear year) {
        return year.getOrZero(LineItem.TOTAL_ASSETS)
            - year.getOrZero(LineItem.TOTAL_LIABILITIES)
            - year.getOrZero(LineItem.STOCKHOLDERS_EQUITY)
            - year.getOrZero(LineItem.MINORITY_INTEREST);
    }
}
