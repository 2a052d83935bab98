package com.jay.forecast.layer4_cash;

import com.jay.forecast.model.ForecastAssumptions;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.WorkingCapitalPosition;
import com.jay.forecast.model.enums.AssumptionKey;
import org.springframework.stereotype.Component;

/** Year-end receivables, inventory and payables from the days assumptions. */
@Component
public class WorkingCapitalProjector {

    private static final double DAYS_PER_YEAR = 365.0;

    public WorkingCapitalPosition project(IncomeStatementPeriod is, ForecastAssumptions a) {
        double receivables = a.get(AssumptionKey.DSO_DAYS) * is.getRevenue() / DAYS_PER_YEAR;
        double inventory   = a.get(AssumptionKey.DIO_DAYS) * is.getCostOfRevenue() / DAYS_PER_YEAR;
        double payables    = a.get(AssumptionKey.DPO_DAYS) * is.getCostOfRevenue() / DAYS_PER_YEAR;
        return new WorkingCapitalPosition(receivables, inventory, payables);
    }
}
