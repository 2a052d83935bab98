package com.jay.forecast.engine;

import com.jay.forecast.config.CompanyConfig;
import com.jay.forecast.config.ForecastSettings;
import com.jay.forecast.model.HistoricalFinancials;

/**
 * Everything one forecast run reads. Built per run and passed to {@link ForecastEngine#run},
 * so concurrent runs share no mutable state.
 */
public record ForecastContext(CompanyConfig company, HistoricalFinancials history, ForecastSettings settings) {
}
