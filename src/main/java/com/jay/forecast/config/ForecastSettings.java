package com.jay.forecast.config;

/**
 * Model settings for one run. Each instance holds its own copies of the config sections,
 * so parallel runs never share them.
 */
public record ForecastSettings(ForecastConfig.Bounds bounds,
                               ForecastConfig.Fallbacks fallbacks,
                               ForecastConfig.History history,
                               double balanceTolerance,
                               double revenueGrowthDecay) {

    public static ForecastSettings defaults() {
        return new ForecastConfig().settings();
    }
}
