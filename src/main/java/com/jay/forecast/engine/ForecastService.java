package com.jay.forecast.engine;

import com.jay.forecast.config.CompanyConfig;
import com.jay.forecast.config.ForecastConfig;
import com.jay.forecast.exception.ForecastException;
import com.jay.forecast.layer1_data.HistoricalDataLoader;
import com.jay.forecast.model.ForecastResult;
import com.jay.forecast.model.HistoricalFinancials;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point for callers: loads a company's history, builds its run context and runs
 * the engine. {@link #forecastAll()} runs every configured company in parallel, each
 * with its own context, and reports failures per company.
 */
@Slf4j
@Service
public class ForecastService {

    private final ForecastConfig config;
    private final HistoricalDataLoader dataLoader;
    private final ForecastEngine engine;
    private final ExecutorService executor;

    public ForecastService(ForecastConfig config, HistoricalDataLoader dataLoader, ForecastEngine engine) {
        this.config = config;
        this.dataLoader = dataLoader;
        this.engine = engine;
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.check().getParallelism()));
    }

    public ForecastResult forecast(String companyKey) {
        return forecast(companyKey, null, null);
    }

    public ForecastResult forecast(String companyKey, Integer baseYear, Integer years) {
        CompanyConfig company = config.companyConfig(companyKey, baseYear, years);
        HistoricalFinancials history = dataLoader.load(companyKey);
        return engine.run(new ForecastContext(company, history, config.settings(company)));
    }

    public List<ForecastOutcome> forecastAll() {
        List<String> keys = List.copyOf(config.companyKeys());
        log.info("Running forecasts for {} companies", keys.size());

        List<CompletableFuture<ForecastOutcome>> futures = keys.stream()
            .map(key -> CompletableFuture.supplyAsync(() -> runSafely(key), executor))
            .toList();
        List<ForecastOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();

        long ok = outcomes.stream().filter(ForecastOutcome::succeeded).count();
        log.info("Batch complete: {} succeeded, {} failed", ok, outcomes.size() - ok);
        return outcomes;
    }

    private ForecastOutcome runSafely(String key) {
        try {
            return ForecastOutcome.success(key, forecast(key));
        } catch (ForecastException e) {
            log.error("Forecast failed for {}: {}", key, e.getMessage());
            return ForecastOutcome.failure(key, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error forecasting {}", key, e);
            return ForecastOutcome.failure(key, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
