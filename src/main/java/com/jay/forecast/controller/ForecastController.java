package com.jay.forecast.controller;

import com.jay.forecast.config.ForecastConfig;
import com.jay.forecast.engine.ForecastOutcome;
import com.jay.forecast.engine.ForecastService;
import com.jay.forecast.exception.ForecastException;
import com.jay.forecast.exception.InvalidConfigurationException;
import com.jay.forecast.layer8_report.ForecastReportGenerator;
import com.jay.forecast.model.ForecastResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API — Forecast runs and reports.
 *
 * Endpoints:
 *   GET  /api/companies                 — Configured companies
 *   GET  /api/forecast/{company}        — Full forecast as JSON (?baseYear=&years=)
 *   GET  /api/forecast/{company}/report — Text report for the same run
 *   GET  /api/forecast/all              — Run every company, per-company status
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastConfig config;
    private final ForecastService forecastService;
    private final ForecastReportGenerator reportGenerator;

    // ── GET /api/companies ────────────────────────────────────────────────────

    @GetMapping("/companies")
    public ResponseEntity<List<Map<String, Object>>> companies() {
        List<Map<String, Object>> out = config.companies().entrySet().stream()
            .map(e -> {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("key", e.getKey());
                m.put("name", e.getValue().getName());
                m.put("ticker", e.getValue().getTicker());
                m.put("baseYear", e.getValue().getBaseYear());
                return m;
            })
            .toList();
        return ResponseEntity.ok(out);
    }

    // ── GET /api/forecast/all ─────────────────────────────────────────────────

    @GetMapping("/forecast/all")
    public ResponseEntity<List<Map<String, Object>>> forecastAll() {
        List<ForecastOutcome> outcomes = forecastService.forecastAll();
        List<Map<String, Object>> out = outcomes.stream()
            .map(o -> {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("company", o.companyKey());
                m.put("status", o.succeeded() ? "OK" : "FAILED");
                if (o.succeeded()) {
                    m.put("baseYear", o.result().getBaseYear());
                    m.put("balanced", o.result().isBalanced());
                    m.put("backtest", o.result().isBacktest());
                } else {
                    m.put("error", o.errorMessage());
                }
                return m;
            })
            .toList();
        return ResponseEntity.ok(out);
    }

    // ── GET /api/forecast/{company} ───────────────────────────────────────────

    @GetMapping("/forecast/{company}")
    public ResponseEntity<ForecastResult> forecast(@PathVariable String company,
                                                   @RequestParam(required = false) Integer baseYear,
                                                   @RequestParam(required = false) Integer years) {
        requireKnown(company);
        return ResponseEntity.ok(forecastService.forecast(company, baseYear, years));
    }

    // ── GET /api/forecast/{company}/report ────────────────────────────────────

    @GetMapping(value = "/forecast/{company}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(@PathVariable String company,
                                         @RequestParam(required = false) Integer baseYear,
                                         @RequestParam(required = false) Integer years) {
        requireKnown(company);
        ForecastResult result = forecastService.forecast(company, baseYear, years);
        return ResponseEntity.ok(reportGenerator.generate(result));
    }

    // ── Error mapping ─────────────────────────────────────────────────────────

    @ExceptionHandler(UnknownCompanyException.class)
    public ResponseEntity<Map<String, Object>> unknownCompany(UnknownCompanyException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ForecastException.class)
    public ResponseEntity<Map<String, Object>> forecastFailed(ForecastException e) {
        log.warn("Forecast request rejected: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    private void requireKnown(String company) {
        if (!config.companies().containsKey(company)) {
            throw new UnknownCompanyException(company);
        }
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
            "status", status.value(),
            "error", message,
            "timestamp", LocalDateTime.now().toString()
        ));
    }

    static class UnknownCompanyException extends InvalidConfigurationException {
        UnknownCompanyException(String company) {
            super("Unknown company '" + company + "'");
        }
    }
}
