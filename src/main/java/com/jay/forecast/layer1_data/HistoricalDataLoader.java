package com.jay.forecast.layer1_data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.jay.forecast.config.ForecastConfig;
import com.jay.forecast.exception.MissingDataException;
import com.jay.forecast.model.HistoricalFinancials;
import com.jay.forecast.model.enums.LineItem;
import com.jay.forecast.model.enums.Statement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Layer 1 — Historical Data Loader.
 * Reads the three exported statements for a company from {@code <data_dir>/<company>/}:
 * rows are line items, the first column is the label, and the remaining headers are
 * period-end dates ("2023-12-31"). Only the 4-digit year of each header is kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HistoricalDataLoader {

    private final ForecastConfig config;

    private final CsvMapper csvMapper = new CsvMapper();

    public HistoricalFinancials load(String companyKey) {
        return load(Path.of(config.dataDir(), companyKey), companyKey);
    }

    public HistoricalFinancials load(Path folder, String companyKey) {
        if (!Files.isDirectory(folder)) {
            throw new MissingDataException("Data folder not found for " + companyKey + ": " + folder);
        }
        HistoricalFinancials.Builder builder = HistoricalFinancials.builder(companyKey);
        int items = 0;
        for (Statement statement : Statement.values()) {
            items += readStatement(folder.resolve(statement.fileName()), statement, builder);
        }
        HistoricalFinancials history = builder.build();
        if (history.isEmpty()) {
            throw new MissingDataException("No usable year columns found for " + companyKey + " in " + folder);
        }
        log.info("Loaded {} for {}: {} line-item values, years {}", folder, companyKey, items, history.years());
        return history;
    }

    private int readStatement(Path file, Statement statement, HistoricalFinancials.Builder builder) {
        if (!Files.exists(file)) {
            throw new MissingDataException("Missing " + statement.fileName() + " in " + file.getParent());
        }
        List<String[]> rows;
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(file.toFile())) {
            rows = it.readAll();
        } catch (IOException e) {
            throw new MissingDataException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        if (rows.isEmpty()) {
            throw new MissingDataException(statement.fileName() + " is empty: " + file);
        }

        List<Integer> years = parseYears(rows.get(0));
        int count = 0;
        for (String[] row : rows.subList(1, rows.size())) {
            if (row.length == 0) continue;
            Optional<LineItem> item = LineItem.fromLabel(statement, row[0]);
            if (item.isEmpty()) continue;
            boolean primary = item.get().isPrimaryLabel(row[0]);
            for (int col = 1; col < row.length && col <= years.size(); col++) {
                Integer year = years.get(col - 1);
                Double value = parseNumber(row[col]);
                if (year == null || value == null) continue;
                // primary labels win over aliases regardless of row order
                if (primary) builder.put(year, item.get(), value);
                else builder.putIfAbsent(year, item.get(), value);
                count++;
            }
        }
        return count;
    }

    /** Header cells after the label column; null where the header is not a date. */
    private static List<Integer> parseYears(String[] header) {
        List<Integer> years = new ArrayList<>();
        for (int i = 1; i < header.length; i++) {
            String h = header[i] == null ? "" : header[i].trim();
            Integer year = null;
            if (h.length() >= 4) {
                try {
                    year = Integer.parseInt(h.substring(0, 4));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-date column '{}'", h);
                }
            }
            years.add(year);
        }
        return years;
    }

    private static Double parseNumber(String cell) {
        if (cell == null || cell.isBlank()) return null;
        try {
            double v = Double.parseDouble(cell.trim());
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
