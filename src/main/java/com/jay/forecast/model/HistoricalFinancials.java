package com.jay.forecast.model;

import com.jay.forecast.exception.MissingDataException;
import com.jay.forecast.model.enums.LineItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Immutable per-year history for one company, ordered oldest to newest.
 * Produced by the data loader (or the builder in tests) and only read by the pipeline.
 */
public final class HistoricalFinancials {

    private final String companyKey;
    private final NavigableMap<Integer, FinancialYear> years;

    private HistoricalFinancials(String companyKey, NavigableMap<Integer, FinancialYear> years) {
        this.companyKey = companyKey;
        this.years = Collections.unmodifiableNavigableMap(years);
    }

    public String getCompanyKey() { return companyKey; }

    public List<Integer> years() {
        return List.copyOf(years.keySet());
    }

    public boolean isEmpty() { return years.isEmpty(); }

    public boolean contains(int year) { return years.containsKey(year); }

    public int latestYear() {
        if (years.isEmpty()) {
            throw new MissingDataException("No historical years loaded for " + companyKey);
        }
        return years.lastKey();
    }

    public FinancialYear year(int year) {
        FinancialYear fy = years.get(year);
        if (fy == null) {
            throw new MissingDataException(String.format(
                "Year %d not available for %s. Available years: %s", year, companyKey, years.keySet()));
        }
        return fy;
    }

    public OptionalDouble value(int year, LineItem item) {
        FinancialYear fy = years.get(year);
        return fy != null ? fy.get(item) : OptionalDouble.empty();
    }

    /** History truncated at {@code baseYear}, which must itself be present. */
    public HistoricalFinancials upTo(int baseYear) {
        year(baseYear);
        return new HistoricalFinancials(companyKey, new TreeMap<>(years.headMap(baseYear, true)));
    }

    /** The {@code n} most recent years ending at {@code baseYear}, oldest first. May hold fewer than n. */
    public List<FinancialYear> window(int baseYear, int n) {
        List<FinancialYear> out = new ArrayList<>(years.headMap(baseYear, true).descendingMap().values());
        if (out.size() > n) out = out.subList(0, n);
        Collections.reverse(out);
        return List.copyOf(out);
    }

    public static Builder builder(String companyKey) {
        return new Builder(companyKey);
    }

    public static final class Builder {
        private final String companyKey;
        private final Map<Integer, Map<LineItem, Double>> values = new TreeMap<>();

        private Builder(String companyKey) {
            this.companyKey = companyKey;
        }

        public Builder put(int year, LineItem item, double value) {
            values.computeIfAbsent(year, y -> new EnumMap<>(LineItem.class)).put(item, value);
            return this;
        }

        public Builder putIfAbsent(int year, LineItem item, double value) {
            values.computeIfAbsent(year, y -> new EnumMap<>(LineItem.class)).putIfAbsent(item, value);
            return this;
        }

        public HistoricalFinancials build() {
            NavigableMap<Integer, FinancialYear> out = new TreeMap<>();
            values.forEach((year, items) -> out.put(year, new FinancialYear(year, items)));
            return new HistoricalFinancials(companyKey, out);
        }
    }
}
