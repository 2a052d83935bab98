package com.jay.forecast.model;

import com.jay.forecast.model.enums.LineItem;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/** One fiscal year of reported line items across all three statements. */
public final class FinancialYear {

    private final int year;
    private final Map<LineItem, Double> values;

    public FinancialYear(int year, Map<LineItem, Double> values) {
        this.year = year;
        EnumMap<LineItem, Double> copy = new EnumMap<>(LineItem.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    public int getYear() { return year; }

    public Map<LineItem, Double> getValues() { return values; }

    public boolean has(LineItem item) {
        return values.containsKey(item);
    }

    public OptionalDouble get(LineItem item) {
        Double v = values.get(item);
        return v != null ? OptionalDouble.of(v) : OptionalDouble.empty();
    }

    public double getOrZero(LineItem item) {
        return values.getOrDefault(item, 0.0);
    }

    /** Absolute value, for lines that exports sign as outflows. Zero when absent. */
    public double magnitude(LineItem item) {
        return Math.abs(getOrZero(item));
    }

    @Override
    public String toString() {
        return "FinancialYear{" + year + ", " + values.size() + " items}";
    }
}
