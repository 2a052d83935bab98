package com.jay.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.jay.forecast.model.enums.AssumptionKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved assumption set. Construction fails unless every {@link AssumptionKey}
 * is present with a finite value, so downstream code never checks for presence.
 */
public final class ForecastAssumptions {

    private final Map<AssumptionKey, ResolvedAssumption> entries;

    public ForecastAssumptions(Map<AssumptionKey, ResolvedAssumption> entries) {
        List<String> problems = new ArrayList<>();
        for (AssumptionKey key : AssumptionKey.values()) {
            ResolvedAssumption ra = entries.get(key);
            if (ra == null) {
                problems.add(key.configName() + " missing");
            } else if (!Double.isFinite(ra.value())) {
                problems.add(key.configName() + " not finite (" + ra.value() + ")");
            }
        }
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Unresolved assumptions: " + String.join(", ", problems));
        }
        this.entries = Collections.unmodifiableMap(new EnumMap<>(entries));
    }

    public double get(AssumptionKey key) {
        return entries.get(key).value();
    }

    public ResolvedAssumption resolved(AssumptionKey key) {
        return entries.get(key);
    }

    @JsonValue
    public Collection<ResolvedAssumption> all() {
        return entries.values();
    }

    /** Copy with one value replaced, tagged as an override. */
    public ForecastAssumptions with(AssumptionKey key, double value) {
        Map<AssumptionKey, ResolvedAssumption> copy = new EnumMap<>(entries);
        copy.put(key, ResolvedAssumption.overridden(key, value));
        return new ForecastAssumptions(copy);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ForecastAssumptions other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() { return entries.hashCode(); }
}
