package com.jay.forecast.model;

import com.jay.forecast.model.enums.AssumptionKey;
import com.jay.forecast.model.enums.Provenance;

/**
 * A single resolved assumption with its provenance.
 * {@code source} is a short human note, e.g. "avg 2021-2023 (3 obs)".
 */
public record ResolvedAssumption(AssumptionKey key, double value, Provenance provenance, String source) {

    public static ResolvedAssumption overridden(AssumptionKey key, double value) {
        return new ResolvedAssumption(key, value, Provenance.OVERRIDDEN, "company override");
    }

    public static ResolvedAssumption derived(AssumptionKey key, double value, String source) {
        return new ResolvedAssumption(key, value, Provenance.DERIVED, source);
    }

    public static ResolvedAssumption fallback(AssumptionKey key, double value) {
        return new ResolvedAssumption(key, value, Provenance.FALLBACK, "configured fallback");
    }

    public static ResolvedAssumption policy(AssumptionKey key, double value) {
        return new ResolvedAssumption(key, value, Provenance.POLICY, "financing policy");
    }
}
