package com.jay.forecast.model.enums;

/** Where a resolved assumption value came from. */
public enum Provenance {
    OVERRIDDEN,   // per-company override in forecast.yaml
    DERIVED,      // averaged from historical ratios
    FALLBACK,     // no usable history, configured fallback applied
    POLICY        // financing policy value from configuration
}
