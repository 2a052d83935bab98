package com.jay.forecast.model;

import com.jay.forecast.model.enums.LineItem;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record BacktestResult(int year, List<LineItemVariance> variances) {

    public BacktestResult {
        variances = List.copyOf(variances);
    }

    public Optional<LineItemVariance> variance(LineItem item) {
        return variances.stream().filter(v -> v.lineItem() == item).findFirst();
    }

    /** Mean of |percent variance| over the lines that have one; 0 when none do. */
    public double meanAbsolutePercentVariance() {
        return variances.stream()
            .map(LineItemVariance::percentVariance)
            .filter(Objects::nonNull)
            .mapToDouble(Math::abs)
            .average()
            .orElse(0.0);
    }
}
