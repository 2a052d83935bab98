package com.jay.forecast.layer2_assumptions;

import com.jay.forecast.model.FinancialYear;
import com.jay.forecast.model.enums.LineItem;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Averages of per-year observations over a trailing history window.
 * Years without a usable observation (absent field, non-positive denominator) are skipped.
 */
final class HistoricalRatios {

    /** An averaged observation and the years it covers. */
    record Average(double value, int observations, int fromYear, int toYear) {
        String describe() {
            return fromYear == toYear
                ? String.format("%d (1 obs)", fromYear)
                : String.format("avg %d-%d (%d obs)", fromYear, toYear, observations);
        }
    }

    private final List<FinancialYear> window;

    HistoricalRatios(List<FinancialYear> window) {
        this.window = window;
    }

    int years() { return window.size(); }

    Optional<Average> average(Function<FinancialYear, OptionalDouble> observation) {
        double sum = 0;
        int n = 0;
        int from = 0, to = 0;
        for (FinancialYear fy : window) {
            OptionalDouble obs = observation.apply(fy);
            if (obs.isEmpty() || !Double.isFinite(obs.getAsDouble())) continue;
            if (n == 0) from = fy.getYear();
            to = fy.getYear();
            sum += obs.getAsDouble();
            n++;
        }
        return n == 0 ? Optional.empty() : Optional.of(new Average(sum / n, n, from, to));
    }

    /** Average year-over-year growth of {@code item} across consecutive years in the window. */
    Optional<Average> growth(LineItem item) {
        double sum = 0;
        int n = 0;
        int from = 0, to = 0;
        for (int i = 1; i < window.size(); i++) {
            OptionalDouble prev = window.get(i - 1).get(item);
            OptionalDouble cur = window.get(i).get(item);
            if (prev.isEmpty() || cur.isEmpty() || prev.getAsDouble() == 0) continue;
            if (n == 0) from = window.get(i - 1).getYear();
            to = window.get(i).getYear();
            sum += (cur.getAsDouble() - prev.getAsDouble()) / Math.abs(prev.getAsDouble());
            n++;
        }
        return n == 0 ? Optional.empty() : Optional.of(new Average(sum / n, n, from, to));
    }

    // ── Observation helpers ───────────────────────────────────────────────────

    /** |numerator| / denominator, empty unless both are reported and the denominator is positive. */
    static OptionalDouble magnitudeOver(FinancialYear fy, LineItem numerator, LineItem denominator) {
        if (!fy.has(numerator)) return OptionalDouble.empty();
        double den = fy.magnitude(denominator);
        if (!fy.has(denominator) || den <= 0) return OptionalDouble.empty();
        return OptionalDouble.of(fy.magnitude(numerator) / den);
    }

    /** Signed numerator over a positive denominator; for lines like interest income. */
    static OptionalDouble signedOver(FinancialYear fy, LineItem numerator, LineItem denominator) {
        if (!fy.has(numerator) || !fy.has(denominator)) return OptionalDouble.empty();
        double den = fy.getOrZero(denominator);
        if (den <= 0) return OptionalDouble.empty();
        return OptionalDouble.of(fy.getOrZero(numerator) / den);
    }

    /** |numerator| / denominator for years where the denominator is strictly positive (e.g. profitable years). */
    static OptionalDouble magnitudeOverPositive(FinancialYear fy, LineItem numerator, LineItem denominator) {
        if (!fy.has(numerator) || !fy.has(denominator)) return OptionalDouble.empty();
        double den = fy.getOrZero(denominator);
        if (den <= 0) return OptionalDouble.empty();
        return OptionalDouble.of(fy.magnitude(numerator) / den);
    }
}
