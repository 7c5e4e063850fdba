package pl.marcinmilkowski.rank_similarity.kendall;

import java.util.Locale;

/**
 * Outcome of a Kendall comparison restricted to the items both rankings share.
 *
 * The coverage figures are diagnostics only: the share of each ranking that
 * took part in the correlation.
 */
public record KendallResult(
    double coefficient,        // NaN when fewer than two items are shared
    int commonCount,           // Items present in both rankings
    double firstCoverage,      // Percent of the first ranking used
    double secondCoverage      // Percent of the second ranking used
) {

    public boolean isDefined() {
        return !Double.isNaN(coefficient);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "tau=%.4f common=%d coverage=%6.3f%%/%6.3f%%",
            coefficient, commonCount, firstCoverage, secondCoverage);
    }
}
