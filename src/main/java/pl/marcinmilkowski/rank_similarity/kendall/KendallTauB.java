package pl.marcinmilkowski.rank_similarity.kendall;

import org.apache.commons.math3.stat.correlation.KendallsCorrelation;

/**
 * Kendall's tau-b, which adjusts for ties, computed by Commons Math.
 */
public final class KendallTauB implements RankCorrelation {

    @Override
    public double correlation(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        if (a.length < 2) {
            return Double.NaN;
        }
        return new KendallsCorrelation().correlation(a, b);
    }

    @Override
    public String name() {
        return "tau-b";
    }

    @Override
    public String toString() {
        return name();
    }
}
