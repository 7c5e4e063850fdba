package pl.marcinmilkowski.rank_similarity.kendall;

/**
 * Correlation between two paired rank sequences of equal length.
 */
public interface RankCorrelation {

    /**
     * @param a ranks of the common items in the first list
     * @param b ranks of the same items, in the same order, in the second list
     * @return coefficient in [-1, 1], or NaN when undefined
     * @throws IllegalArgumentException if the sequences differ in length
     */
    double correlation(double[] a, double[] b);

    /**
     * @return short name used in logs and API responses
     */
    String name();
}
