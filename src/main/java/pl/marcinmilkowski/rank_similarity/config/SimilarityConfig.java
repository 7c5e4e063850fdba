package pl.marcinmilkowski.rank_similarity.config;

import pl.marcinmilkowski.rank_similarity.measure.RankBiasedOverlap;

/**
 * Default parameters for similarity computations.
 */
public record SimilarityConfig(
    double persistence,               // p for fixed-depth RBO; 1.0 = unweighted
    boolean extrapolate,              // add the tail bound to fixed-depth RBO
    int depth,                        // RankBiasedOverlap.UNBOUNDED when not set
    double extrapolationPersistence,  // p for extrapolated RBO
    int progressDelta                 // percent between progress reports
) {

    public static SimilarityConfig defaults() {
        return new SimilarityConfig(1.0, false, RankBiasedOverlap.UNBOUNDED,
            RankBiasedOverlap.DEFAULT_EXTRAPOLATION_PERSISTENCE, RankBiasedOverlap.DEFAULT_PROGRESS_DELTA);
    }

    /**
     * Narrow a depth read as a long, rejecting values an int depth cannot hold.
     *
     * @throws IllegalArgumentException if value is outside [1, Integer.MAX_VALUE]
     */
    public static int checkedDepth(long value) {
        if (value < 1 || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("'depth' must be in [1, " + Integer.MAX_VALUE + "], got " + value);
        }
        return (int) value;
    }

    public boolean isDepthBounded() {
        return depth != RankBiasedOverlap.UNBOUNDED;
    }
}
