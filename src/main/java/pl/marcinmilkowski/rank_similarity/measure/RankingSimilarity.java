package pl.marcinmilkowski.rank_similarity.measure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.rank_similarity.kendall.CommonRanking;
import pl.marcinmilkowski.rank_similarity.kendall.KendallResult;
import pl.marcinmilkowski.rank_similarity.kendall.KendallTauB;
import pl.marcinmilkowski.rank_similarity.kendall.RankCorrelation;
import pl.marcinmilkowski.rank_similarity.model.RankedList;

import java.util.Locale;

/**
 * Similarity measures between two rankings that may differ in length and content.
 *
 * Intersection-based measures (RBO) work on non-conjoint rankings directly.
 * The correlation-based measure (Kendall) only sees the shared items.
 *
 * Instances are immutable; every call allocates its own working state.
 */
public class RankingSimilarity<T> {

    private static final Logger logger = LoggerFactory.getLogger(RankingSimilarity.class);

    private final RankedList<T> first;
    private final RankedList<T> second;
    private final RankCorrelation correlation;
    private final ProgressListener progressListener;
    private final int progressDelta;

    public RankingSimilarity(RankedList<T> first, RankedList<T> second) {
        this(first, second, new KendallTauB(), ProgressListener.NONE, RankBiasedOverlap.DEFAULT_PROGRESS_DELTA);
    }

    public RankingSimilarity(RankedList<T> first, RankedList<T> second, RankCorrelation correlation,
                             ProgressListener progressListener, int progressDelta) {
        if (first == null) throw new IllegalArgumentException("first must not be null");
        if (second == null) throw new IllegalArgumentException("second must not be null");
        if (correlation == null) throw new IllegalArgumentException("correlation must not be null");
        if (progressDelta <= 0) throw new IllegalArgumentException("progressDelta must be >= 1");
        this.first = first;
        this.second = second;
        this.correlation = correlation;
        this.progressListener = progressListener == null ? ProgressListener.NONE : progressListener;
        this.progressDelta = progressDelta;
    }

    /**
     * Unweighted average overlap down to the depth of the shorter ranking.
     */
    public double rbo() {
        return rbo(RankBiasedOverlap.UNBOUNDED, 1.0, false);
    }

    /**
     * Fixed-depth RBO.
     *
     * @param depth evaluation depth or {@link RankBiasedOverlap#UNBOUNDED}
     * @param p persistence; 1.0 for the unweighted average overlap
     * @param extrapolate add the geometric tail bound (only when p &lt; 1)
     */
    public double rbo(int depth, double p, boolean extrapolate) {
        return RankBiasedOverlap.fixedDepth(first, second, depth, p, extrapolate, progressListener, progressDelta);
    }

    public double rboExt() {
        return rboExt(RankBiasedOverlap.DEFAULT_EXTRAPOLATION_PERSISTENCE);
    }

    /**
     * Extrapolated RBO that accounts for the rankings having different lengths.
     */
    public double rboExt(double p) {
        return RankBiasedOverlap.extrapolated(first, second, p, progressListener, progressDelta);
    }

    /**
     * Rank correlation over the shared items only.
     */
    public KendallResult kendall() {
        CommonRanking common = CommonRanking.of(first, second);
        int commonCount = common.size();
        double firstCoverage = coverage(commonCount, first.size());
        double secondCoverage = coverage(commonCount, second.size());

        logger.info("The number of common elements is {}", commonCount);
        logger.info("The proportion used in the first list is {}%",
            formatPercent(firstCoverage));
        logger.info("The proportion used in the second list is {}%",
            formatPercent(secondCoverage));

        double coefficient = correlation.correlation(common.firstRanks(), common.secondRanks());
        if (Double.isNaN(coefficient)) {
            logger.warn("{} is undefined for {} common element(s)", correlation.name(), commonCount);
        }
        return new KendallResult(coefficient, commonCount, firstCoverage, secondCoverage);
    }

    public RankedList<T> first() {
        return first;
    }

    public RankedList<T> second() {
        return second;
    }

    static String formatPercent(double percent) {
        return String.format(Locale.ROOT, "%6.3f", percent);
    }

    private static double coverage(int common, int size) {
        return size == 0 ? 0.0 : 100.0 * common / size;
    }
}
