package pl.marcinmilkowski.rank_similarity.measure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.rank_similarity.model.InvalidParameterException;
import pl.marcinmilkowski.rank_similarity.model.RankedList;

import java.util.HashSet;
import java.util.Set;

/**
 * Rank-biased overlap between two rankings.
 *
 * Implements the finite-depth measure (Eq. 4, or Eq. 7 for p &lt; 1) and the
 * extrapolated measure for rankings of unequal length (Eq. 32) from
 * Webber, Moffat and Zobel, "A Similarity Measure for Indefinite Rankings"
 * (TOIS 2010). With p = 1 the finite-depth measure is the unweighted
 * average overlap of Fagin et al.
 *
 * Both computations are a single forward pass over depth. Membership checks
 * at depth d always see the running sets of depth d-1.
 */
public final class RankBiasedOverlap {

    private static final Logger logger = LoggerFactory.getLogger(RankBiasedOverlap.class);

    /** Depth meaning "as deep as the shorter ranking goes". */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final double DEFAULT_EXTRAPOLATION_PERSISTENCE = 0.98;

    public static final int DEFAULT_PROGRESS_DELTA = 10;

    private RankBiasedOverlap() {
    }

    public static <T> double fixedDepth(RankedList<T> s, RankedList<T> t, int depth, double p, boolean extrapolate) {
        return fixedDepth(s, t, depth, p, extrapolate, ProgressListener.NONE, DEFAULT_PROGRESS_DELTA);
    }

    /**
     * RBO evaluated to a fixed depth.
     *
     * @param depth requested depth, or {@link #UNBOUNDED}; clamped to the shorter ranking
     * @param p persistence; 1.0 gives the unweighted average overlap, otherwise 0 &lt; p &lt; 1
     * @param extrapolate add the tail term {@code A[k-1] * p^k}; ignored when p == 1
     * @throws InvalidParameterException if p is out of range or the effective depth is zero
     */
    public static <T> double fixedDepth(RankedList<T> s, RankedList<T> t, int depth, double p,
                                        boolean extrapolate, ProgressListener listener, int progressDelta) {
        requireLists(s, t);
        boolean unweighted = p == 1.0;
        if (!unweighted) {
            requirePersistence(p);
        }
        int k = Math.min(Math.min(s.size(), t.size()), depth);
        if (k <= 0) {
            throw new InvalidParameterException("Effective evaluation depth must be at least 1, got " + k
                + " (lengths " + s.size() + " and " + t.size() + ", requested depth " + depth + ")");
        }
        logger.debug("Fixed-depth RBO: lengths {}/{}, depth {}, p={}, extrapolate={}",
            s.size(), t.size(), k, p, extrapolate);

        double[] weights = new double[k];
        for (int d = 0; d < k; d++) {
            weights[d] = unweighted ? 1.0 : (1 - p) * Math.pow(p, d);
        }

        double[] agreement = new double[k];
        double[] overlap = new double[k];

        Set<T> sRunning = new HashSet<>();
        Set<T> tRunning = new HashSet<>();
        sRunning.add(s.get(0));
        tRunning.add(t.get(0));
        agreement[0] = s.get(0).equals(t.get(0)) ? 1 : 0;
        overlap[0] = weights[0] * agreement[0];

        ProgressTracker progress = new ProgressTracker(k, progressDelta, listener);
        for (int d = 1; d < k; d++) {
            progress.step(d);
            T sItem = s.get(d);
            T tItem = t.get(d);

            // equal new items cannot already be in the opposite running set
            int increment = 0;
            if (tRunning.contains(sItem)) {
                increment++;
            }
            if (sRunning.contains(tItem)) {
                increment++;
            }
            if (sItem.equals(tItem)) {
                increment++;
            }

            agreement[d] = (agreement[d - 1] * d + increment) / (d + 1);
            if (unweighted) {
                overlap[d] = (overlap[d - 1] * d + agreement[d]) / (d + 1);
            } else {
                overlap[d] = overlap[d - 1] + weights[d] * agreement[d];
            }

            sRunning.add(sItem);
            tRunning.add(tItem);
        }

        if (extrapolate && p < 1) {
            return overlap[k - 1] + agreement[k - 1] * Math.pow(p, k);
        }
        return overlap[k - 1];
    }

    public static <T> double extrapolated(RankedList<T> first, RankedList<T> second, double p) {
        return extrapolated(first, second, p, ProgressListener.NONE, DEFAULT_PROGRESS_DELTA);
    }

    /**
     * Extrapolated RBO for rankings of possibly different lengths (Eq. 32).
     *
     * The shorter ranking plays the short role. When both have the same length
     * the first argument is taken as the short one.
     *
     * @throws InvalidParameterException unless 0 &lt; p &lt; 1, or if either ranking is empty
     */
    public static <T> double extrapolated(RankedList<T> first, RankedList<T> second, double p,
                                          ProgressListener listener, int progressDelta) {
        requireLists(first, second);
        requirePersistence(p);
        if (first.isEmpty() || second.isEmpty()) {
            throw new InvalidParameterException("Extrapolated RBO needs two non-empty rankings (lengths "
                + first.size() + " and " + second.size() + ")");
        }

        RankedList<T> shortList;
        RankedList<T> longList;
        if (first.size() > second.size()) {
            longList = first;
            shortList = second;
        } else {
            shortList = first;
            longList = second;
        }
        int s = shortList.size();
        int l = longList.size();
        logger.debug("Extrapolated RBO: short length {}, long length {}, p={}", s, l, p);

        int[] overlapCount = new int[l];
        double[] agreement = new double[l];
        double[] rbo = new double[l];

        Set<T> sRunning = new HashSet<>();
        Set<T> lRunning = new HashSet<>();
        sRunning.add(shortList.get(0));
        lRunning.add(longList.get(0));
        overlapCount[0] = shortList.get(0).equals(longList.get(0)) ? 1 : 0;
        agreement[0] = overlapCount[0];
        rbo[0] = (1 - p) * agreement[0];

        double extension = agreement[0] * p;
        double disjoint = 0;

        ProgressTracker progress = new ProgressTracker(l, progressDelta, listener);
        for (int d = 1; d < l; d++) {
            progress.step(d);
            double weight = (1 - p) * Math.pow(p, d);

            if (d < s) {
                T sItem = shortList.get(d);
                T lItem = longList.get(d);

                int increment = 0;
                if (sItem.equals(lItem)) {
                    increment++;
                } else {
                    if (lRunning.contains(sItem)) {
                        increment++;
                    }
                    if (sRunning.contains(lItem)) {
                        increment++;
                    }
                }
                sRunning.add(sItem);
                lRunning.add(lItem);

                overlapCount[d] = overlapCount[d - 1] + increment;
                // Eq. 28: ties handled through the running set sizes
                agreement[d] = 2.0 * overlapCount[d] / (sRunning.size() + lRunning.size());
                rbo[d] = rbo[d - 1] + weight * agreement[d];
                extension = agreement[d] * Math.pow(p, d + 1);
            } else {
                T lItem = longList.get(d);
                int increment = sRunning.contains(lItem) ? 1 : 0;
                lRunning.add(lItem);

                overlapCount[d] = overlapCount[d - 1] + increment;
                agreement[d] = (double) overlapCount[d] / (d + 1);
                rbo[d] = rbo[d - 1] + weight * agreement[d];

                int settled = overlapCount[s - 1];
                disjoint += weight * ((double) settled * (d + 1 - s) / ((double) (d + 1) * s));
                extension = ((double) (overlapCount[d] - settled) / (d + 1) + (double) settled / s)
                    * Math.pow(p, d + 1);
            }
        }

        return rbo[l - 1] + disjoint + extension;
    }

    static void requirePersistence(double p) {
        if (!(p > 0.0 && p < 1.0)) {
            throw new InvalidParameterException("Persistence p must satisfy 0 < p < 1, got " + p);
        }
    }

    private static void requireLists(RankedList<?> a, RankedList<?> b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Both rankings must not be null");
        }
    }
}
