package pl.marcinmilkowski.rank_similarity.measure;

/**
 * Observer for long similarity computations.
 *
 * Receives integer percentages of completion. Implementations must not
 * influence the computation they observe.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = percent -> { };

    /**
     * @param percent completion in [0, 100]
     */
    void onProgress(int percent);

    /**
     * Called once after the last step has been reported.
     */
    default void onFinished() {
    }
}
