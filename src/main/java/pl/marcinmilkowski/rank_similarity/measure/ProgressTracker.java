package pl.marcinmilkowski.rank_similarity.measure;

/**
 * Turns loop steps into percentage notifications at a fixed granularity.
 *
 * One tracker belongs to one computation; it is not thread-safe.
 */
final class ProgressTracker {

    private final int total;
    private final int delta;
    private final ProgressListener listener;
    private int lastReported;

    ProgressTracker(int total, int delta, ProgressListener listener) {
        if (delta <= 0) {
            throw new IllegalArgumentException("Progress delta must be positive: " + delta);
        }
        this.total = total;
        this.delta = delta;
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    /**
     * Record that step {@code step} of {@code total} is being processed.
     */
    void step(int step) {
        if (listener == ProgressListener.NONE) {
            return;
        }
        int current = (int) (100L * step / total);
        if (current >= lastReported + delta) {
            listener.onProgress(current);
            lastReported = current;
        }
        if (step == total - 1) {
            listener.onProgress(100);
            listener.onFinished();
        }
    }
}
