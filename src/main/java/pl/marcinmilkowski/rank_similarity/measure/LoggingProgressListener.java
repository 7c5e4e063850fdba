package pl.marcinmilkowski.rank_similarity.measure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports progress through the application log.
 */
public class LoggingProgressListener implements ProgressListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final String label;

    public LoggingProgressListener(String label) {
        this.label = label;
    }

    @Override
    public void onProgress(int percent) {
        logger.info("{}: current progress {} %...", label, percent);
    }

    @Override
    public void onFinished() {
        logger.info("{}: finished", label);
    }
}
