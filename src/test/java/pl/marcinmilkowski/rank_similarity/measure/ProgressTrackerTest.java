package pl.marcinmilkowski.rank_similarity.measure;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    private static final class RecordingListener implements ProgressListener {
        final List<Integer> reported = new ArrayList<>();
        int finished;

        @Override
        public void onProgress(int percent) {
            reported.add(percent);
        }

        @Override
        public void onFinished() {
            finished++;
        }
    }

    @Test
    void testReportsAtGranularity() {
        RecordingListener listener = new RecordingListener();
        ProgressTracker tracker = new ProgressTracker(5, 10, listener);

        for (int i = 1; i < 5; i++) {
            tracker.step(i);
        }

        assertEquals(List.of(20, 40, 60, 80, 100), listener.reported);
        assertEquals(1, listener.finished);
    }

    @Test
    void testCoarseGranularitySkipsSteps() {
        RecordingListener listener = new RecordingListener();
        ProgressTracker tracker = new ProgressTracker(100, 25, listener);

        for (int i = 1; i < 100; i++) {
            tracker.step(i);
        }

        assertEquals(List.of(25, 50, 75, 100), listener.reported);
        assertEquals(1, listener.finished);
    }

    @Test
    void testInvalidDelta() {
        assertThrows(IllegalArgumentException.class, () -> new ProgressTracker(10, 0, ProgressListener.NONE));
    }
}
