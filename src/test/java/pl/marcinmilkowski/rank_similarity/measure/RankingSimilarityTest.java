package pl.marcinmilkowski.rank_similarity.measure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.rank_similarity.kendall.KendallResult;
import pl.marcinmilkowski.rank_similarity.kendall.KendallTauB;
import pl.marcinmilkowski.rank_similarity.kendall.RankCorrelation;
import pl.marcinmilkowski.rank_similarity.model.RankedList;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the RankingSimilarity facade.
 */
class RankingSimilarityTest {

    private static RankingSimilarity<String> similarity(List<String> s, List<String> t) {
        return new RankingSimilarity<>(RankedList.of(s), RankedList.of(t));
    }

    @Test
    @DisplayName("Default rbo() is the unweighted average overlap over the shorter list")
    void testDefaultRbo() {
        RankingSimilarity<String> sim = similarity(List.of("a", "b", "c", "d", "e"), List.of("e", "d", "c"));
        assertEquals(1.0 / 9.0, sim.rbo(), 1e-12);
    }

    @Test
    void testDefaultRboExtUsesHighPersistence() {
        RankingSimilarity<String> sim = similarity(List.of("a", "b", "c"), List.of("a", "c", "x", "b"));
        assertEquals(RankBiasedOverlap.extrapolated(sim.first(), sim.second(), 0.98), sim.rboExt());
    }

    @Test
    @DisplayName("Kendall on identical lists: tau = 1 and full coverage")
    void testKendallIdentical() {
        KendallResult result = similarity(List.of("a", "b", "c"), List.of("a", "b", "c")).kendall();

        assertEquals(1.0, result.coefficient(), 1e-12);
        assertEquals(3, result.commonCount());
        assertEquals(100.0, result.firstCoverage(), 1e-12);
        assertEquals(100.0, result.secondCoverage(), 1e-12);
        assertTrue(result.isDefined());
    }

    @Test
    void testKendallReversed() {
        KendallResult result = similarity(List.of("a", "b", "c"), List.of("c", "b", "a")).kendall();
        assertEquals(-1.0, result.coefficient(), 1e-12);
    }

    @Test
    @DisplayName("Kendall only sees the common items")
    void testKendallPartialOverlap() {
        KendallResult result = similarity(List.of("a", "b", "c", "d", "e"), List.of("e", "d", "c")).kendall();

        assertEquals(-1.0, result.coefficient(), 1e-12);
        assertEquals(3, result.commonCount());
        assertEquals(60.0, result.firstCoverage(), 1e-12);
        assertEquals(100.0, result.secondCoverage(), 1e-12);
    }

    @Test
    void testKendallUndefinedWithoutEnoughCommonItems() {
        KendallResult single = similarity(List.of("a", "b"), List.of("b", "x")).kendall();
        assertFalse(single.isDefined());
        assertEquals(1, single.commonCount());
        assertEquals(50.0, single.firstCoverage(), 1e-12);

        KendallResult none = similarity(List.of("a", "b"), List.of("x", "y")).kendall();
        assertFalse(none.isDefined());
        assertEquals(0, none.commonCount());
        assertEquals(0.0, none.secondCoverage(), 1e-12);
    }

    @Test
    @DisplayName("Kendall delegates to the supplied correlation")
    void testKendallUsesCollaborator() {
        List<double[]> seen = new ArrayList<>();
        RankCorrelation recording = new RankCorrelation() {
            @Override
            public double correlation(double[] a, double[] b) {
                seen.add(a);
                seen.add(b);
                return 0.5;
            }

            @Override
            public String name() {
                return "recording";
            }
        };

        RankingSimilarity<String> sim = new RankingSimilarity<>(
            RankedList.of("a", "b", "c", "d", "e"), RankedList.of("e", "d", "c"),
            recording, ProgressListener.NONE, 10);

        assertEquals(0.5, sim.kendall().coefficient());
        assertArrayEquals(new double[]{2, 3, 4}, seen.get(0));
        assertArrayEquals(new double[]{2, 1, 0}, seen.get(1));
    }

    @Test
    @DisplayName("Progress reporting does not change results")
    void testProgressDoesNotAffectResults() {
        List<String> s = new ArrayList<>();
        List<String> t = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            s.add("item" + i);
            t.add("item" + ((i * 7) % 200));
        }
        List<Integer> reported = new ArrayList<>();

        RankingSimilarity<String> quiet = similarity(s, t.subList(0, 150));
        RankingSimilarity<String> noisy = new RankingSimilarity<>(RankedList.of(s), RankedList.of(t.subList(0, 150)),
            new KendallTauB(), reported::add, 5);

        assertEquals(quiet.rbo(RankBiasedOverlap.UNBOUNDED, 0.9, true),
            noisy.rbo(RankBiasedOverlap.UNBOUNDED, 0.9, true));
        assertEquals(quiet.rboExt(0.95), noisy.rboExt(0.95));
        assertFalse(reported.isEmpty());
        assertEquals(100, reported.get(reported.size() - 1));
    }

    @Test
    @DisplayName("Coverage figures use a dot decimal separator whatever the default locale")
    void testCoverageFormattingIgnoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("pl", "PL"));
            assertEquals("100.000", RankingSimilarity.formatPercent(100.0));
            assertEquals("60.000", RankingSimilarity.formatPercent(60.0).trim());

            KendallResult result = similarity(List.of("a", "b", "c"), List.of("c", "b", "a")).kendall();
            assertTrue(result.toString().contains("tau=-1.0000"), result.toString());
            assertTrue(result.toString().contains("100.000%"), result.toString());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void testConstructorValidation() {
        RankedList<String> s = RankedList.of("a");
        assertThrows(IllegalArgumentException.class, () -> new RankingSimilarity<>(null, s));
        assertThrows(IllegalArgumentException.class,
            () -> new RankingSimilarity<>(s, s, null, ProgressListener.NONE, 10));
        assertThrows(IllegalArgumentException.class,
            () -> new RankingSimilarity<>(s, s, new KendallTauB(), ProgressListener.NONE, 0));
    }
}
