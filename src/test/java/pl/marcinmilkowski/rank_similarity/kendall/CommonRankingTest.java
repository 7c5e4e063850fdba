package pl.marcinmilkowski.rank_similarity.kendall;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.rank_similarity.model.RankedList;

import static org.junit.jupiter.api.Assertions.*;

class CommonRankingTest {

    @Test
    @DisplayName("Both sequences describe the same items at the same positions")
    void testPairedRanks() {
        RankedList<String> s = RankedList.of("a", "b", "c", "d", "e");
        RankedList<String> t = RankedList.of("x", "d", "a", "y");

        CommonRanking common = CommonRanking.of(s, t);

        assertEquals(2, common.size());
        // items a, d in the order of the first list
        assertArrayEquals(new double[]{0, 3}, common.firstRanks());
        assertArrayEquals(new double[]{2, 1}, common.secondRanks());
    }

    @Test
    void testNoCommonItems() {
        CommonRanking common = CommonRanking.of(RankedList.of("a"), RankedList.of("b"));
        assertEquals(0, common.size());
    }
}
