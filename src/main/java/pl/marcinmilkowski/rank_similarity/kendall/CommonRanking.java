package pl.marcinmilkowski.rank_similarity.kendall;

import pl.marcinmilkowski.rank_similarity.model.RankedList;

import java.util.Map;
import java.util.Set;

/**
 * Paired rank sequences over the items two rankings have in common.
 *
 * Position i of both arrays refers to the same item. Items are ordered by
 * their rank in the first list, which keeps the pairing consistent; the
 * correlation does not depend on which shared order is used.
 */
public record CommonRanking(double[] firstRanks, double[] secondRanks) {

    public static <T> CommonRanking of(RankedList<T> first, RankedList<T> second) {
        Set<T> common = first.commonItems(second);
        Map<T, Integer> firstIndex = first.ranksWithin(common);
        Map<T, Integer> secondIndex = second.ranksWithin(common);

        double[] a = new double[common.size()];
        double[] b = new double[common.size()];
        int i = 0;
        for (T item : common) {
            a[i] = firstIndex.get(item);
            b[i] = secondIndex.get(item);
            i++;
        }
        return new CommonRanking(a, b);
    }

    public int size() {
        return firstRanks.length;
    }
}
