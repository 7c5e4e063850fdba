package pl.marcinmilkowski.rank_similarity.model;

/**
 * Thrown when a ranked list holds the same item at two ranks.
 */
public class DuplicateItemException extends RankingException {

    private final Object item;
    private final int firstRank;
    private final int secondRank;

    public DuplicateItemException(Object item, int firstRank, int secondRank) {
        super(String.format("Duplicate item '%s' at ranks %d and %d", item, firstRank, secondRank));
        this.item = item;
        this.firstRank = firstRank;
        this.secondRank = secondRank;
    }

    public Object getItem() {
        return item;
    }

    public int getFirstRank() {
        return firstRank;
    }

    public int getSecondRank() {
        return secondRank;
    }
}
