package pl.marcinmilkowski.rank_similarity.model;

/**
 * Thrown when the input to {@link RankedList#from(Object)} is not an ordered sequence.
 */
public class UnsupportedRankingTypeException extends RankingException {

    public UnsupportedRankingTypeException(Object input) {
        super("Unsupported ranking type: "
            + (input == null ? "null" : input.getClass().getName())
            + " (expected a List or an array)");
    }
}
