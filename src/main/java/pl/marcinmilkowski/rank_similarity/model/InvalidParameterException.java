package pl.marcinmilkowski.rank_similarity.model;

/**
 * Thrown for a persistence outside (0, 1) or an evaluation depth that resolves to zero.
 */
public class InvalidParameterException extends RankingException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
