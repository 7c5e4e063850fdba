package pl.marcinmilkowski.rank_similarity.model;

/**
 * Base type for invalid ranking input or parameters.
 *
 * Extends IllegalArgumentException so callers that only guard against
 * bad arguments keep working.
 */
public class RankingException extends IllegalArgumentException {

    public RankingException(String message) {
        super(message);
    }
}
