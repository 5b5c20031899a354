package it.aw.specrepeal.model;

/**
 * Corrispondenza tra un'infrazione e un chunk del corpus.
 * score e' una similarita' coseno nel range canonico [-1, 1].
 */
public record MatchResult(Infraction infraction, SpecChunk chunk, int chunkIndex, double score) {

    public int scorePercent() {
        return (int) Math.round(score * 100);
    }
}
