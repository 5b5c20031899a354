package it.aw.specrepeal.infraction;

/**
 * Cattura prodotta dai passaggi di estrazione.
 * {@link Pair} porta la keyword che ha aperto il blocco, {@link Scalar} solo il testo.
 */
public interface KeywordCapture {

    String value();

    /** Offset nel testo ripulito. */
    int position();

    record Pair(String keyword, String value, int position) implements KeywordCapture {}

    record Scalar(String value, int position) implements KeywordCapture {}

    static String keywordOf(KeywordCapture capture) {
        return capture instanceof Pair pair ? pair.keyword() : null;
    }
}
