package it.aw.specrepeal.matching;

import it.aw.specrepeal.corpus.IndexHit;
import it.aw.specrepeal.corpus.ScoreKind;

/**
 * Unico punto di conversione dei punteggi dell'indice nella similarita' coseno
 * canonica in [-1, 1]. I vettori sono a norma unitaria.
 */
public final class SimilarityScale {

    private SimilarityScale() {}

    public static double toCosine(double raw, ScoreKind kind) {
        double cos = switch (kind) {
            case RELEVANCE -> 2 * raw - 1;
            case L2_DISTANCE -> 1 - (raw * raw) / 2;
            case COSINE -> raw;
        };
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    public static double toCosine(IndexHit hit) {
        return toCosine(hit.score(), hit.kind());
    }
}
