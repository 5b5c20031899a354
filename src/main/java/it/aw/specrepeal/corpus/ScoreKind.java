package it.aw.specrepeal.corpus;

/**
 * Scala dei punteggi restituiti da un indice vettoriale.
 * La conversione nella similarita' coseno canonica avviene solo in {@code SimilarityScale}.
 */
public enum ScoreKind {
    /** Relevance LangChain4j: (cos + 1) / 2, range [0, 1]. */
    RELEVANCE,
    /** Distanza euclidea tra vettori unitari, range [0, 2]. */
    L2_DISTANCE,
    /** Similarita' coseno, range [-1, 1]. */
    COSINE
}
