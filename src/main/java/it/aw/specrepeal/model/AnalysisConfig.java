package it.aw.specrepeal.model;

/**
 * Parametri di una singola analisi di audit: profondita' di ricerca,
 * soglia di similarita' minima e tabella delle soglie di decisione.
 */
public record AnalysisConfig(
        int        topK,
        int        categoryTopK,      // k per infrazioni con flag di categoria
        double     minSimilarity,
        double     highThreshold,
        double     mediumThreshold,
        int        minMatches,
        int        maxInfractions,
        ReviewMode reviewMode
) {

    public static final int    DEFAULT_TOP_K            = 5;
    public static final int    DEFAULT_CATEGORY_TOP_K   = 8;
    public static final double DEFAULT_MIN_SIMILARITY   = 0.40;
    public static final double DEFAULT_HIGH_THRESHOLD   = 85;
    public static final double DEFAULT_MEDIUM_THRESHOLD = 60;
    public static final int    DEFAULT_MIN_MATCHES      = 2;
    public static final int    DEFAULT_MAX_INFRACTIONS  = 100;

    /** Costruttore compatto con validazione. */
    public AnalysisConfig {
        if (topK < 1 || categoryTopK < 1) {
            throw new IllegalArgumentException("topK e categoryTopK devono essere >= 1");
        }
        if (minSimilarity < -1 || minSimilarity > 1) {
            throw new IllegalArgumentException("minSimilarity fuori range [-1, 1]: " + minSimilarity);
        }
        if (mediumThreshold > highThreshold) {
            throw new IllegalArgumentException(
                    "mediumThreshold (" + mediumThreshold + ") deve essere <= highThreshold (" + highThreshold + ")");
        }
        if (highThreshold < 0 || highThreshold > 100 || mediumThreshold < 0) {
            throw new IllegalArgumentException("le soglie devono essere nel range [0, 100]");
        }
        if (minMatches < 0 || maxInfractions < 1) {
            throw new IllegalArgumentException("minMatches deve essere >= 0 e maxInfractions >= 1");
        }
        if (reviewMode == null) {
            reviewMode = ReviewMode.THREE_TIER;
        }
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(DEFAULT_TOP_K, DEFAULT_CATEGORY_TOP_K, DEFAULT_MIN_SIMILARITY,
                DEFAULT_HIGH_THRESHOLD, DEFAULT_MEDIUM_THRESHOLD, DEFAULT_MIN_MATCHES,
                DEFAULT_MAX_INFRACTIONS, ReviewMode.THREE_TIER);
    }

    public int kFor(Infraction infraction) {
        return infraction.categoryFlagged() ? categoryTopK : topK;
    }

    public AnalysisConfig withReviewMode(ReviewMode mode) {
        return new AnalysisConfig(topK, categoryTopK, minSimilarity, highThreshold, mediumThreshold,
                minMatches, maxInfractions, mode);
    }

    public AnalysisConfig withMinSimilarity(double value) {
        return new AnalysisConfig(topK, categoryTopK, value, highThreshold, mediumThreshold,
                minMatches, maxInfractions, reviewMode);
    }
}
