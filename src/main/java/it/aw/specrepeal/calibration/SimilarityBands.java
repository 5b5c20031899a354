package it.aw.specrepeal.calibration;

/**
 * Tabella di conversione similarita' coseno &rarr; punteggio base.
 * Le soglie sono tarate sul coseno grezzo di un modello di embedding di frasi,
 * dove testi correlati ma non equivalenti cadono tipicamente tra 0.5 e 0.7.
 */
public final class SimilarityBands {

    private static final double[] LOWER_BOUNDS = {0.90, 0.80, 0.70, 0.60, 0.45};
    private static final double[] SCORES = {95, 85, 70, 55, 40};
    private static final double FLOOR = 20;

    private SimilarityBands() {}

    public static double score(double similarity) {
        for (int i = 0; i < LOWER_BOUNDS.length; i++) {
            if (similarity >= LOWER_BOUNDS[i]) return SCORES[i];
        }
        return FLOOR;
    }
}
