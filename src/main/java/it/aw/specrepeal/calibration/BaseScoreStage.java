package it.aw.specrepeal.calibration;

/** Punteggio base dalla similarita' migliore; 0 senza match. */
public class BaseScoreStage implements ScoringStage {

    @Override
    public String name() {
        return "base-score";
    }

    @Override
    public double apply(double score, CalibrationInput input) {
        if (!input.hasMatches()) return 0;
        return SimilarityBands.score(input.bestSimilarity());
    }
}
