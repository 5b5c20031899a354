package it.aw.specrepeal.calibration;

/** Piu' passaggi concordanti rafforzano la confidenza. */
public class MatchCountStage implements ScoringStage {

    @Override
    public String name() {
        return "match-count";
    }

    @Override
    public double apply(double score, CalibrationInput input) {
        int n = input.matches().size();
        if (n >= 3) return score * 1.2;
        if (n >= 2) return score * 1.1;
        return score;
    }
}
