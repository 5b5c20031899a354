package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.MatchResult;

/**
 * Bonus quando l'infrazione cita lo stesso numero di documento di un chunk
 * corrispondente (nei metadati o nel nome della sorgente).
 */
public class DocumentReferenceStage implements ScoringStage {

    @Override
    public String name() {
        return "document-reference";
    }

    @Override
    public double apply(double score, CalibrationInput input) {
        String ref = input.infraction().documentRef();
        if (ref == null) return score;
        for (MatchResult m : input.matches()) {
            if (ref.equals(m.chunk().documentNumber()) || m.chunk().source().contains(ref)) {
                return score * 1.15;
            }
        }
        return score;
    }
}
