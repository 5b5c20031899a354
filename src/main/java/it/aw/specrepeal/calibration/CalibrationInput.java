package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.Infraction;
import it.aw.specrepeal.model.MatchResult;

import java.util.List;

/** Infrazione e relativi match (gia' ordinati per similarita' decrescente). */
public record CalibrationInput(Infraction infraction, List<MatchResult> matches) {

    public CalibrationInput {
        matches = List.copyOf(matches);
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }

    /** Similarita' migliore, oppure NaN se non ci sono match. */
    public double bestSimilarity() {
        double best = Double.NaN;
        for (MatchResult m : matches) {
            if (Double.isNaN(best) || m.score() > best) best = m.score();
        }
        return best;
    }
}
