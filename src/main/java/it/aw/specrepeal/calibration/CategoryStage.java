package it.aw.specrepeal.calibration;

import it.aw.specrepeal.infraction.EquipmentClassifier;
import it.aw.specrepeal.model.MatchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Solo per infrazioni con flag di categoria: bonus se un termine della categoria
 * usato dall'infrazione compare anche nei metadati (sorgente, numero documento)
 * di un chunk corrispondente.
 */
public class CategoryStage implements ScoringStage {

    @Override
    public String name() {
        return "category";
    }

    @Override
    public double apply(double score, CalibrationInput input) {
        if (!input.infraction().categoryFlagged()) return score;
        String infraction = input.infraction().rawText().toLowerCase(Locale.ROOT);
        List<String> shared = new ArrayList<>();
        for (String term : EquipmentClassifier.termsOf(input.infraction().category())) {
            if (infraction.contains(term)) shared.add(term);
        }
        if (shared.isEmpty()) return score;
        for (MatchResult m : input.matches()) {
            String meta = (m.chunk().source() + " "
                    + (m.chunk().documentNumber() != null ? m.chunk().documentNumber() : ""))
                    .toLowerCase(Locale.ROOT);
            for (String term : shared) {
                if (meta.contains(term)) return score * 1.1;
            }
        }
        return score;
    }
}
