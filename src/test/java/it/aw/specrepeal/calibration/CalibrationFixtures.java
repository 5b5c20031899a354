package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.EquipmentCategory;
import it.aw.specrepeal.model.Infraction;
import it.aw.specrepeal.model.MatchResult;
import it.aw.specrepeal.model.SectionType;
import it.aw.specrepeal.model.Severity;
import it.aw.specrepeal.model.SpecChunk;

final class CalibrationFixtures {

    private CalibrationFixtures() {}

    static Infraction infraction(String text) {
        return infraction(text, EquipmentCategory.GENERAL, null);
    }

    static Infraction infraction(String text, EquipmentCategory category, String documentRef) {
        return new Infraction(text, text.toLowerCase(), Severity.MEDIUM, category, documentRef, 0, "go-back");
    }

    static MatchResult match(Infraction infraction, String chunkText, double score) {
        return match(infraction, chunkText, "spec.pdf", null, score, 0);
    }

    static MatchResult match(Infraction infraction, String chunkText, String source, String documentNumber,
                             double score, int index) {
        SpecChunk chunk = new SpecChunk(chunkText, source, 1, SectionType.GENERAL, documentNumber, null);
        return new MatchResult(infraction, chunk, index, score);
    }
}
