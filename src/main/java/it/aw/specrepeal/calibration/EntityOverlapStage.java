package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.MatchResult;
import it.aw.specrepeal.text.EntityExtractor;
import it.aw.specrepeal.text.EntityType;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * +5 per ogni tipo di entita' (misura, valore elettrico, norma) dell'infrazione
 * che compare alla lettera in un chunk corrispondente; al massimo +15.
 * <p>
 * Le entita' sono estratte da entrambi i testi e confrontate come valori interi
 * ("10 feet" non coincide con "110 feet"), ignorando maiuscole e spazi.
 */
public class EntityOverlapStage implements ScoringStage {

    static final double PER_TYPE = 5;
    static final double CAP = 15;

    @Override
    public String name() {
        return "entity-overlap";
    }

    @Override
    public double apply(double score, CalibrationInput input) {
        if (!input.hasMatches()) return score;
        Map<EntityType, Set<String>> entities = EntityExtractor.extract(input.infraction().rawText());
        if (entities.isEmpty()) return score;
        double bonus = 0;
        for (Map.Entry<EntityType, Set<String>> e : entities.entrySet()) {
            if (foundInMatches(e.getKey(), keys(e.getValue()), input)) bonus += PER_TYPE;
        }
        return score + Math.min(bonus, CAP);
    }

    private static boolean foundInMatches(EntityType type, Set<String> values, CalibrationInput input) {
        for (MatchResult m : input.matches()) {
            Set<String> chunkValues = EntityExtractor.extract(m.chunk().text()).get(type);
            if (chunkValues == null) continue;
            for (String v : chunkValues) {
                if (values.contains(key(v))) return true;
            }
        }
        return false;
    }

    private static Set<String> keys(Set<String> values) {
        Set<String> keys = new HashSet<>();
        for (String v : values) keys.add(key(v));
        return keys;
    }

    private static String key(String value) {
        return value.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
