package it.aw.specrepeal.infraction;

import it.aw.specrepeal.model.EquipmentCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ambito impiantistico per punteggio di parole chiave: vince la categoria con piu'
 * termini presenti; a parita' prevale quella aerea; nessun termine = GENERAL.
 */
public final class EquipmentClassifier {

    private static final Map<EquipmentCategory, List<String>> TERMS = new EnumMap<>(EquipmentCategory.class);

    static {
        TERMS.put(EquipmentCategory.OVERHEAD_POLE,
                List.of("pole", "crossarm", "overhead", "clearance", "attachment", "guy"));
        TERMS.put(EquipmentCategory.UNDERGROUND,
                List.of("underground", "conduit", "trench", "buried", "depth", "vault"));
    }

    private EquipmentClassifier() {}

    public static EquipmentCategory classify(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        EquipmentCategory best = EquipmentCategory.GENERAL;
        int bestScore = 0;
        for (Map.Entry<EquipmentCategory, List<String>> e : TERMS.entrySet()) {
            int score = 0;
            for (String term : e.getValue()) {
                if (lower.contains(term)) score++;
            }
            if (score > bestScore) {
                best = e.getKey();
                bestScore = score;
            }
        }
        return best;
    }

    /** Termini della categoria, vuoto per GENERAL. */
    public static List<String> termsOf(EquipmentCategory category) {
        return TERMS.getOrDefault(category, List.of());
    }
}
