package it.aw.specrepeal.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estrazione a pattern delle entita' critiche: misure, valori elettrici e
 * citazioni di norme (GO 95, NESC, ASTM, IEEE, ANSI).
 */
public final class EntityExtractor {

    private static final Map<EntityType, List<Pattern>> PATTERNS = new EnumMap<>(EntityType.class);

    static {
        PATTERNS.put(EntityType.MEASUREMENT, List.of(
                Pattern.compile("\\b\\d+(?:\\.\\d+)?\\s*(?:feet|foot|ft|inches|inch|in\\.|meters|metres|mm|cm)(?![a-z])",
                        Pattern.CASE_INSENSITIVE),
                Pattern.compile("\\b\\d+(?:\\.\\d+)?\\s*(?:'|\")")));
        PATTERNS.put(EntityType.ELECTRICAL_RATING, List.of(
                Pattern.compile("\\b\\d+(?:\\.\\d+)?\\s*(?:kV|kVA|volts?|amps?|kcmil|AWG)\\b",
                        Pattern.CASE_INSENSITIVE)));
        PATTERNS.put(EntityType.STANDARD_CITATION, List.of(
                Pattern.compile("\\bG\\.?O\\.?\\s*-?\\s*(?:95|128|165)(?:\\s*,?\\s*Rule\\s+\\d+(?:\\.\\d+)*)?",
                        Pattern.CASE_INSENSITIVE),
                Pattern.compile("\\bNESC\\s+(?:Rule\\s+)?\\d+[A-Z]?", Pattern.CASE_INSENSITIVE),
                Pattern.compile("\\b(?:ASTM|IEEE|ANSI|NEMA|UL)\\s*[A-Z]?\\d+(?:\\.\\d+)*")));
    }

    private EntityExtractor() {}

    /** Entita' trovate per tipo, nell'ordine di apparizione e senza duplicati. */
    public static Map<EntityType, Set<String>> extract(String text) {
        Map<EntityType, Set<String>> found = new EnumMap<>(EntityType.class);
        if (text == null || text.isEmpty()) return found;
        for (Map.Entry<EntityType, List<Pattern>> e : PATTERNS.entrySet()) {
            Set<String> values = new LinkedHashSet<>();
            for (Pattern p : e.getValue()) {
                Matcher m = p.matcher(text);
                while (m.find()) {
                    values.add(TextNormalizer.collapseWhitespace(m.group()));
                }
            }
            if (!values.isEmpty()) found.put(e.getKey(), Collections.unmodifiableSet(values));
        }
        return found;
    }

    /** Tutte le entita' di un tipo, lista vuota se assenti. */
    public static List<String> extract(String text, EntityType type) {
        Set<String> values = extract(text).get(type);
        return values == null ? List.of() : new ArrayList<>(values);
    }
}
