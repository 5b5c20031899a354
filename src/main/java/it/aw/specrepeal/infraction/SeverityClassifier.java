package it.aw.specrepeal.infraction;

import it.aw.specrepeal.model.Severity;

import java.util.List;
import java.util.Locale;

/** Severita' per parole chiave; i termini di sicurezza prevalgono su quelli minori. */
public final class SeverityClassifier {

    private static final List<String> HIGH = List.of("safety", "critical", "hazard", "danger", "energized");
    private static final List<String> LOW = List.of("minor", "cosmetic", "typo", "formatting");

    private SeverityClassifier() {}

    public static Severity classify(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (containsAny(lower, HIGH)) return Severity.HIGH;
        if (containsAny(lower, LOW)) return Severity.LOW;
        return Severity.MEDIUM;
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String t : terms) {
            if (text.contains(t)) return true;
        }
        return false;
    }
}
