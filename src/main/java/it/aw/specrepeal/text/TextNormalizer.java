package it.aw.specrepeal.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizzazioni testuali condivise da ingestione ed estrazione.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {}

    /** Collassa spazi, tab e a-capo interni in un singolo spazio. */
    public static String collapseWhitespace(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /** Chiave di confronto: spazi collassati e minuscolo. */
    public static String dedupKey(String text) {
        return collapseWhitespace(text).toLowerCase(Locale.ROOT);
    }

    /** Anteprima di al massimo maxLength caratteri, con "..." se troncata. */
    public static String snippet(String text, int maxLength) {
        String collapsed = collapseWhitespace(text);
        return collapsed.length() > maxLength
                ? collapsed.substring(0, maxLength) + "..."
                : collapsed;
    }
}
