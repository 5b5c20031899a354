package it.aw.specrepeal.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Riconosce numeri di documento e revisioni delle specifiche
 * (es. "Document 022178", "TD-022178", "Guys 022178 REV 13").
 */
public final class DocumentIdentifiers {

    private static final Pattern PREFIXED_NUMBER = Pattern.compile(
            "\\b(?:document|doc\\.?|spec(?:ification)?|std\\.?|standard|TD)\\s*(?:no\\.?|number|#)?\\s*[-:#]?\\s*(\\d{5,7})\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_NUMBER = Pattern.compile("(?<![\\d.])(\\d{6})(?![\\d.])");
    private static final Pattern REVISION = Pattern.compile(
            "\\b(?:rev\\.?|revision)\\s*[:#]?\\s*(\\d{1,3}[A-Z]?)\\b",
            Pattern.CASE_INSENSITIVE);

    private DocumentIdentifiers() {}

    /** Numero documento con prefisso esplicito, oppure null. */
    public static String prefixedNumber(String text) {
        return firstGroup(PREFIXED_NUMBER, text);
    }

    /**
     * Numero documento: prima la forma con prefisso, poi un identificativo
     * numerico nudo di sei cifre. Null se assente.
     */
    public static String documentNumber(String text) {
        String prefixed = prefixedNumber(text);
        return prefixed != null ? prefixed : firstGroup(BARE_NUMBER, text);
    }

    public static String revision(String text) {
        return firstGroup(REVISION, text);
    }

    private static String firstGroup(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) return null;
        Matcher m = pattern.matcher(text);
        if (!m.find()) return null;
        String group = m.group(1);
        return (group == null || group.isEmpty()) ? null : group;
    }
}
