package it.aw.specrepeal.infraction;

import java.util.List;

/**
 * Parametri dell'estrazione delle infrazioni.
 * structuredKeywords aprono un blocco "keyword: descrizione"; scanKeywords
 * segnalano righe candidate nel testo libero.
 */
public record ExtractionParams(
        List<String> structuredKeywords,
        List<String> scanKeywords,
        int          minLength,
        int          maxLength,
        int          maxInfractions
) {

    public static final List<String> DEFAULT_STRUCTURED_KEYWORDS = List.of(
            "go-back", "go back", "goback", "infraction", "violation", "issue",
            "non-compliance", "non-conformance", "deficiency", "finding");

    public static final List<String> DEFAULT_SCAN_KEYWORDS = List.of(
            "go-back", "infraction", "violation", "deficiency", "non-compliant", "non-conforming",
            "does not meet", "fails to meet", "not in compliance", "out of compliance",
            "correction required", "missing", "incomplete", "failed");

    public static final int DEFAULT_MIN_LENGTH = 20;
    public static final int DEFAULT_MAX_LENGTH = 1000;

    public ExtractionParams {
        if (structuredKeywords == null || structuredKeywords.isEmpty()) {
            throw new IllegalArgumentException("structuredKeywords non puo' essere vuoto");
        }
        scanKeywords = scanKeywords == null ? List.of() : List.copyOf(scanKeywords);
        structuredKeywords = List.copyOf(structuredKeywords);
        if (minLength < 1 || maxLength < minLength) {
            throw new IllegalArgumentException(
                    "lunghezze non valide: min=" + minLength + ", max=" + maxLength);
        }
        if (maxInfractions < 1) {
            throw new IllegalArgumentException("maxInfractions deve essere >= 1 (ricevuto: " + maxInfractions + ")");
        }
    }

    public static ExtractionParams defaults() {
        return new ExtractionParams(DEFAULT_STRUCTURED_KEYWORDS, DEFAULT_SCAN_KEYWORDS,
                DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH, 100);
    }

    public ExtractionParams withMaxInfractions(int max) {
        return new ExtractionParams(structuredKeywords, scanKeywords, minLength, maxLength, max);
    }
}
