package it.aw.specrepeal.service;

import it.aw.specrepeal.model.SectionType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rileva i confini di sezione nel testo di una specifica usando pattern espliciti
 * e conservativi (keyword e numerazioni, nessuna euristica sulle MAIUSCOLE generiche).
 * <p>
 * Tipi riconosciuti:
 * <ul>
 *   <li>TABLE: "Table N", "TABLE 3A"</li>
 *   <li>FIGURE: "Figure N", "Fig. N"</li>
 *   <li>PURPOSE: "Purpose", "Purpose and Scope", "Scope"</li>
 *   <li>NOTES: "Notes", "Note 7", "Notes:"</li>
 *   <li>GENERAL: "References", "Document 022178", "1. Titolo", "1.2 Titolo", "Section N", "Appendix A"</li>
 * </ul>
 *
 * Il rilevamento opera riga per riga; l'offset di ogni confine e' la posizione
 * del primo carattere della riga nel testo analizzato.
 */
public class SectionDetector {

    /**
     * Un confine rilevato: posizione nel testo, tipo della sezione che inizia e titolo.
     * L'offset e' 0-based rispetto all'inizio del testo analizzato.
     */
    public record SectionBoundary(int offset, SectionType type, String title) {}

    // numerazione opzionale davanti alle keyword: "3.1 Table 2", "4. Notes"
    private static final String NUM = "^\\s*(?:\\d+(?:\\.\\d+)*\\.?\\s+)?";

    private static final Pattern TABLE = Pattern.compile(
            NUM + "Table\\s+\\d+[A-Z]?\\b.*", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIGURE = Pattern.compile(
            NUM + "(Figure|Fig\\.)\\s*\\d+[A-Z]?\\b.*", Pattern.CASE_INSENSITIVE);
    private static final Pattern PURPOSE = Pattern.compile(
            NUM + "(Purpose(\\s+(and|&)\\s+Scope)?|Scope)\\s*(:.*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOTES = Pattern.compile(
            NUM + "(Notes?\\s*(:.*)?|Note\\s+\\d+\\b.*)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern REFERENCES = Pattern.compile(
            NUM + "References\\s*:?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOCUMENT_HEADER = Pattern.compile(
            "^\\s*(Document|Doc\\.)\\s*(No\\.?|Number)?\\s*:?\\s*\\d{5,7}\\b.*", Pattern.CASE_INSENSITIVE);
    // "1. Titolo" oppure "1.2 Titolo": un numero singolo senza punto e' una riga di tabella
    private static final Pattern NUMBERED = Pattern.compile(
            "^\\s*(\\d+\\.|\\d+\\.\\d+(\\.\\d+){0,2}\\.?)\\s+[A-Z][A-Za-z].{0,100}$");
    private static final Pattern SECTION_KEYWORD = Pattern.compile(
            "^\\s*(Section\\s+\\d+|Appendix\\s+[A-Z])\\b.*", Pattern.CASE_INSENSITIVE);

    private SectionDetector() {}

    /**
     * Analizza il testo e restituisce i confini rilevati, in ordine di posizione.
     *
     * @param text testo da analizzare (tipicamente una pagina)
     * @return lista di {@link SectionBoundary}, vuota se nessun confine trovato
     */
    public static List<SectionBoundary> detect(String text) {
        List<SectionBoundary> boundaries = new ArrayList<>();
        int offset = 0;
        for (String line : text.split("\n", -1)) {
            SectionType type = classify(line);
            if (type != null) {
                boundaries.add(new SectionBoundary(offset, type, line.trim()));
            }
            offset += line.length() + 1; // +1 per il '\n'
        }
        return boundaries;
    }

    /**
     * Determina il tipo di sezione aperto da una riga, oppure null se la riga non e' un confine.
     */
    public static SectionType classify(String line) {
        if (line == null || line.isBlank()) return null;
        // le righe lunghe sono prosa che cita una tabella, non un'intestazione
        if (line.trim().length() > 160) return null;
        if (TABLE.matcher(line).matches()) return SectionType.TABLE;
        if (FIGURE.matcher(line).matches()) return SectionType.FIGURE;
        if (PURPOSE.matcher(line).matches()) return SectionType.PURPOSE;
        if (NOTES.matcher(line).matches()) return SectionType.NOTES;
        if (REFERENCES.matcher(line).matches()
                || DOCUMENT_HEADER.matcher(line).matches()
                || SECTION_KEYWORD.matcher(line).matches()
                || NUMBERED.matcher(line).matches()) {
            return SectionType.GENERAL;
        }
        return null;
    }
}
