package it.aw.specrepeal.infraction;

import it.aw.specrepeal.error.EmptyDocumentException;
import it.aw.specrepeal.model.EquipmentCategory;
import it.aw.specrepeal.model.Infraction;
import it.aw.specrepeal.model.Severity;
import it.aw.specrepeal.text.DocumentIdentifiers;
import it.aw.specrepeal.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Estrae le candidate infrazioni dal testo di un audit.
 * <p>
 * Due passaggi sul testo ripulito:
 * <ol>
 *   <li>strutturato: righe {@code [elenco] keyword [#N] : descrizione}; la descrizione
 *       prosegue fino a una riga vuota o alla successiva riga con keyword</li>
 *   <li>scansione: ogni riga fuori dai blocchi strutturati che contiene una keyword
 *       di scansione diventa una candidata</li>
 * </ol>
 * Seguono filtro per lunghezza, classificazione, deduplica e ordinamento per posizione.
 * Le catture malformate sono scartate senza errori.
 */
public class InfractionExtractor {

    private static final Logger log = LoggerFactory.getLogger(InfractionExtractor.class);

    private final ExtractionParams params;
    private final Pattern structuredLine;
    private final List<String> scanKeywords;

    public InfractionExtractor(ExtractionParams params) {
        this.params = params;
        String alternation = params.structuredKeywords().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.structuredLine = Pattern.compile(
                "^[ ]*(?:[-*\\u2022\\u00B7>]|\\d{1,3}[.)])?[ ]*((?:" + alternation + "))[ ]*(?:#[ ]*(\\d+))?[ ]*:[ ]*(.*)$",
                Pattern.CASE_INSENSITIVE);
        this.scanKeywords = params.scanKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    public InfractionExtractor() {
        this(ExtractionParams.defaults());
    }

    public List<Infraction> extract(String auditText) {
        return extract(auditText, params.maxInfractions());
    }

    /**
     * @throws EmptyDocumentException se il testo e' vuoto
     */
    public List<Infraction> extract(String auditText, int maxInfractions) {
        if (auditText == null || auditText.isBlank()) {
            throw new EmptyDocumentException("Testo di audit vuoto");
        }
        String text = AuditTextCleaner.clean(auditText);
        List<Line> lines = Line.split(text);

        boolean[] structured = new boolean[lines.size()];
        List<KeywordCapture> captures = new ArrayList<>(structuredPass(lines, structured));
        captures.addAll(scanPass(lines, structured));

        Map<String, Infraction> unique = new LinkedHashMap<>();
        captures.stream()
                .sorted(Comparator.comparingInt(KeywordCapture::position))
                .map(this::toInfraction)
                .filter(i -> i != null)
                .forEach(i -> unique.putIfAbsent(i.normalizedText(), i));

        List<Infraction> result = unique.values().stream()
                .limit(maxInfractions)
                .collect(Collectors.toList());
        log.debug("Estrazione: {} catture, {} infrazioni", captures.size(), result.size());
        return result;
    }

    private List<KeywordCapture> structuredPass(List<Line> lines, boolean[] structured) {
        List<KeywordCapture> captures = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            Matcher m = structuredLine.matcher(lines.get(i).text());
            if (!m.matches()) {
                i++;
                continue;
            }
            String keyword = m.group(1);
            Line first = lines.get(i);
            int blockStart = first.offset() + m.start(1);
            StringBuilder block = new StringBuilder(first.text().substring(m.start(1)).strip());
            structured[i] = true;
            i++;
            while (i < lines.size()
                    && !lines.get(i).text().isBlank()
                    && !structuredLine.matcher(lines.get(i).text()).matches()) {
                block.append('\n').append(lines.get(i).text().strip());
                structured[i] = true;
                i++;
            }
            String description = m.group(3);
            boolean hasContinuation = block.indexOf("\n") >= 0;
            if ((description == null || description.isBlank()) && !hasContinuation) {
                continue;
            }
            captures.add(new KeywordCapture.Pair(keyword, block.toString(), blockStart));
        }
        return captures;
    }

    private List<KeywordCapture> scanPass(List<Line> lines, boolean[] structured) {
        List<KeywordCapture> captures = new ArrayList<>();
        if (scanKeywords.isEmpty()) return captures;
        for (int i = 0; i < lines.size(); i++) {
            if (structured[i]) continue;
            Line line = lines.get(i);
            String lower = line.text().toLowerCase(Locale.ROOT);
            for (String keyword : scanKeywords) {
                if (lower.contains(keyword)) {
                    String value = line.text().strip();
                    if (!value.isEmpty()) {
                        captures.add(new KeywordCapture.Scalar(value, line.offset() + leading(line.text())));
                    }
                    break;
                }
            }
        }
        return captures;
    }

    private Infraction toInfraction(KeywordCapture capture) {
        String raw = capture.value();
        if (raw == null) return null;
        String collapsed = TextNormalizer.collapseWhitespace(raw);
        if (collapsed.length() < params.minLength() || collapsed.length() > params.maxLength()) {
            return null;
        }
        Severity severity = SeverityClassifier.classify(collapsed);
        EquipmentCategory category = EquipmentClassifier.classify(collapsed);
        return new Infraction(
                raw.strip(),
                TextNormalizer.dedupKey(collapsed),
                severity,
                category,
                DocumentIdentifiers.documentNumber(collapsed),
                capture.position(),
                KeywordCapture.keywordOf(capture));
    }

    private static int leading(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == ' ') i++;
        return i;
    }

    /** Riga del testo ripulito con il suo offset. */
    private record Line(String text, int offset) {
        static List<Line> split(String text) {
            List<Line> lines = new ArrayList<>();
            int offset = 0;
            for (String l : text.split("\n", -1)) {
                lines.add(new Line(l, offset));
                offset += l.length() + 1;
            }
            return lines;
        }
    }
}
