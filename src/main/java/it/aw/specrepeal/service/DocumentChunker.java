package it.aw.specrepeal.service;

import it.aw.specrepeal.error.EmptyDocumentException;
import it.aw.specrepeal.model.ChunkingParams;
import it.aw.specrepeal.model.PageText;
import it.aw.specrepeal.model.SectionType;
import it.aw.specrepeal.model.SpecChunk;
import it.aw.specrepeal.text.DocumentIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trasforma il testo per pagina di una specifica in chunk con metadati strutturali.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Concatenazione delle pagine non vuote con mappa degli offset ({@link PagedText})</li>
 *   <li>Pagine con confini di sezione: buffer per sezione, flush al confine col tipo
 *       della sezione <em>precedente</em>; target in parole maggiore per tabelle e figure.
 *       Un chunk non supera mai il target: le righe lunghe vengono spezzate con overlap</li>
 *   <li>Pagine senza confini: finestre di chunkSize parole con overlap, tipo ereditato</li>
 *   <li>Pagina stimata dall'offset del primo carattere; numero documento e revisione
 *       dal chunk o, in mancanza, dal documento</li>
 *   <li>Scarto dei chunk sotto minChunkChars caratteri</li>
 * </ol>
 * Trasformazione pura: nessun effetto collaterale.
 */
public final class DocumentChunker {

    private static final Logger log = LoggerFactory.getLogger(DocumentChunker.class);

    private static final Pattern WORD = Pattern.compile("\\S+");

    private DocumentChunker() {}

    /**
     * @throws EmptyDocumentException se il documento non produce alcun chunk
     */
    public static List<SpecChunk> chunk(List<PageText> pages, String sourceName, ChunkingParams params) {
        PagedText paged = PagedText.of(pages);
        if (paged.isEmpty()) {
            throw new EmptyDocumentException("Nessun testo estratto da " + sourceName);
        }

        String docNumber = DocumentIdentifiers.documentNumber(sourceName);
        String docRevision = DocumentIdentifiers.revision(sourceName);
        String firstPage = paged.pageText(0);
        if (docNumber == null) docNumber = DocumentIdentifiers.prefixedNumber(firstPage);
        if (docRevision == null) docRevision = DocumentIdentifiers.revision(firstPage);

        Accumulator acc = new Accumulator(paged, sourceName, params, docNumber, docRevision);
        for (int p = 0; p < paged.pageOffsets().size(); p++) {
            String pageText = paged.pageText(p);
            int pageStart = paged.pageStart(p);
            if (SectionDetector.detect(pageText).isEmpty()) {
                acc.windowPage(pageText, pageStart);
            } else {
                acc.sectionPage(pageText, pageStart);
            }
        }
        acc.flush();

        if (acc.chunks.isEmpty()) {
            throw new EmptyDocumentException("Nessun chunk valido prodotto da " + sourceName);
        }
        log.debug("Chunking {}: {} pagine, {} chunk (doc={}, rev={})",
                sourceName, paged.pageOffsets().size(), acc.chunks.size(), docNumber, docRevision);
        return List.copyOf(acc.chunks);
    }

    /** Stato del chunking lungo il documento: sezione corrente e buffer aperto. */
    private static final class Accumulator {

        private final PagedText paged;
        private final String source;
        private final ChunkingParams params;
        private final String docNumber;
        private final String docRevision;
        private final List<SpecChunk> chunks = new ArrayList<>();

        private SectionType current = SectionType.GENERAL;
        private final StringBuilder buffer = new StringBuilder();
        private int bufferStart = -1;
        private int bufferWords = 0;

        Accumulator(PagedText paged, String source, ChunkingParams params,
                    String docNumber, String docRevision) {
            this.paged = paged;
            this.source = source;
            this.params = params;
            this.docNumber = docNumber;
            this.docRevision = docRevision;
        }

        void sectionPage(String pageText, int pageStart) {
            int offset = pageStart;
            for (String line : pageText.split("\n", -1)) {
                SectionType boundary = SectionDetector.classify(line);
                if (boundary != null) {
                    flush();
                    current = boundary;
                }
                if (!line.isBlank()) appendLine(line, offset);
                offset += line.length() + 1;
            }
        }

        /**
         * Aggiunge una riga al buffer senza superare il target in parole: la parte
         * eccedente prosegue nel chunk successivo, ripartendo con overlap parole.
         */
        private void appendLine(String line, int lineStart) {
            List<int[]> words = words(line);
            int limit = target(current);
            int i = 0;
            while (i < words.size()) {
                int end = Math.min(words.size(), i + (limit - bufferWords));
                if (bufferStart < 0) bufferStart = lineStart + words.get(i)[0];
                if (buffer.length() > 0) buffer.append('\n');
                buffer.append(line, words.get(i)[0], words.get(end - 1)[1]);
                bufferWords += end - i;
                if (bufferWords >= limit) {
                    flush();
                    if (end < words.size()) {
                        i = Math.max(end - params.overlap(), i + 1);
                        continue;
                    }
                }
                i = end;
            }
        }

        void windowPage(String pageText, int pageStart) {
            flush();
            List<int[]> words = words(pageText);
            if (words.isEmpty()) return;

            int size = params.chunkSize();
            int step = size - params.overlap();
            for (int from = 0; from < words.size(); from += step) {
                int to = Math.min(from + size, words.size());
                StringBuilder sb = new StringBuilder();
                for (int i = from; i < to; i++) {
                    if (sb.length() > 0) sb.append(' ');
                    int[] w = words.get(i);
                    sb.append(pageText, w[0], w[1]);
                }
                emit(sb.toString(), pageStart + words.get(from)[0]);
                if (to == words.size()) break;
            }
        }

        void flush() {
            if (buffer.length() > 0) {
                emit(buffer.toString(), bufferStart);
            }
            buffer.setLength(0);
            bufferStart = -1;
            bufferWords = 0;
        }

        private void emit(String text, int startOffset) {
            String trimmed = text.strip();
            if (trimmed.length() < params.minChunkChars()) {
                log.trace("Chunk scartato ({} caratteri): '{}'", trimmed.length(), trimmed);
                return;
            }
            String number = DocumentIdentifiers.prefixedNumber(trimmed);
            String revision = DocumentIdentifiers.revision(trimmed);
            chunks.add(new SpecChunk(trimmed, source, paged.pageAt(Math.max(startOffset, 0)), current,
                    number != null ? number : docNumber,
                    revision != null ? revision : docRevision));
        }

        private int target(SectionType type) {
            return type.isTabular() ? params.tableChunkSize() : params.chunkSize();
        }

        /** Posizioni {inizio, fine} delle parole nel testo. */
        private static List<int[]> words(String text) {
            List<int[]> words = new ArrayList<>();
            Matcher m = WORD.matcher(text);
            while (m.find()) words.add(new int[]{m.start(), m.end()});
            return words;
        }
    }
}
