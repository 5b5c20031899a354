package it.aw.specrepeal.service;

import it.aw.specrepeal.corpus.CorpusIndexManager;
import it.aw.specrepeal.corpus.IngestCancellation;
import it.aw.specrepeal.error.EmptyDocumentException;
import it.aw.specrepeal.model.ChunkingParams;
import it.aw.specrepeal.model.CorpusStats;
import it.aw.specrepeal.model.IngestResult;
import it.aw.specrepeal.model.PageText;
import it.aw.specrepeal.model.SourceRecord;
import it.aw.specrepeal.model.SpecChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Gestisce il ciclo di vita delle specifiche nel corpus: ingestione, re-ingestione e rimozione.
 * <p>
 * Pipeline di ingestione:
 * <ol>
 *   <li>Hash SHA-256 del contenuto (byte originali se disponibili, altrimenti testo delle pagine)</li>
 *   <li>Chunking con metadati strutturali via {@link DocumentChunker}: un documento
 *       senza testo viene rifiutato prima di qualsiasi modifica</li>
 *   <li>Embedding a batch, commit e persistenza via {@link CorpusIndexManager}</li>
 * </ol>
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final CorpusIndexManager corpus;
    private final ChunkingParams chunkingParams;

    public IngestionService(CorpusIndexManager corpus, ChunkingParams chunkingParams) {
        this.corpus = corpus;
        this.chunkingParams = chunkingParams;
    }

    /** Indicizza una specifica a partire dalle pagine estratte. */
    public IngestResult ingestDocument(List<PageText> pages, String sourceName) {
        return ingestDocument(pages, sourceName, null, IngestCancellation.NONE);
    }

    public IngestResult ingestDocument(List<PageText> pages, String sourceName, byte[] rawBytes) {
        return ingestDocument(pages, sourceName, rawBytes, IngestCancellation.NONE);
    }

    /**
     * @param rawBytes     contenuto originale del file per la deduplica; null per usare il testo
     * @param cancellation controllato tra un batch e l'altro
     * @throws EmptyDocumentException se il documento non produce chunk
     */
    public IngestResult ingestDocument(List<PageText> pages, String sourceName, byte[] rawBytes,
                                       IngestCancellation cancellation) {
        log.info("Inizio ingestione: {} ({} pagine), chunkSize={}, overlap={}",
                sourceName, pages.size(), chunkingParams.chunkSize(), chunkingParams.overlap());
        List<SpecChunk> chunks = DocumentChunker.chunk(pages, sourceName, chunkingParams);
        String hash = rawBytes != null ? sha256(rawBytes) : sha256(pagesFingerprint(pages));
        IngestResult result = corpus.ingest(sourceName, hash, chunks, cancellation);
        log.info("Ingestione {}: {} chunk su {} aggiunti (skipped={}, complete={})",
                sourceName, result.chunksAdded(), chunks.size(), result.skipped(), result.complete());
        return result;
    }

    /**
     * Sostituisce una specifica con una nuova versione: i chunk della versione
     * precedente con lo stesso nome vengono rimossi prima dell'ingestione.
     */
    public IngestResult reingestDocument(List<PageText> pages, String sourceName, byte[] rawBytes) {
        DocumentChunker.chunk(pages, sourceName, chunkingParams);
        int removed = corpus.removeSource(sourceName);
        log.info("Re-ingestione {}: {} chunk della versione precedente rimossi", sourceName, removed);
        return ingestDocument(pages, sourceName, rawBytes);
    }

    public IngestResult reingestDocument(List<PageText> pages, String sourceName) {
        return reingestDocument(pages, sourceName, null);
    }

    /** Ritorna il numero di chunk rimossi (0 se la sorgente non esiste). */
    public int removeSource(String sourceName) {
        return corpus.removeSource(sourceName);
    }

    public void reset() {
        corpus.reset();
    }

    public List<SourceRecord> listSources() {
        return corpus.sources();
    }

    public CorpusStats stats() {
        return corpus.stats();
    }

    private static String pagesFingerprint(List<PageText> pages) {
        StringBuilder sb = new StringBuilder();
        for (PageText p : pages) {
            if (p.isBlank()) continue;
            sb.append(p.pageNumber()).append('\u0000').append(p.text()).append('\u0000');
        }
        return sb.toString();
    }

    private static String sha256(String text) {
        return sha256(text.getBytes(StandardCharsets.UTF_8));
    }

    static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 non disponibile", e);
        }
    }
}
