package it.aw.specrepeal.corpus;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.specrepeal.error.EmbeddingProviderException;
import it.aw.specrepeal.error.IndexNotReadyException;
import it.aw.specrepeal.error.IngestionBusyException;
import it.aw.specrepeal.error.IntegrityException;
import it.aw.specrepeal.model.CorpusStats;
import it.aw.specrepeal.model.IngestResult;
import it.aw.specrepeal.model.SourceRecord;
import it.aw.specrepeal.model.SpecChunk;
import it.aw.specrepeal.registry.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Proprietario del corpus di una directory: snapshot corrente, persistenza e registro sorgenti.
 * <p>
 * Concorrenza:
 * <ul>
 *   <li>un solo scrittore alla volta ({@link ReentrantLock}); in modalita' non bloccante
 *       un secondo scrittore riceve {@link IngestionBusyException}</li>
 *   <li>i lettori usano lo snapshot pubblicato tramite riferimento volatile, mai uno stato parziale</li>
 *   <li>ogni batch di embedding viene aggiunto a un nuovo snapshot, verificato, persistito
 *       e solo allora pubblicato</li>
 *   <li>un errore del provider riporta il corpus allo stato di inizio ingestione;
 *       un annullamento conserva invece i batch gia' committati</li>
 * </ul>
 * Piu' manager su directory diverse possono convivere nello stesso processo.
 */
public class CorpusIndexManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CorpusIndexManager.class);

    /** Impostazioni di un manager. */
    public record Settings(boolean dedupEnabled, boolean blocking) {
        public static Settings defaults() {
            return new Settings(true, true);
        }
    }

    private final Path storeDir;
    private final EmbeddingGateway gateway;
    private final SourceRegistry registry;
    private final Settings settings;
    private final CorpusStorage storage;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile CorpusIndex current;

    private CorpusIndexManager(Path storeDir, EmbeddingGateway gateway, SourceRegistry registry,
                               Settings settings, ObjectMapper objectMapper) {
        this.storeDir = storeDir;
        this.gateway = gateway;
        this.registry = registry;
        this.settings = settings;
        this.storage = new CorpusStorage(storeDir, objectMapper);
        this.current = CorpusIndex.empty(gateway.modelId());
    }

    /** Carica il corpus della directory indicata, o ne crea uno vuoto. */
    public static CorpusIndexManager open(Path storeDir, EmbeddingGateway gateway,
                                          SourceRegistry registry, Settings settings) {
        return open(storeDir, gateway, registry, settings, new ObjectMapper());
    }

    public static CorpusIndexManager open(Path storeDir, EmbeddingGateway gateway, SourceRegistry registry,
                                          Settings settings, ObjectMapper objectMapper) {
        CorpusIndexManager manager = new CorpusIndexManager(storeDir, gateway, registry, settings, objectMapper);
        manager.load();
        return manager;
    }

    // ── Lettura ──────────────────────────────────────────────────────────────

    /** Snapshot corrente; resta valido anche se nel frattempo ne viene pubblicato uno nuovo. */
    public CorpusIndex snapshot() {
        return current;
    }

    public boolean isReady() {
        return !current.isEmpty();
    }

    /**
     * @throws IndexNotReadyException se il corpus e' vuoto
     */
    public List<IndexHit> search(float[] queryVector, int k) {
        CorpusIndex snapshot = current;
        if (snapshot.isEmpty()) {
            throw new IndexNotReadyException("Corpus vuoto: indicizzare almeno una specifica");
        }
        return snapshot.search(queryVector, k);
    }

    public List<SourceRecord> sources() {
        return registry.findAll();
    }

    public CorpusStats stats() {
        CorpusIndex snapshot = current;
        return new CorpusStats(registry.totalSources(), snapshot.size(), snapshot.modelId(),
                snapshot.embeddingDim(), storeDir.toAbsolutePath().toString());
    }

    public EmbeddingGateway gateway() {
        return gateway;
    }

    // ── Scrittura ────────────────────────────────────────────────────────────

    /**
     * Aggiunge i chunk di una sorgente, un batch di embedding alla volta.
     * <p>
     * Con deduplica attiva una sorgente gia' completa non produce modifiche; una sorgente
     * interrotta riprende dal numero di chunk gia' committati.
     *
     * @throws EmbeddingProviderException dopo aver ripristinato corpus e registro allo stato iniziale
     */
    public IngestResult ingest(String source, String contentHash, List<SpecChunk> chunks,
                               IngestCancellation cancellation) {
        acquireWriteLock();
        try {
            CorpusIndex before = current;
            Optional<SourceRecord> priorRecord = contentHash != null
                    ? registry.findByHash(contentHash) : Optional.empty();
            int start = 0;
            if (settings.dedupEnabled() && contentHash != null) {
                if (priorRecord.isPresent()) {
                    SourceRecord rec = priorRecord.get();
                    if (rec.complete()) {
                        log.info("Sorgente gia' indicizzata: {} (come '{}'), nessuna modifica",
                                source, rec.sourceName());
                        return IngestResult.skipped(source, current.size());
                    }
                    start = Math.min(rec.chunkCount(), chunks.size());
                    log.info("Ripresa ingestione di {} dal chunk {} di {}", source, start, chunks.size());
                }
            }

            BatchOutcome outcome;
            try {
                outcome = commitBatches(source, contentHash, chunks, start, cancellation);
            } catch (EmbeddingProviderException e) {
                rollback(before, contentHash, priorRecord);
                log.error("Ingestione di {} fallita per errore del provider: corpus riportato a {} chunk",
                        source, current.size(), e);
                throw e;
            }
            int added = outcome.added();
            boolean complete = outcome.complete();
            if (complete && added == 0 && contentHash != null) {
                registry.upsert(new SourceRecord(contentHash, source, LocalDateTime.now(), chunks.size(), true));
            }

            log.info("Ingestione {}: {} chunk aggiunti, totale corpus {} chunk{}",
                    source, added, current.size(), complete ? "" : " (incompleta)");
            return new IngestResult(source, added, current.size(), false, complete);
        } finally {
            writeLock.unlock();
        }
    }

    /** Rimuove i chunk di una sorgente riusando i vettori esistenti. Ritorna i chunk rimossi. */
    public int removeSource(String source) {
        acquireWriteLock();
        try {
            CorpusIndex next = current.withoutSource(source);
            int removed = current.size() - next.size();
            if (removed > 0) commit(next);
            registry.removeBySourceName(source);
            log.info("Sorgente rimossa: {} ({} chunk)", source, removed);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /** Svuota corpus e registro. Operazione distruttiva esplicita. */
    public void reset() {
        acquireWriteLock();
        try {
            storage.deleteAll();
            registry.clear();
            current = CorpusIndex.empty(gateway.modelId());
            log.warn("Corpus azzerato: {}", storeDir.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Errore durante l'azzeramento del corpus " + storeDir, e);
        } finally {
            writeLock.unlock();
        }
    }

    /** Ricalcola tutti i vettori dal chunk store e ricostruisce l'indice. */
    public void rebuildFromChunks() {
        acquireWriteLock();
        try {
            rebuild(current.chunks());
        } finally {
            writeLock.unlock();
        }
    }

    /** Riscrive i tre artefatti dello snapshot corrente. */
    public void persist() {
        acquireWriteLock();
        try {
            storage.persist(current);
        } catch (IOException e) {
            throw new UncheckedIOException("Errore di persistenza del corpus " + storeDir, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        registry.close();
        gateway.close();
        log.info("CorpusIndexManager chiuso: {}", storeDir.toAbsolutePath());
    }

    // ── Caricamento e riparazione ────────────────────────────────────────────

    private void load() {
        if (!storage.hasChunks()) {
            log.info("Nessun corpus in {}, partenza da zero", storeDir.toAbsolutePath());
            return;
        }
        List<SpecChunk> chunks;
        try {
            chunks = storage.readChunks();
        } catch (IOException e) {
            throw new IntegrityException("Chunk store illeggibile in " + storeDir
                    + ": re-indicizzare le specifiche", e);
        }

        if (storage.rebuildRequired()) {
            log.warn("Marker {} presente: ricostruzione dal chunk store", CorpusStorage.REBUILD_MARKER);
            rebuild(chunks);
            return;
        }

        Optional<CorpusStorage.VectorFile> vectorFile = storage.readVectors();
        if (vectorFile.isEmpty()
                || vectorFile.get().vectors() == null
                || vectorFile.get().vectors().size() != chunks.size()
                || !gateway.modelId().equals(vectorFile.get().modelId())) {
            log.warn("Vector store assente, incoerente o di un altro modello: ricalcolo di {} vettori",
                    chunks.size());
            rebuild(chunks);
            return;
        }
        List<float[]> vectors = vectorFile.get().vectors();

        Optional<VectorIndex> index = storage.readIndex();
        VectorIndex vectorIndex;
        if (index.isPresent() && index.get().totalCount() == chunks.size()) {
            vectorIndex = index.get();
        } else {
            log.warn("Indice assente o incoerente: ricostruzione dal vector store ({} vettori)", vectors.size());
            vectorIndex = LangChain4jVectorIndex.build(vectors);
            try {
                storage.persistIndex(vectorIndex);
            } catch (IOException e) {
                throw new UncheckedIOException("Errore di scrittura dell'indice in " + storeDir, e);
            }
        }
        try {
            current = new CorpusIndex(chunks, vectors, vectorIndex, gateway.modelId());
        } catch (IntegrityException e) {
            log.warn("Vector store incoerente ({}): ricostruzione dal chunk store", e.getMessage());
            rebuild(chunks);
            return;
        }
        log.info("Corpus caricato da {}: {} chunk, dim={}", storeDir.toAbsolutePath(),
                current.size(), current.embeddingDim());
    }

    private void rebuild(List<SpecChunk> chunks) {
        List<String> texts = new ArrayList<>(chunks.size());
        for (SpecChunk c : chunks) texts.add(c.text());
        List<float[]> vectors = gateway.embedAll(texts);
        commit(new CorpusIndex(chunks, vectors, LangChain4jVectorIndex.build(vectors), gateway.modelId()));
        try {
            storage.clearRebuildMarker();
        } catch (IOException e) {
            throw new UncheckedIOException("Impossibile rimuovere il marker di ricostruzione", e);
        }
        log.info("Corpus ricostruito: {} chunk ricalcolati con il modello {}", chunks.size(), gateway.modelId());
    }

    private record BatchOutcome(int added, boolean complete) {}

    /** Embedding e commit dei batch da start in poi; si ferma tra un batch e l'altro se annullato. */
    private BatchOutcome commitBatches(String source, String contentHash, List<SpecChunk> chunks, int start,
                                       IngestCancellation cancellation) {
        int batchSize = gateway.batchSize();
        int added = 0;
        for (int from = start; from < chunks.size(); from += batchSize) {
            if (cancellation.shouldStop()) {
                log.warn("Ingestione di {} annullata dopo {} chunk su {}", source, from, chunks.size());
                return new BatchOutcome(added, false);
            }
            int to = Math.min(from + batchSize, chunks.size());
            List<SpecChunk> batch = chunks.subList(from, to);
            List<String> texts = new ArrayList<>(batch.size());
            for (SpecChunk c : batch) texts.add(c.text());

            List<float[]> vectors = gateway.embedBatch(texts);
            CorpusIndex next;
            try {
                next = current.append(batch, vectors);
            } catch (IntegrityException e) {
                storage.markRebuildRequired();
                log.error("Invariante del corpus violata durante l'ingestione di {}", source, e);
                throw e;
            }
            commit(next);
            added += batch.size();
            if (contentHash != null) {
                registry.upsert(new SourceRecord(contentHash, source, LocalDateTime.now(),
                        to, to == chunks.size()));
            }
            log.debug("Batch committato: {} [{}-{}), corpus={} chunk", source, from, to, current.size());
        }
        return new BatchOutcome(added, true);
    }

    /**
     * Ripristina lo stato di inizio ingestione: snapshot e riga del registro.
     * I batch committati prima dell'errore vengono scartati.
     */
    private void rollback(CorpusIndex before, String contentHash, Optional<SourceRecord> priorRecord) {
        if (current != before) commit(before);
        if (contentHash == null) return;
        if (priorRecord.isPresent()) {
            registry.upsert(priorRecord.get());
        } else {
            registry.removeByHash(contentHash);
        }
    }

    /** Persiste e pubblica lo snapshot; se la persistenza fallisce lo snapshot corrente non cambia. */
    private void commit(CorpusIndex next) {
        try {
            storage.persist(next);
        } catch (IOException e) {
            throw new UncheckedIOException("Errore di persistenza del corpus " + storeDir, e);
        }
        current = next;
    }

    private void acquireWriteLock() {
        if (settings.blocking()) {
            writeLock.lock();
        } else if (!writeLock.tryLock()) {
            throw new IngestionBusyException("Un'altra ingestione e' in corso su " + storeDir);
        }
    }
}
