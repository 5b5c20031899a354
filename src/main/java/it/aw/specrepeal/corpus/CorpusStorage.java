package it.aw.specrepeal.corpus;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.specrepeal.model.SpecChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * Layout su disco di un corpus:
 * <pre>
 *   chunks.json       chunk store (fonte di verita')
 *   vectors.json      model id, dimensione e vettori, paralleli ai chunk
 *   index.json        snapshot dell'InMemoryEmbeddingStore
 *   REBUILD_REQUIRED  marker: forza la ricostruzione dal chunk store al prossimo caricamento
 * </pre>
 * Ogni file viene scritto su {@code *.tmp} e poi spostato atomicamente sul nome finale.
 */
public class CorpusStorage {

    private static final Logger log = LoggerFactory.getLogger(CorpusStorage.class);

    public static final String CHUNKS_FILE = "chunks.json";
    public static final String VECTORS_FILE = "vectors.json";
    public static final String INDEX_FILE = "index.json";
    public static final String REBUILD_MARKER = "REBUILD_REQUIRED";

    private static final TypeReference<List<SpecChunk>> CHUNK_LIST_TYPE = new TypeReference<>() {};

    /** Contenuto di vectors.json. */
    public record VectorFile(String modelId, int dim, List<float[]> vectors) {}

    private final Path dir;
    private final ObjectMapper objectMapper;

    public CorpusStorage(Path dir, ObjectMapper objectMapper) {
        this.dir = dir;
        this.objectMapper = objectMapper;
    }

    public Path dir() {
        return dir;
    }

    public boolean hasChunks() {
        return Files.exists(dir.resolve(CHUNKS_FILE));
    }

    public List<SpecChunk> readChunks() throws IOException {
        return objectMapper.readValue(dir.resolve(CHUNKS_FILE).toFile(), CHUNK_LIST_TYPE);
    }

    /** Vuoto se il file manca o non e' leggibile: il vector store e' ricostruibile dai chunk. */
    public Optional<VectorFile> readVectors() {
        Path file = dir.resolve(VECTORS_FILE);
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), VectorFile.class));
        } catch (IOException e) {
            log.warn("Vector store illeggibile ({}): {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /** Vuoto se il file manca o non e' leggibile: l'indice e' ricostruibile dai vettori. */
    public Optional<VectorIndex> readIndex() {
        Path file = dir.resolve(INDEX_FILE);
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.of(LangChain4jVectorIndex.load(file));
        } catch (IOException | RuntimeException e) {
            log.warn("Indice illeggibile ({}): {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /** Scrive i tre artefatti: prima tutti i temporanei, poi gli spostamenti atomici. */
    public void persist(CorpusIndex snapshot) throws IOException {
        Files.createDirectories(dir);
        Path chunksTmp = dir.resolve(CHUNKS_FILE + ".tmp");
        Path vectorsTmp = dir.resolve(VECTORS_FILE + ".tmp");
        Path indexTmp = dir.resolve(INDEX_FILE + ".tmp");

        objectMapper.writeValue(chunksTmp.toFile(), snapshot.chunks());
        objectMapper.writeValue(vectorsTmp.toFile(),
                new VectorFile(snapshot.modelId(), snapshot.embeddingDim(), snapshot.storedVectors()));
        snapshot.index().persist(indexTmp);

        moveAtomic(chunksTmp, dir.resolve(CHUNKS_FILE));
        moveAtomic(vectorsTmp, dir.resolve(VECTORS_FILE));
        moveAtomic(indexTmp, dir.resolve(INDEX_FILE));
        log.debug("Corpus persistito in {}: {} chunk", dir, snapshot.size());
    }

    public void persistIndex(VectorIndex index) throws IOException {
        Path tmp = dir.resolve(INDEX_FILE + ".tmp");
        index.persist(tmp);
        moveAtomic(tmp, dir.resolve(INDEX_FILE));
    }

    public boolean rebuildRequired() {
        return Files.exists(dir.resolve(REBUILD_MARKER));
    }

    public void markRebuildRequired() {
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(REBUILD_MARKER), "rebuild");
        } catch (IOException e) {
            log.error("Impossibile scrivere il marker {} in {}", REBUILD_MARKER, dir, e);
        }
    }

    public void clearRebuildMarker() throws IOException {
        Files.deleteIfExists(dir.resolve(REBUILD_MARKER));
    }

    /** Elimina tutti gli artefatti del corpus (il registro e' gestito a parte). */
    public void deleteAll() throws IOException {
        for (String name : List.of(CHUNKS_FILE, VECTORS_FILE, INDEX_FILE, REBUILD_MARKER)) {
            Files.deleteIfExists(dir.resolve(name));
            Files.deleteIfExists(dir.resolve(name + ".tmp"));
        }
    }

    private static void moveAtomic(Path from, Path to) throws IOException {
        Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
