package it.aw.specrepeal.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link VectorIndex} su {@link InMemoryEmbeddingStore} di LangChain4j.
 * <p>
 * Lo store restituisce punteggi di relevance ((cos + 1) / 2); l'id di ogni embedding
 * e' la posizione del chunk in forma testuale. La persistenza usa il formato JSON
 * nativo dello store.
 */
public class LangChain4jVectorIndex implements VectorIndex {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final InMemoryEmbeddingStore<TextSegment> store;
    private int count;

    public LangChain4jVectorIndex() {
        this(new InMemoryEmbeddingStore<>(), 0);
    }

    private LangChain4jVectorIndex(InMemoryEmbeddingStore<TextSegment> store, int count) {
        this.store = store;
        this.count = count;
    }

    /** Costruisce un indice con un embedding per ogni vettore, nell'ordine dato. */
    public static LangChain4jVectorIndex build(List<float[]> vectors) {
        LangChain4jVectorIndex index = new LangChain4jVectorIndex();
        for (int i = 0; i < vectors.size(); i++) {
            index.add(i, vectors.get(i));
        }
        return index;
    }

    /** Carica un indice serializzato con {@link #persist(Path)}. */
    public static LangChain4jVectorIndex load(Path file) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        JsonNode entries = JSON.readTree(json).path("entries");
        int count = entries.isArray() ? entries.size() : 0;
        return new LangChain4jVectorIndex(InMemoryEmbeddingStore.fromJson(json), count);
    }

    @Override
    public void add(int chunkIndex, float[] vector) {
        store.add(String.valueOf(chunkIndex), Embedding.from(vector));
        count++;
    }

    @Override
    public List<IndexHit> search(float[] query, int k) {
        if (count == 0 || k < 1) return List.of();
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(Embedding.from(query))
                .maxResults(k)
                .minScore(0.0)
                .build();
        List<IndexHit> hits = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : store.search(request).matches()) {
            hits.add(new IndexHit(Integer.parseInt(match.embeddingId()), match.score(), ScoreKind.RELEVANCE));
        }
        return hits;
    }

    @Override
    public int totalCount() {
        return count;
    }

    @Override
    public void persist(Path file) throws IOException {
        Files.writeString(file, store.serializeToJson(), StandardCharsets.UTF_8);
    }

    @Override
    public ScoreKind scoreKind() {
        return ScoreKind.RELEVANCE;
    }
}
