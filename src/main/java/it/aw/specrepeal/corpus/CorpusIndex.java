package it.aw.specrepeal.corpus;

import it.aw.specrepeal.error.IntegrityException;
import it.aw.specrepeal.model.SpecChunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot immutabile del corpus: chunk ordinati, vettori paralleli e indice.
 * <p>
 * Il vincolo {@code chunks.size() == vectors.size() == index.totalCount()} e la
 * dimensione uniforme dei vettori sono verificati alla costruzione: un lettore
 * vede sempre uno snapshot completo.
 */
public final class CorpusIndex {

    private final List<SpecChunk> chunks;
    private final List<float[]> vectors;
    private final VectorIndex index;
    private final int embeddingDim;
    private final String modelId;

    public CorpusIndex(List<SpecChunk> chunks, List<float[]> vectors, VectorIndex index, String modelId) {
        this.chunks = List.copyOf(chunks);
        this.vectors = List.copyOf(vectors);
        this.index = index;
        this.modelId = modelId;
        if (this.chunks.size() != this.vectors.size() || this.vectors.size() != index.totalCount()) {
            throw new IntegrityException("Snapshot incoerente: chunk=" + this.chunks.size()
                    + ", vettori=" + this.vectors.size() + ", indice=" + index.totalCount());
        }
        int dim = this.vectors.isEmpty() ? 0 : this.vectors.get(0).length;
        for (float[] v : this.vectors) {
            if (v.length != dim) {
                throw new IntegrityException("Dimensione vettori non uniforme: " + v.length + " != " + dim);
            }
        }
        this.embeddingDim = dim;
    }

    public static CorpusIndex empty(String modelId) {
        return new CorpusIndex(List.of(), List.of(), new LangChain4jVectorIndex(), modelId);
    }

    /** Nuovo snapshot con i chunk aggiunti in coda; l'indice viene ricostruito. */
    public CorpusIndex append(List<SpecChunk> newChunks, List<float[]> newVectors) {
        if (newChunks.size() != newVectors.size()) {
            throw new IntegrityException("Batch incoerente: " + newChunks.size()
                    + " chunk, " + newVectors.size() + " vettori");
        }
        List<SpecChunk> c = new ArrayList<>(chunks);
        c.addAll(newChunks);
        List<float[]> v = new ArrayList<>(vectors);
        v.addAll(newVectors);
        return new CorpusIndex(c, v, LangChain4jVectorIndex.build(v), modelId);
    }

    /** Nuovo snapshot senza i chunk della sorgente indicata; i vettori esistenti sono riusati. */
    public CorpusIndex withoutSource(String source) {
        List<SpecChunk> c = new ArrayList<>();
        List<float[]> v = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            if (!chunks.get(i).source().equals(source)) {
                c.add(chunks.get(i));
                v.add(vectors.get(i));
            }
        }
        return new CorpusIndex(c, v, LangChain4jVectorIndex.build(v), modelId);
    }

    /** Ricerca sull'indice; scarta eventuali hit fuori dallo snapshot. */
    public List<IndexHit> search(float[] query, int k) {
        List<IndexHit> hits = new ArrayList<>();
        for (IndexHit hit : index.search(query, k)) {
            if (hit.chunkIndex() >= 0 && hit.chunkIndex() < chunks.size()) hits.add(hit);
        }
        return hits;
    }

    public SpecChunk chunk(int chunkIndex) {
        return chunks.get(chunkIndex);
    }

    public List<SpecChunk> chunks() {
        return chunks;
    }

    /** Copie dei vettori: modificarle non altera lo snapshot pubblicato. */
    public List<float[]> vectors() {
        List<float[]> copies = new ArrayList<>(vectors.size());
        for (float[] v : vectors) copies.add(v.clone());
        return copies;
    }

    /** Vettori interni, in sola lettura, per la persistenza. */
    List<float[]> storedVectors() {
        return vectors;
    }

    public VectorIndex index() {
        return index;
    }

    public int size() {
        return chunks.size();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int embeddingDim() {
        return embeddingDim;
    }

    public String modelId() {
        return modelId;
    }

    public ScoreKind scoreKind() {
        return index.scoreKind();
    }
}
