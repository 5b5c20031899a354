package it.aw.specrepeal.corpus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Indice di nearest-neighbour sui vettori del corpus.
 * <p>
 * Gli identificativi sono le posizioni dei chunk nel chunk store. Un'istanza viene
 * popolata una sola volta in fase di costruzione dello snapshot e poi usata in sola lettura.
 */
public interface VectorIndex {

    void add(int chunkIndex, float[] vector);

    /** Al massimo k risultati in ordine di rilevanza decrescente. */
    List<IndexHit> search(float[] query, int k);

    int totalCount();

    void persist(Path file) throws IOException;

    ScoreKind scoreKind();
}
