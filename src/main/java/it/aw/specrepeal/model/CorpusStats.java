package it.aw.specrepeal.model;

/**
 * Statistiche aggregate sullo stato del corpus.
 */
public record CorpusStats(
        int    totalSources,
        int    totalChunks,
        String embeddingModel,
        int    embeddingDim,
        String storeDir
) {}
