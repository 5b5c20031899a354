package it.aw.specrepeal.model;

/**
 * Parametri di chunking per una singola operazione di ingestione.
 * <p>
 * chunkSize e overlap sono espressi in parole; tableChunkSize e' il target
 * delle sezioni tabellari (tabelle e figure), piu' grande per non spezzare righe
 * di dati correlate. I chunk sotto minChunkChars caratteri sono scartati come rumore.
 */
public record ChunkingParams(int chunkSize, int overlap, int tableChunkSize, int minChunkChars) {

    public static final int DEFAULT_CHUNK_SIZE      = 300;
    public static final int DEFAULT_OVERLAP         = 50;
    public static final int DEFAULT_MIN_CHUNK_CHARS = 50;

    /** Costruttore compatto con validazione. */
    public ChunkingParams {
        if (chunkSize < 20) {
            throw new IllegalArgumentException("chunkSize deve essere >= 20 (ricevuto: " + chunkSize + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap deve essere >= 0 (ricevuto: " + overlap + ")");
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") deve essere < chunkSize (" + chunkSize + ")");
        }
        if (tableChunkSize < chunkSize) {
            throw new IllegalArgumentException(
                    "tableChunkSize (" + tableChunkSize + ") deve essere >= chunkSize (" + chunkSize + ")");
        }
        if (minChunkChars < 1) {
            throw new IllegalArgumentException("minChunkChars deve essere >= 1 (ricevuto: " + minChunkChars + ")");
        }
    }

    public ChunkingParams(int chunkSize, int overlap) {
        this(chunkSize, overlap, chunkSize * 2, DEFAULT_MIN_CHUNK_CHARS);
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }
}
