package it.aw.specrepeal.model;

import java.time.LocalDateTime;

/**
 * Riga del registro sorgenti: una specifica indicizzata, identificata dall'hash del contenuto.
 * chunkCount e' il numero di chunk gia' committati; complete = false indica
 * un'ingestione interrotta che verra' ripresa alla prossima richiesta.
 */
public record SourceRecord(
        String        contentHash,
        String        sourceName,
        LocalDateTime ingestedAt,
        int           chunkCount,
        boolean       complete
) {}
