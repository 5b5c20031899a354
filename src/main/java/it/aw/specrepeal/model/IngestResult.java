package it.aw.specrepeal.model;

/**
 * Esito di un'ingestione.
 * skipped = true se la sorgente era gia' presente (deduplica per hash);
 * complete = false se l'ingestione e' stata interrotta tra due batch.
 */
public record IngestResult(
        String  source,
        int     chunksAdded,
        int     totalChunks,
        boolean skipped,
        boolean complete
) {
    public static IngestResult skipped(String source, int totalChunks) {
        return new IngestResult(source, 0, totalChunks, true, true);
    }
}
