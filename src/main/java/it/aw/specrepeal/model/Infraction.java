package it.aw.specrepeal.model;

/**
 * Candidata non conformita' estratta da un documento di audit.
 * <p>
 * normalizedText (spazi collassati, minuscolo) e' la chiave di deduplica;
 * position e' l'offset della prima occorrenza nel testo ripulito.
 * Creata per singola analisi, mai persistita.
 */
public record Infraction(
        String            rawText,
        String            normalizedText,
        Severity          severity,
        EquipmentCategory category,
        String            documentRef,   // numero documento citato, null se assente
        int               position,
        String            keyword        // keyword che ha generato la cattura, null se assente
) {
    public boolean categoryFlagged() {
        return category != null && category.isFlagged();
    }
}
