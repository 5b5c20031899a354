package it.aw.specrepeal.model;

import java.util.List;

/**
 * Esito della calibrazione per una singola infrazione.
 * <p>
 * confidence e' sempre nel range [0, 100]; reasons contiene al massimo tre righe
 * leggibili; breakdown riporta il punteggio dopo ogni stadio, nell'ordine di applicazione.
 */
public record RepealVerdict(
        Infraction       infraction,
        RepealStatus     status,
        double           confidence,
        List<String>     reasons,
        List<String>     specReferences,
        int              matchCount,
        List<StageScore> breakdown
) {
    public RepealVerdict {
        reasons = List.copyOf(reasons);
        specReferences = List.copyOf(specReferences);
        breakdown = List.copyOf(breakdown);
    }
}
