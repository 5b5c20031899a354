package it.aw.specrepeal.model;

/**
 * Risultato di una ricerca semantica libera sul corpus.
 * score e' la similarita' coseno canonica.
 */
public record SearchResult(
        double      score,
        String      text,
        String      source,
        int         page,
        SectionType sectionType,
        String      documentNumber
) {}
