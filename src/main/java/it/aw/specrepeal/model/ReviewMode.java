package it.aw.specrepeal.model;

/**
 * Gestione della fascia intermedia REVIEW_RECOMMENDED.
 * Le due modalita' COLLAPSE_* riducono la decisione a due soli stati.
 */
public enum ReviewMode {
    THREE_TIER,
    COLLAPSE_TO_VALID,
    COLLAPSE_TO_REPEALABLE
}
