package it.aw.specrepeal.model;

/**
 * Ambito impiantistico di un'infrazione. GENERAL significa "nessun ambito specifico":
 * il flag di categoria e' attivo solo per gli altri valori.
 */
public enum EquipmentCategory {
    OVERHEAD_POLE,
    UNDERGROUND,
    GENERAL;

    public boolean isFlagged() {
        return this != GENERAL;
    }
}
