package it.aw.specrepeal.text;

/** Tipi di entita' critiche confrontate tra infrazione e specifica. */
public enum EntityType {
    MEASUREMENT,
    ELECTRICAL_RATING,
    STANDARD_CITATION
}
