package it.aw.specrepeal.model;

/**
 * Tipo strutturale della sezione da cui proviene un chunk.
 * Tabelle e figure ricevono una dimensione target maggiore in fase di chunking.
 */
public enum SectionType {
    PURPOSE,
    NOTES,
    TABLE,
    FIGURE,
    GENERAL;

    public boolean isTabular() {
        return this == TABLE || this == FIGURE;
    }
}
