package it.aw.specrepeal.error;

/**
 * Incoerenza tra chunk store, vector store e indice.
 * Al caricamento successivo l'indice viene ricostruito dal chunk store;
 * se il chunk store stesso e' illeggibile l'errore e' definitivo e serve re-indicizzare.
 */
public class IntegrityException extends SpecRepealException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
