package it.aw.specrepeal.error;

/** Ricerca o analisi richiesta prima di qualsiasi ingestione. */
public class IndexNotReadyException extends SpecRepealException {

    public IndexNotReadyException(String message) {
        super(message);
    }
}
