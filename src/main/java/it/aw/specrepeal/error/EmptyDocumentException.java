package it.aw.specrepeal.error;

/** Nessun testo da elaborare; nessuna modifica e' stata eseguita. */
public class EmptyDocumentException extends SpecRepealException {

    public EmptyDocumentException(String message) {
        super(message);
    }
}
