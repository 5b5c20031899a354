package it.aw.specrepeal.error;

/** Errore o timeout del provider di embedding. Non lascia mai stato parziale. */
public class EmbeddingProviderException extends SpecRepealException {

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
