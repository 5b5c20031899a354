package it.aw.specrepeal.error;

/**
 * Radice degli errori tipizzati del motore.
 * <p>
 * I chiamanti distinguono tre famiglie: ritentabili (provider di embedding,
 * timeout, scrittore occupato), fatali (store corrotto) e destinati all'utente
 * (documento vuoto, indice non pronto).
 */
public abstract class SpecRepealException extends RuntimeException {

    protected SpecRepealException(String message) {
        super(message);
    }

    protected SpecRepealException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
