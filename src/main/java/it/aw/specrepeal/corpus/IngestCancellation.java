package it.aw.specrepeal.corpus;

/**
 * Token di cancellazione controllato tra un batch di embedding e il successivo.
 * Anche l'interruzione del thread chiamante viene trattata come cancellazione.
 */
@FunctionalInterface
public interface IngestCancellation {

    IngestCancellation NONE = () -> false;

    boolean isCancelled();

    default boolean shouldStop() {
        return isCancelled() || Thread.currentThread().isInterrupted();
    }
}
