package it.aw.specrepeal.config;

import it.aw.specrepeal.corpus.CorpusIndexManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;

/**
 * Chiude il corpus allo shutdown dell'applicazione: connessione DuckDB del registro
 * ed executor del provider di embedding.
 * <p>
 * Non serve alcun salvataggio finale: ogni batch viene persistito al commit.
 */
@Component
public class StoreLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StoreLifecycle.class);

    private final CorpusIndexManager corpus;

    public StoreLifecycle(CorpusIndexManager corpus) {
        this.corpus = corpus;
    }

    @PreDestroy
    public void close() {
        log.info("Shutdown: chiusura corpus ({} chunk)", corpus.snapshot().size());
        corpus.close();
    }
}
