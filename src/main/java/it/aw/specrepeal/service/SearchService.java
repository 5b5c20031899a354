package it.aw.specrepeal.service;

import it.aw.specrepeal.corpus.CorpusIndex;
import it.aw.specrepeal.corpus.CorpusIndexManager;
import it.aw.specrepeal.corpus.IndexHit;
import it.aw.specrepeal.error.IndexNotReadyException;
import it.aw.specrepeal.matching.SimilarityScale;
import it.aw.specrepeal.model.SearchResult;
import it.aw.specrepeal.model.SpecChunk;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Ricerca semantica libera sul corpus delle specifiche.
 * I punteggi sono convertiti nella similarita' coseno canonica.
 */
@Service
public class SearchService {

    private final CorpusIndexManager corpus;

    public SearchService(CorpusIndexManager corpus) {
        this.corpus = corpus;
    }

    /**
     * Cerca i chunk piu' simili alla query testuale.
     *
     * @param query testo della query
     * @param limit numero massimo di risultati da restituire
     * @return lista di risultati ordinati per score decrescente
     * @throws IndexNotReadyException se il corpus e' vuoto
     */
    public List<SearchResult> search(String query, int limit) {
        CorpusIndex snapshot = corpus.snapshot();
        if (snapshot.isEmpty()) {
            throw new IndexNotReadyException("Corpus vuoto: nessuna specifica indicizzata");
        }
        float[] vector = corpus.gateway().embed(query);
        List<SearchResult> results = new ArrayList<>();
        for (IndexHit hit : snapshot.search(vector, limit)) {
            SpecChunk c = snapshot.chunk(hit.chunkIndex());
            results.add(new SearchResult(SimilarityScale.toCosine(hit), c.text(), c.source(), c.page(),
                    c.sectionType(), c.documentNumber()));
        }
        return results;
    }
}
