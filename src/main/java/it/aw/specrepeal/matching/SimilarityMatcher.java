package it.aw.specrepeal.matching;

import it.aw.specrepeal.corpus.CorpusIndex;
import it.aw.specrepeal.corpus.CorpusIndexManager;
import it.aw.specrepeal.corpus.IndexHit;
import it.aw.specrepeal.error.IndexNotReadyException;
import it.aw.specrepeal.model.AnalysisConfig;
import it.aw.specrepeal.model.Infraction;
import it.aw.specrepeal.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recupera per ogni infrazione i chunk di specifica piu' simili.
 * <p>
 * Tutti i testi di una chiamata sono inviati al provider in un'unica richiesta e
 * confrontati con lo stesso snapshot del corpus. I risultati sotto la soglia minima
 * sono scartati; l'ordine e' per similarita' decrescente, a parita' per posizione del chunk.
 */
public class SimilarityMatcher {

    private static final Logger log = LoggerFactory.getLogger(SimilarityMatcher.class);

    private static final Comparator<MatchResult> ORDER =
            Comparator.comparingDouble(MatchResult::score).reversed()
                    .thenComparingInt(MatchResult::chunkIndex);

    private final CorpusIndexManager corpus;

    public SimilarityMatcher(CorpusIndexManager corpus) {
        this.corpus = corpus;
    }

    /**
     * Una lista di match per infrazione, nello stesso ordine dell'input.
     *
     * @throws IndexNotReadyException se il corpus e' vuoto
     */
    public List<List<MatchResult>> match(List<Infraction> infractions, AnalysisConfig config) {
        CorpusIndex snapshot = corpus.snapshot();
        if (snapshot.isEmpty()) {
            throw new IndexNotReadyException("Corpus vuoto: indicizzare almeno una specifica prima dell'analisi");
        }
        if (infractions.isEmpty()) return List.of();

        List<String> texts = new ArrayList<>(infractions.size());
        for (Infraction i : infractions) texts.add(i.rawText());
        List<float[]> queries = corpus.gateway().embedBatch(texts);

        List<List<MatchResult>> result = new ArrayList<>(infractions.size());
        for (int i = 0; i < infractions.size(); i++) {
            Infraction infraction = infractions.get(i);
            List<MatchResult> matches = new ArrayList<>();
            for (IndexHit hit : snapshot.search(queries.get(i), config.kFor(infraction))) {
                double cosine = SimilarityScale.toCosine(hit);
                if (cosine < config.minSimilarity()) continue;
                matches.add(new MatchResult(infraction, snapshot.chunk(hit.chunkIndex()), hit.chunkIndex(), cosine));
            }
            matches.sort(ORDER);
            result.add(List.copyOf(matches));
        }
        log.debug("Matching: {} infrazioni su {} chunk", infractions.size(), snapshot.size());
        return result;
    }
}
