package it.aw.specrepeal.corpus;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import it.aw.specrepeal.error.EmbeddingProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Accesso al provider di embedding: batching, timeout per chiamata,
 * normalizzazione a norma unitaria e mappatura degli errori su
 * {@link EmbeddingProviderException}.
 * <p>
 * Ogni chiamata al modello gira su un thread dedicato; oltre il timeout la
 * chiamata viene annullata e nessun risultato parziale viene restituito.
 */
public class EmbeddingGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final EmbeddingModel model;
    private final String modelId;
    private final int batchSize;
    private final Duration timeout;
    private final ExecutorService executor;

    public EmbeddingGateway(EmbeddingModel model, String modelId, int batchSize, Duration timeout) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize deve essere >= 1 (ricevuto: " + batchSize + ")");
        }
        this.model = model;
        this.modelId = modelId;
        this.batchSize = batchSize;
        this.timeout = timeout;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "embedding-" + modelId);
            t.setDaemon(true);
            return t;
        });
    }

    public String modelId() {
        return modelId;
    }

    public int batchSize() {
        return batchSize;
    }

    /** Embedding di tutti i testi, suddivisi in batch di batchSize; un vettore unitario per testo. */
    public List<float[]> embedAll(List<String> texts) {
        List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            result.addAll(embedBatch(texts.subList(from, Math.min(from + batchSize, texts.size()))));
        }
        return result;
    }

    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    /** Una singola chiamata al modello, tutto-o-niente. */
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) return List.of();
        List<TextSegment> segments = new ArrayList<>(texts.size());
        for (String t : texts) segments.add(TextSegment.from(t));

        Future<List<Embedding>> future = executor.submit(() -> model.embedAll(segments).content());
        List<Embedding> embeddings;
        try {
            embeddings = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbeddingProviderException(
                    "Timeout embedding dopo " + timeout.toMillis() + " ms (" + texts.size() + " testi)", e);
        } catch (ExecutionException e) {
            throw new EmbeddingProviderException("Errore del provider di embedding: " + e.getCause().getMessage(),
                    e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException("Embedding interrotto", e);
        }

        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new EmbeddingProviderException("Il provider ha restituito " +
                    (embeddings == null ? 0 : embeddings.size()) + " vettori per " + texts.size() + " testi", null);
        }
        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (Embedding e : embeddings) vectors.add(normalize(e.vector()));
        log.debug("Embedding batch: {} testi, dim={}", texts.size(), vectors.get(0).length);
        return vectors;
    }

    /** Copia a norma unitaria; il vettore nullo resta invariato. */
    static float[] normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) norm += (double) v * v;
        norm = Math.sqrt(norm);
        float[] out = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = norm == 0 ? vector[i] : (float) (vector[i] / norm);
        }
        return out;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
