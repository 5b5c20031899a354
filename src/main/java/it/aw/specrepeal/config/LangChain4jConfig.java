package it.aw.specrepeal.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import it.aw.specrepeal.calibration.ConfidenceCalibrator;
import it.aw.specrepeal.corpus.CorpusIndexManager;
import it.aw.specrepeal.corpus.EmbeddingGateway;
import it.aw.specrepeal.infraction.InfractionExtractor;
import it.aw.specrepeal.matching.SimilarityMatcher;
import it.aw.specrepeal.model.AnalysisConfig;
import it.aw.specrepeal.model.ChunkingParams;
import it.aw.specrepeal.registry.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configura i bean del motore.
 *
 * EmbeddingModel:     AllMiniLM-L6-v2 quantizzato, gira in locale senza API key.
 * CorpusIndexManager: carica il corpus da {@code specrepeal.store-dir} all'avvio
 *                     (o parte da zero); la persistenza avviene a ogni batch committato.
 *                     La chiusura e' gestita da StoreLifecycle.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingModel embeddingModel() {
        log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    @Bean(destroyMethod = "")
    public CorpusIndexManager corpusIndexManager(EmbeddingModel embeddingModel,
                                                 EngineProperties props,
                                                 ObjectMapper objectMapper) {
        Path storeDir = Paths.get(props.getStoreDir());
        log.info("Corpus: directory {}, modello {}, batch {}",
                storeDir.toAbsolutePath(), props.getEmbeddingModelId(), props.getEmbeddingBatchSize());
        EmbeddingGateway gateway = new EmbeddingGateway(embeddingModel, props.getEmbeddingModelId(),
                props.getEmbeddingBatchSize(), props.getEmbeddingTimeout());
        SourceRegistry registry = SourceRegistry.open(storeDir);
        return CorpusIndexManager.open(storeDir, gateway, registry,
                new CorpusIndexManager.Settings(props.isDedupEnabled(), props.isIngestBlocking()),
                objectMapper);
    }

    @Bean
    public ChunkingParams chunkingParams(EngineProperties props) {
        return props.toChunkingParams();
    }

    @Bean
    public AnalysisConfig analysisConfig(EngineProperties props) {
        return props.toAnalysisConfig();
    }

    @Bean
    public InfractionExtractor infractionExtractor(EngineProperties props) {
        return new InfractionExtractor(props.toExtractionParams());
    }

    @Bean
    public SimilarityMatcher similarityMatcher(CorpusIndexManager corpus) {
        return new SimilarityMatcher(corpus);
    }

    @Bean
    public ConfidenceCalibrator confidenceCalibrator() {
        return new ConfidenceCalibrator();
    }
}
