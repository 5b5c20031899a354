package it.aw.specrepeal.config;

import it.aw.specrepeal.infraction.ExtractionParams;
import it.aw.specrepeal.model.AnalysisConfig;
import it.aw.specrepeal.model.ChunkingParams;
import it.aw.specrepeal.model.ReviewMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configurazione del motore ({@code specrepeal.*} in application.properties).
 * Convertita nei record immutabili usati dai componenti.
 */
@Validated
@ConfigurationProperties(prefix = "specrepeal")
public class EngineProperties {

    /** Directory del corpus (chunks.json, vectors.json, index.json, registry.duckdb). */
    @NotBlank
    private String storeDir = "./data/corpus";

    @Min(20)
    private int chunkSize = ChunkingParams.DEFAULT_CHUNK_SIZE;

    @Min(0)
    private int chunkOverlap = ChunkingParams.DEFAULT_OVERLAP;

    /** Target in parole per tabelle e figure; 0 = il doppio di chunkSize. */
    @Min(0)
    private int tableChunkSize = 0;

    @Min(1)
    private int minChunkChars = ChunkingParams.DEFAULT_MIN_CHUNK_CHARS;

    @Min(1)
    private int embeddingBatchSize = 32;

    @NotNull
    private Duration embeddingTimeout = Duration.ofSeconds(60);

    /** Identificativo del modello registrato con i vettori: se cambia il corpus viene ricalcolato. */
    @NotBlank
    private String embeddingModelId = "all-minilm-l6-v2-q";

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double minSimilarityThreshold = AnalysisConfig.DEFAULT_MIN_SIMILARITY;

    @Min(1)
    private int topK = AnalysisConfig.DEFAULT_TOP_K;

    @Min(1)
    private int categoryTopK = AnalysisConfig.DEFAULT_CATEGORY_TOP_K;

    @DecimalMin("0")
    @DecimalMax("100")
    private double highThreshold = AnalysisConfig.DEFAULT_HIGH_THRESHOLD;

    @DecimalMin("0")
    @DecimalMax("100")
    private double mediumThreshold = AnalysisConfig.DEFAULT_MEDIUM_THRESHOLD;

    @Min(0)
    private int minMatches = AnalysisConfig.DEFAULT_MIN_MATCHES;

    @NotNull
    private ReviewMode reviewMode = ReviewMode.THREE_TIER;

    @Min(1)
    private int maxInfractions = AnalysisConfig.DEFAULT_MAX_INFRACTIONS;

    @Min(1)
    private int minInfractionLength = ExtractionParams.DEFAULT_MIN_LENGTH;

    @Min(1)
    private int maxInfractionLength = ExtractionParams.DEFAULT_MAX_LENGTH;

    private boolean dedupEnabled = true;

    /** false = un secondo scrittore riceve IngestionBusyException invece di attendere. */
    private boolean ingestBlocking = true;

    @NotEmpty
    private List<String> structuredKeywords = new ArrayList<>(ExtractionParams.DEFAULT_STRUCTURED_KEYWORDS);

    private List<String> scanKeywords = new ArrayList<>(ExtractionParams.DEFAULT_SCAN_KEYWORDS);

    public ChunkingParams toChunkingParams() {
        int table = tableChunkSize > 0 ? tableChunkSize : chunkSize * 2;
        return new ChunkingParams(chunkSize, chunkOverlap, table, minChunkChars);
    }

    public AnalysisConfig toAnalysisConfig() {
        return new AnalysisConfig(topK, categoryTopK, minSimilarityThreshold, highThreshold,
                mediumThreshold, minMatches, maxInfractions, reviewMode);
    }

    public ExtractionParams toExtractionParams() {
        return new ExtractionParams(structuredKeywords, scanKeywords,
                minInfractionLength, maxInfractionLength, maxInfractions);
    }

    public String getStoreDir() {
        return storeDir;
    }

    public void setStoreDir(String storeDir) {
        this.storeDir = storeDir;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public int getTableChunkSize() {
        return tableChunkSize;
    }

    public void setTableChunkSize(int tableChunkSize) {
        this.tableChunkSize = tableChunkSize;
    }

    public int getMinChunkChars() {
        return minChunkChars;
    }

    public void setMinChunkChars(int minChunkChars) {
        this.minChunkChars = minChunkChars;
    }

    public int getEmbeddingBatchSize() {
        return embeddingBatchSize;
    }

    public void setEmbeddingBatchSize(int embeddingBatchSize) {
        this.embeddingBatchSize = embeddingBatchSize;
    }

    public Duration getEmbeddingTimeout() {
        return embeddingTimeout;
    }

    public void setEmbeddingTimeout(Duration embeddingTimeout) {
        this.embeddingTimeout = embeddingTimeout;
    }

    public String getEmbeddingModelId() {
        return embeddingModelId;
    }

    public void setEmbeddingModelId(String embeddingModelId) {
        this.embeddingModelId = embeddingModelId;
    }

    public double getMinSimilarityThreshold() {
        return minSimilarityThreshold;
    }

    public void setMinSimilarityThreshold(double minSimilarityThreshold) {
        this.minSimilarityThreshold = minSimilarityThreshold;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public int getCategoryTopK() {
        return categoryTopK;
    }

    public void setCategoryTopK(int categoryTopK) {
        this.categoryTopK = categoryTopK;
    }

    public double getHighThreshold() {
        return highThreshold;
    }

    public void setHighThreshold(double highThreshold) {
        this.highThreshold = highThreshold;
    }

    public double getMediumThreshold() {
        return mediumThreshold;
    }

    public void setMediumThreshold(double mediumThreshold) {
        this.mediumThreshold = mediumThreshold;
    }

    public int getMinMatches() {
        return minMatches;
    }

    public void setMinMatches(int minMatches) {
        this.minMatches = minMatches;
    }

    public ReviewMode getReviewMode() {
        return reviewMode;
    }

    public void setReviewMode(ReviewMode reviewMode) {
        this.reviewMode = reviewMode;
    }

    public int getMaxInfractions() {
        return maxInfractions;
    }

    public void setMaxInfractions(int maxInfractions) {
        this.maxInfractions = maxInfractions;
    }

    public int getMinInfractionLength() {
        return minInfractionLength;
    }

    public void setMinInfractionLength(int minInfractionLength) {
        this.minInfractionLength = minInfractionLength;
    }

    public int getMaxInfractionLength() {
        return maxInfractionLength;
    }

    public void setMaxInfractionLength(int maxInfractionLength) {
        this.maxInfractionLength = maxInfractionLength;
    }

    public boolean isDedupEnabled() {
        return dedupEnabled;
    }

    public void setDedupEnabled(boolean dedupEnabled) {
        this.dedupEnabled = dedupEnabled;
    }

    public boolean isIngestBlocking() {
        return ingestBlocking;
    }

    public void setIngestBlocking(boolean ingestBlocking) {
        this.ingestBlocking = ingestBlocking;
    }

    public List<String> getStructuredKeywords() {
        return structuredKeywords;
    }

    public void setStructuredKeywords(List<String> structuredKeywords) {
        this.structuredKeywords = structuredKeywords;
    }

    public List<String> getScanKeywords() {
        return scanKeywords;
    }

    public void setScanKeywords(List<String> scanKeywords) {
        this.scanKeywords = scanKeywords;
    }
}
