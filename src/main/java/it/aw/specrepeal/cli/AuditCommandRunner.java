package it.aw.specrepeal.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.specrepeal.model.AuditReport;
import it.aw.specrepeal.model.IngestResult;
import it.aw.specrepeal.model.PageText;
import it.aw.specrepeal.service.AnalysisService;
import it.aw.specrepeal.service.IngestionService;
import it.aw.specrepeal.service.PdfPageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Esecuzione da riga di comando.
 *
 * Opzioni:
 *   --ingest=spec.pdf    indicizza una specifica (ripetibile)
 *   --analyze=audit.pdf  analizza un audit e stampa il report in JSON
 *
 * Senza opzioni non fa nulla.
 */
@Component
public class AuditCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AuditCommandRunner.class);

    private final IngestionService ingestionService;
    private final AnalysisService analysisService;
    private final ObjectMapper objectMapper;

    public AuditCommandRunner(IngestionService ingestionService,
                              AnalysisService analysisService,
                              ObjectMapper objectMapper) {
        this.ingestionService = ingestionService;
        this.analysisService = analysisService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> ingest = args.getOptionValues("ingest");
        if (ingest != null) {
            for (String file : ingest) {
                ingest(Paths.get(file));
            }
        }
        List<String> analyze = args.getOptionValues("analyze");
        if (analyze != null) {
            for (String file : analyze) {
                System.out.println(analyze(Paths.get(file)));
            }
        }
    }

    IngestResult ingest(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        List<PageText> pages = PdfPageParser.parse(bytes);
        IngestResult result = ingestionService.ingestDocument(pages, file.getFileName().toString(), bytes);
        log.info("CLI ingest {}: {} chunk aggiunti, corpus {} chunk", file, result.chunksAdded(), result.totalChunks());
        return result;
    }

    String analyze(Path file) throws IOException {
        List<PageText> pages = PdfPageParser.parse(file);
        AuditReport report = analysisService.analyzeAudit(file.getFileName().toString(),
                PdfPageParser.fullText(pages));
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serializzazione del report fallita", e);
        }
    }
}
