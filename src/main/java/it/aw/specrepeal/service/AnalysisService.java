package it.aw.specrepeal.service;

import it.aw.specrepeal.calibration.ConfidenceCalibrator;
import it.aw.specrepeal.corpus.CorpusIndexManager;
import it.aw.specrepeal.error.EmptyDocumentException;
import it.aw.specrepeal.error.IndexNotReadyException;
import it.aw.specrepeal.infraction.InfractionExtractor;
import it.aw.specrepeal.model.AnalysisConfig;
import it.aw.specrepeal.model.AuditReport;
import it.aw.specrepeal.model.Infraction;
import it.aw.specrepeal.model.MatchResult;
import it.aw.specrepeal.model.RepealVerdict;
import it.aw.specrepeal.matching.SimilarityMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Analisi di un audit contro il corpus: estrazione delle infrazioni,
 * ricerca delle specifiche corrispondenti e calibrazione del verdetto.
 * Sola lettura sul corpus.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final CorpusIndexManager corpus;
    private final InfractionExtractor extractor;
    private final SimilarityMatcher matcher;
    private final ConfidenceCalibrator calibrator;
    private final AnalysisConfig defaultConfig;

    public AnalysisService(CorpusIndexManager corpus,
                           InfractionExtractor extractor,
                           SimilarityMatcher matcher,
                           ConfidenceCalibrator calibrator,
                           AnalysisConfig defaultConfig) {
        this.corpus = corpus;
        this.extractor = extractor;
        this.matcher = matcher;
        this.calibrator = calibrator;
        this.defaultConfig = defaultConfig;
    }

    public List<RepealVerdict> analyzeInfractions(String auditText) {
        return analyzeInfractions(auditText, defaultConfig);
    }

    /**
     * Un verdetto per infrazione, nell'ordine di apparizione nell'audit.
     *
     * @throws IndexNotReadyException se nessuna specifica e' stata indicizzata
     */
    public List<RepealVerdict> analyzeInfractions(String auditText, AnalysisConfig config) {
        if (!corpus.isReady()) {
            throw new IndexNotReadyException("Corpus vuoto: indicizzare almeno una specifica prima dell'analisi");
        }
        List<Infraction> infractions = extractor.extract(auditText, config.maxInfractions());
        if (infractions.isEmpty()) {
            log.info("Nessuna infrazione trovata nell'audit");
            return List.of();
        }
        List<List<MatchResult>> matches = matcher.match(infractions, config);
        List<RepealVerdict> verdicts = new ArrayList<>(infractions.size());
        for (int i = 0; i < infractions.size(); i++) {
            verdicts.add(calibrator.calibrate(infractions.get(i), matches.get(i), config));
        }
        log.info("Analisi completata: {} infrazioni", verdicts.size());
        return verdicts;
    }

    public AuditReport analyzeAudit(String auditName, String auditText) {
        return analyzeAudit(auditName, auditText, defaultConfig);
    }

    public AuditReport analyzeAudit(String auditName, String auditText, AnalysisConfig config) {
        AuditReport report = AuditReport.of(auditName, analyzeInfractions(auditText, config));
        log.info("Audit {}: {} revocabili, {} da rivedere, {} valide",
                auditName, report.repealable(), report.reviewRecommended(), report.valid());
        return report;
    }

    /**
     * Analizza piu' audit (nome &rarr; testo) nell'ordine della mappa.
     * Un audit vuoto produce un report senza verdetti e non interrompe il batch.
     */
    public List<AuditReport> analyzeBatch(Map<String, String> audits, AnalysisConfig config) {
        List<AuditReport> reports = new ArrayList<>(audits.size());
        for (Map.Entry<String, String> e : audits.entrySet()) {
            try {
                reports.add(analyzeAudit(e.getKey(), e.getValue(), config));
            } catch (EmptyDocumentException ex) {
                log.warn("Audit {} vuoto: {}", e.getKey(), ex.getMessage());
                reports.add(AuditReport.of(e.getKey(), List.of()));
            }
        }
        return reports;
    }

    public AnalysisConfig defaultConfig() {
        return defaultConfig;
    }
}
