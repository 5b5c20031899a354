package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.AnalysisConfig;
import it.aw.specrepeal.model.Infraction;
import it.aw.specrepeal.model.MatchResult;
import it.aw.specrepeal.model.RepealStatus;
import it.aw.specrepeal.model.RepealVerdict;
import it.aw.specrepeal.model.StageScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Combina i segnali dei match in una confidenza [0, 100] e in un verdetto.
 * <p>
 * Gli stadi sono applicati in ordine; dopo ognuno il punteggio viene riportato
 * nel range e registrato nel breakdown del verdetto. Deterministico.
 */
public class ConfidenceCalibrator {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceCalibrator.class);

    private final List<ScoringStage> stages;

    public ConfidenceCalibrator(List<ScoringStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public ConfidenceCalibrator() {
        this(defaultStages());
    }

    public static List<ScoringStage> defaultStages() {
        return List.of(
                new BaseScoreStage(),
                new MatchCountStage(),
                new DocumentReferenceStage(),
                new EntityOverlapStage(),
                new CategoryStage());
    }

    public RepealVerdict calibrate(Infraction infraction, List<MatchResult> matches, AnalysisConfig config) {
        CalibrationInput input = new CalibrationInput(infraction, matches);
        double score = 0;
        List<StageScore> breakdown = new ArrayList<>(stages.size());
        for (ScoringStage stage : stages) {
            score = clamp(stage.apply(score, input));
            breakdown.add(new StageScore(stage.name(), score));
        }
        RepealStatus status = DecisionPolicy.decide(score, matches.size(), config);
        log.debug("Calibrazione '{}': confidenza={}, match={}, stato={}",
                infraction.normalizedText(), score, matches.size(), status);
        return new RepealVerdict(infraction, status, score,
                ReasonFormatter.reasons(matches),
                ReasonFormatter.specReferences(matches),
                matches.size(),
                breakdown);
    }

    public RepealVerdict calibrate(Infraction infraction, List<MatchResult> matches) {
        return calibrate(infraction, matches, AnalysisConfig.defaults());
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) return 0;
        return Math.max(0, Math.min(100, score));
    }
}
