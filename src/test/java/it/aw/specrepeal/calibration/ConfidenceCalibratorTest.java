package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.EquipmentCategory;
import it.aw.specrepeal.model.Infraction;
import it.aw.specrepeal.model.MatchResult;
import it.aw.specrepeal.model.RepealStatus;
import it.aw.specrepeal.model.RepealVerdict;
import it.aw.specrepeal.model.StageScore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static it.aw.specrepeal.calibration.CalibrationFixtures.infraction;
import static it.aw.specrepeal.calibration.CalibrationFixtures.match;
import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceCalibratorTest {

    private final ConfidenceCalibrator calibrator = new ConfidenceCalibrator();

    @Nested
    @DisplayName("breakdown")
    class Breakdown {

        @Test
        void stagesRecordedInOrder() {
            Infraction i = infraction("Go-back: x");
            RepealVerdict v = calibrator.calibrate(i, List.of(match(i, "text", 0.7)));

            assertThat(v.breakdown()).extracting(StageScore::stage)
                    .containsExactly("base-score", "match-count", "document-reference", "entity-overlap", "category");
            assertThat(v.breakdown().get(v.breakdown().size() - 1).score()).isEqualTo(v.confidence());
        }

        @Test
        void everyStepClamped() {
            Infraction i = infraction("Go-back: 18 feet, 12 kV, GO 95 pole", EquipmentCategory.OVERHEAD_POLE, "022178");
            List<MatchResult> matches = List.of(
                    match(i, "18 feet and 12 kV per GO 95", "Pole 022178.pdf", "022178", 0.97, 0),
                    match(i, "18 feet", "Pole 022178.pdf", "022178", 0.95, 1),
                    match(i, "12 kV", "Pole 022178.pdf", "022178", 0.93, 2));

            RepealVerdict v = calibrator.calibrate(i, matches);

            assertThat(v.breakdown()).allSatisfy(s -> assertThat(s.score()).isBetween(0.0, 100.0));
            assertThat(v.confidence()).isEqualTo(100);
            assertThat(v.status()).isEqualTo(RepealStatus.REPEALABLE);
        }
    }

    @Test
    void noMatchesMeansValidInfraction() {
        RepealVerdict v = calibrator.calibrate(infraction("Go-back: label missing"), List.of());

        assertThat(v.confidence()).isZero();
        assertThat(v.status()).isEqualTo(RepealStatus.VALID_INFRACTION);
        assertThat(v.reasons()).containsExactly(ReasonFormatter.NO_MATCH_REASON);
        assertThat(v.specReferences()).isEmpty();
        assertThat(v.matchCount()).isZero();
    }

    @Test
    void singleModerateMatchStaysValid() {
        Infraction i = infraction("Go-back: pole clearance only 10 feet");
        RepealVerdict v = calibrator.calibrate(i,
                List.of(match(i, "Table 1: minimum 18 feet above roadway", 0.65)));

        assertThat(v.confidence()).isEqualTo(55);
        assertThat(v.status()).isEqualTo(RepealStatus.VALID_INFRACTION);
        assertThat(v.reasons()).singleElement().asString()
                .startsWith("spec.pdf p.1 (65% similarity): Table 1");
    }

    @Test
    void deterministic() {
        Infraction i = infraction("Go-back: 18 feet over road");
        List<MatchResult> matches = List.of(match(i, "18 feet minimum", 0.82), match(i, "road crossing", 0.6));

        assertThat(calibrator.calibrate(i, matches)).isEqualTo(calibrator.calibrate(i, matches));
    }

    @Test
    void confidenceNeverDecreasesWithBetterSimilarity() {
        Infraction i = infraction("Go-back: clearance");
        double previous = -1;
        for (int s = 0; s <= 100; s += 5) {
            double sim = s / 100.0;
            double conf = calibrator.calibrate(i, List.of(match(i, "text", sim))).confidence();
            assertThat(conf).isGreaterThanOrEqualTo(previous);
            previous = conf;
        }
    }

    @Test
    void reasonsCappedAtThreeAndReferencesDeduplicated() {
        Infraction i = infraction("Go-back: x");
        List<MatchResult> matches = List.of(
                match(i, "a", "a.pdf", null, 0.9, 0),
                match(i, "b", "a.pdf", null, 0.8, 1),
                match(i, "c", "b.pdf", null, 0.7, 2),
                match(i, "d", "c.pdf", null, 0.6, 3));

        RepealVerdict v = calibrator.calibrate(i, matches);

        assertThat(v.reasons()).hasSize(3);
        assertThat(v.specReferences()).containsExactly("a.pdf p.1", "b.pdf p.1", "c.pdf p.1");
        assertThat(v.matchCount()).isEqualTo(4);
    }

    @Test
    void customStages() {
        ScoringStage fixed = new ScoringStage() {
            @Override
            public String name() {
                return "fixed";
            }

            @Override
            public double apply(double score, CalibrationInput input) {
                return 250;
            }
        };

        RepealVerdict v = new ConfidenceCalibrator(List.of(fixed)).calibrate(infraction("x"), List.of());

        assertThat(v.confidence()).isEqualTo(100);
        assertThat(v.breakdown()).containsExactly(new StageScore("fixed", 100));
    }

    @Test
    void clampHandlesNaN() {
        assertThat(ConfidenceCalibrator.clamp(Double.NaN)).isZero();
        assertThat(ConfidenceCalibrator.clamp(-3)).isZero();
        assertThat(ConfidenceCalibrator.clamp(140)).isEqualTo(100);
    }
}
