package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.EquipmentCategory;
import it.aw.specrepeal.model.Infraction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static it.aw.specrepeal.calibration.CalibrationFixtures.infraction;
import static it.aw.specrepeal.calibration.CalibrationFixtures.match;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringStagesTest {

    @Nested
    @DisplayName("base-score")
    class BaseScore {

        @ParameterizedTest
        @CsvSource({"0.95,95", "0.90,95", "0.85,85", "0.72,70", "0.65,55", "0.50,40", "0.41,20"})
        void bands(double similarity, double expected) {
            Infraction i = infraction("Go-back: test");
            double score = new BaseScoreStage().apply(0, new CalibrationInput(i, List.of(match(i, "x", similarity))));
            assertThat(score).isEqualTo(expected);
        }

        @Test
        void noMatchesScoreZero() {
            assertThat(new BaseScoreStage().apply(50, new CalibrationInput(infraction("x"), List.of())))
                    .isZero();
        }

        @Test
        void usesBestSimilarity() {
            Infraction i = infraction("Go-back: test");
            CalibrationInput input = new CalibrationInput(i, List.of(match(i, "a", 0.5), match(i, "b", 0.91)));
            assertThat(new BaseScoreStage().apply(0, input)).isEqualTo(95);
        }
    }

    @Nested
    @DisplayName("match-count")
    class MatchCount {

        @Test
        void multipliersByCount() {
            Infraction i = infraction("x");
            MatchCountStage stage = new MatchCountStage();

            assertThat(stage.apply(50, new CalibrationInput(i, List.of(match(i, "a", 0.5)))))
                    .isEqualTo(50);
            assertThat(stage.apply(50, new CalibrationInput(i, List.of(match(i, "a", 0.5), match(i, "b", 0.5)))))
                    .isCloseTo(55, within(1e-9));
            assertThat(stage.apply(50, new CalibrationInput(i,
                    List.of(match(i, "a", 0.5), match(i, "b", 0.5), match(i, "c", 0.5)))))
                    .isCloseTo(60, within(1e-9));
        }
    }

    @Nested
    @DisplayName("document-reference")
    class DocumentReference {

        @Test
        void bonusWhenDocumentNumberMatches() {
            Infraction i = infraction("Go-back: per Document 022178", EquipmentCategory.GENERAL, "022178");
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "guy text", "guys.pdf", "022178", 0.7, 0)));

            assertThat(new DocumentReferenceStage().apply(60, input)).isCloseTo(69, within(1e-9));
        }

        @Test
        void bonusWhenReferenceAppearsInSourceName() {
            Infraction i = infraction("Go-back: per 022178", EquipmentCategory.GENERAL, "022178");
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "guy text", "Guys 022178 REV 13.pdf", null, 0.7, 0)));

            assertThat(new DocumentReferenceStage().apply(60, input)).isCloseTo(69, within(1e-9));
        }

        @Test
        void noBonusWithoutReference() {
            Infraction i = infraction("Go-back: x");
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "guy text", "guys.pdf", "022178", 0.7, 0)));

            assertThat(new DocumentReferenceStage().apply(60, input)).isEqualTo(60);
        }
    }

    @Nested
    @DisplayName("entity-overlap")
    class EntityOverlap {

        @Test
        void fivePointsPerSharedEntityType() {
            Infraction i = infraction("Go-back: clearance 18 feet over 12 kV line per GO 95");
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "Minimum 18 FEET above 12 kv conductors", 0.7)));

            assertThat(new EntityOverlapStage().apply(50, input)).isEqualTo(60);
        }

        @Test
        void differentValuesDoNotCount() {
            Infraction i = infraction("Go-back: pole clearance only 10 feet");
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "minimum 18 feet above roadway", 0.65)));

            assertThat(new EntityOverlapStage().apply(55, input)).isEqualTo(55);
        }

        @Test
        @DisplayName("un valore contenuto in un numero piu' lungo non conta")
        void partialNumberDoesNotCount() {
            Infraction i = infraction("Go-back: pole clearance only 10 feet");
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "minimum 110 feet above roadway", 0.65)));

            assertThat(new EntityOverlapStage().apply(55, input)).isEqualTo(55);
        }

        @Test
        void spacingAndCaseIgnored() {
            Infraction i = infraction("Go-back: clearance 18feet at crossing");
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "Minimum 18 FEET at crossings", 0.7)));

            assertThat(new EntityOverlapStage().apply(50, input)).isEqualTo(55);
        }

        @Test
        void cappedAtFifteen() {
            Infraction i = infraction("Go-back: 18 feet, 12 kV, GO 95");
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "18 feet and 12 kV per GO 95", 0.9)));

            assertThat(new EntityOverlapStage().apply(50, input)).isEqualTo(65);
        }
    }

    @Nested
    @DisplayName("category")
    class Category {

        @Test
        void bonusWhenCategoryTermInMetadata() {
            Infraction i = infraction("Go-back: pole clearance", EquipmentCategory.OVERHEAD_POLE, null);
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "some text", "Pole Clearances 025055.pdf", null, 0.7, 0)));

            assertThat(new CategoryStage().apply(50, input)).isCloseTo(55, within(1e-9));
        }

        @Test
        void noBonusForUnflaggedInfraction() {
            Infraction i = infraction("Go-back: label missing");
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "some text", "Pole Clearances.pdf", null, 0.7, 0)));

            assertThat(new CategoryStage().apply(50, input)).isEqualTo(50);
        }

        @Test
        @DisplayName("un termine presente solo nei metadati non basta")
        void termMustAppearInInfraction() {
            Infraction i = infraction("Go-back: pole clearance", EquipmentCategory.OVERHEAD_POLE, null);
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "some text", "Guys 022178.pdf", "022178", 0.7, 0)));

            assertThat(new CategoryStage().apply(55, input)).isEqualTo(55);
        }

        @Test
        void chunkTextAloneDoesNotCount() {
            Infraction i = infraction("Go-back: pole clearance", EquipmentCategory.OVERHEAD_POLE, null);
            CalibrationInput input = new CalibrationInput(i,
                    List.of(match(i, "pole clearance table", "spec.pdf", null, 0.7, 0)));

            assertThat(new CategoryStage().apply(50, input)).isEqualTo(50);
        }
    }
}
