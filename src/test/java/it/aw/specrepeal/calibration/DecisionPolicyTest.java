package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.AnalysisConfig;
import it.aw.specrepeal.model.RepealStatus;
import it.aw.specrepeal.model.ReviewMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionPolicyTest {

    private final AnalysisConfig config = AnalysisConfig.defaults();

    @ParameterizedTest(name = "confidenza {0}, {1} match -> {2}")
    @CsvSource({
            "95, 3, REPEALABLE",
            "85, 2, REPEALABLE",
            "90, 1, REVIEW_RECOMMENDED",
            "84.9, 5, REVIEW_RECOMMENDED",
            "60, 0, REVIEW_RECOMMENDED",
            "59.9, 4, VALID_INFRACTION",
            "0, 0, VALID_INFRACTION"
    })
    void threeTierTable(double confidence, int matches, RepealStatus expected) {
        assertThat(DecisionPolicy.decide(confidence, matches, config)).isEqualTo(expected);
    }

    @Nested
    @DisplayName("modalita' a due stati")
    class Collapsed {

        @Test
        void collapseToValid() {
            AnalysisConfig c = config.withReviewMode(ReviewMode.COLLAPSE_TO_VALID);

            assertThat(DecisionPolicy.decide(70, 1, c)).isEqualTo(RepealStatus.VALID_INFRACTION);
            assertThat(DecisionPolicy.decide(90, 3, c)).isEqualTo(RepealStatus.REPEALABLE);
            assertThat(DecisionPolicy.decide(10, 0, c)).isEqualTo(RepealStatus.VALID_INFRACTION);
        }

        @Test
        void collapseToRepealable() {
            AnalysisConfig c = config.withReviewMode(ReviewMode.COLLAPSE_TO_REPEALABLE);

            assertThat(DecisionPolicy.decide(70, 1, c)).isEqualTo(RepealStatus.REPEALABLE);
            assertThat(DecisionPolicy.decide(10, 0, c)).isEqualTo(RepealStatus.VALID_INFRACTION);
        }

        @Test
        void neverReturnsReview() {
            for (ReviewMode mode : new ReviewMode[]{ReviewMode.COLLAPSE_TO_VALID, ReviewMode.COLLAPSE_TO_REPEALABLE}) {
                AnalysisConfig c = config.withReviewMode(mode);
                for (int conf = 0; conf <= 100; conf += 5) {
                    for (int matches = 0; matches <= 4; matches++) {
                        assertThat(DecisionPolicy.decide(conf, matches, c))
                                .isNotEqualTo(RepealStatus.REVIEW_RECOMMENDED);
                    }
                }
            }
        }
    }

    @Test
    void customThresholds() {
        AnalysisConfig strict = new AnalysisConfig(5, 8, 0.4, 95, 75, 3, 100, ReviewMode.THREE_TIER);

        assertThat(DecisionPolicy.decide(90, 3, strict)).isEqualTo(RepealStatus.REVIEW_RECOMMENDED);
        assertThat(DecisionPolicy.decide(95, 2, strict)).isEqualTo(RepealStatus.REVIEW_RECOMMENDED);
        assertThat(DecisionPolicy.decide(95, 3, strict)).isEqualTo(RepealStatus.REPEALABLE);
        assertThat(DecisionPolicy.decide(70, 3, strict)).isEqualTo(RepealStatus.VALID_INFRACTION);
    }
}
