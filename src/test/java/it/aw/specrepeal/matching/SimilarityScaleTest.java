package it.aw.specrepeal.matching;

import it.aw.specrepeal.corpus.IndexHit;
import it.aw.specrepeal.corpus.ScoreKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityScaleTest {

    @Test
    void relevanceToCosine() {
        assertThat(SimilarityScale.toCosine(1.0, ScoreKind.RELEVANCE)).isCloseTo(1.0, within(1e-9));
        assertThat(SimilarityScale.toCosine(0.5, ScoreKind.RELEVANCE)).isCloseTo(0.0, within(1e-9));
        assertThat(SimilarityScale.toCosine(0.825, ScoreKind.RELEVANCE)).isCloseTo(0.65, within(1e-9));
    }

    @Test
    void l2DistanceOnUnitVectors() {
        assertThat(SimilarityScale.toCosine(0.0, ScoreKind.L2_DISTANCE)).isCloseTo(1.0, within(1e-9));
        assertThat(SimilarityScale.toCosine(Math.sqrt(2), ScoreKind.L2_DISTANCE)).isCloseTo(0.0, within(1e-9));
        assertThat(SimilarityScale.toCosine(2.0, ScoreKind.L2_DISTANCE)).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    void cosineIsIdentityAndClamped() {
        assertThat(SimilarityScale.toCosine(0.42, ScoreKind.COSINE)).isEqualTo(0.42);
        assertThat(SimilarityScale.toCosine(1.0000001, ScoreKind.COSINE)).isEqualTo(1.0);
        assertThat(SimilarityScale.toCosine(new IndexHit(0, 0.9, ScoreKind.RELEVANCE)))
                .isCloseTo(0.8, within(1e-9));
    }
}
