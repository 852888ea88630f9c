package com.seekr.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VectorUtilsTest {

    @Test
    void formatsPgVectorLiteral() {
        assertThat(VectorUtils.toPgVector(new float[]{1.0f, -0.5f, 0.25f})).isEqualTo("[1.0,-0.5,0.25]");
    }

    @Test
    void cosineOfParallelAndOrthogonalVectors() {
        assertThat(VectorUtils.cosine(new float[]{1, 2, 3}, new float[]{2, 4, 6})).isCloseTo(1.0, within(1e-6));
        assertThat(VectorUtils.cosine(new float[]{1, 0}, new float[]{0, 1})).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void clampsSimilarityIntoUnitRange() {
        assertThat(VectorUtils.clampSimilarity(-0.3)).isZero();
        assertThat(VectorUtils.clampSimilarity(1.2)).isEqualTo(1.0);
        assertThat(VectorUtils.clampSimilarity(0.42)).isEqualTo(0.42);
    }
}
