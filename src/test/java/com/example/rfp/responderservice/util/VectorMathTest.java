package com.example.rfp.responderservice.util;

import com.example.rfp.responderservice.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VectorMathTest {

    @Test
    void identicalVectorsScoreOne() {
        assertThat(VectorMath.cosine(new float[]{1, 0}, new float[]{1, 0})).isEqualTo(1.0);
        float[] v = {0.3f, -0.4f, 0.5f};
        assertThat(VectorMath.cosine(v, v)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void orthogonalAndOppositeVectors() {
        assertThat(VectorMath.cosine(new float[]{1, 0}, new float[]{0, 1})).isEqualTo(0.0);
        assertThat(VectorMath.cosine(new float[]{2, 0}, new float[]{-1, 0})).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    void zeroVectorScoresZero() {
        assertThat(VectorMath.cosine(new float[]{0, 0}, new float[]{1, 1})).isEqualTo(0.0);
        assertThat(VectorMath.cosine(new float[0], new float[0])).isEqualTo(0.0);
    }

    @Test
    void mismatchedLengthsFail() {
        assertThatThrownBy(() -> VectorMath.cosine(new float[]{1, 0}, new float[]{1, 0, 0}))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessageContaining("expected 2 but got 3");
    }

    @Test
    void meanOfEmptyIsZero() {
        assertThat(VectorMath.mean(new double[0])).isEqualTo(0.0);
        assertThat(VectorMath.mean(new double[]{0.5, 1.0})).isEqualTo(0.75);
    }
}
