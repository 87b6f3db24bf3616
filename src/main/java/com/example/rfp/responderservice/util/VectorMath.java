package com.example.rfp.responderservice.util;

import com.example.rfp.responderservice.exception.DimensionMismatchException;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]. Zero-magnitude vectors score 0 rather than NaN.
     *
     * @throws DimensionMismatchException if the vectors differ in length
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na  += (double) a[i] * a[i];
            nb  += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0;
        }
        double score = dot / Math.sqrt(na * nb);
        return Math.max(-1.0, Math.min(1.0, score));
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }
}
