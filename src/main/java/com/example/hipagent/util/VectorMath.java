package com.example.hipagent.util;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * dot(a, b) / (|a| * |b|). A zero vector on either side gives 0.
     *
     * @throws IllegalArgumentException if the vectors differ in length
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push |similarity| a hair past 1
        return Math.max(-1.0, Math.min(1.0, similarity));
    }
}
