package com.deck.mirror.similarity;

/**
 * Float vector helpers. Vectors of different length are a programming error.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double dot(float[] a, float[] b) {
        checkLength(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    public static double norm(float[] v) {
        double sum = 0.0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }

    /**
     * Cosine similarity; 0.0 when either vector has zero length.
     */
    public static double cosine(float[] a, float[] b) {
        double normA = norm(a);
        double normB = norm(b);
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot(a, b) / (normA * normB);
    }

    /**
     * Returns a unit-length copy; a zero vector stays zero.
     */
    public static float[] normalize(float[] v) {
        double n = norm(v);
        float[] out = new float[v.length];
        if (n == 0.0) {
            return out;
        }
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / n);
        }
        return out;
    }

    private static void checkLength(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector length mismatch: " + a.length + " vs " + b.length);
        }
    }
}
