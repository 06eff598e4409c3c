package org.learningjava.mediadb.domain.service;

public final class VectorMath {

    private VectorMath() {
    }

    public static double norm(float[] v) {
        double sum = 0.0;
        for (float x : v) sum += (double) x * x;
        return Math.sqrt(sum);
    }

    public static double l2Distance(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = (double) a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /** Returns a unit-length copy of {@code v}; a zero vector is rejected. */
    public static float[] normalize(float[] v) {
        double n = norm(v);
        if (n == 0.0 || Double.isNaN(n)) {
            throw new IllegalArgumentException("Cannot normalize a zero vector");
        }
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) out[i] = (float) (v[i] / n);
        return out;
    }
}
