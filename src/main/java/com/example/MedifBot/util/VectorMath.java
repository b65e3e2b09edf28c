package com.example.MedifBot.util;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Scale {@code vector} to unit length.
     *
     * @throws IllegalArgumentException if the length is not {@code expectedDim}
     *                                  or the norm is zero / not finite
     */
    public static float[] normalize(float[] vector, int expectedDim) {
        if (vector == null || vector.length != expectedDim) {
            int actual = vector == null ? 0 : vector.length;
            throw new IllegalArgumentException(
                    "Embedding dimension " + actual + " does not match expected " + expectedDim);
        }
        double sumOfSquares = 0.0;
        for (float v : vector) {
            sumOfSquares += (double) v * v;
        }
        double norm = Math.sqrt(sumOfSquares);
        if (!Double.isFinite(norm) || norm == 0.0) {
            throw new IllegalArgumentException("Embedding norm must be finite and non-zero.");
        }
        float[] normalized = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = (float) (vector[i] / norm);
        }
        return normalized;
    }

    /**
     * Dot product. Equals cosine similarity for unit vectors.
     *
     * @throws IllegalArgumentException if the vectors differ in length
     */
    public static double dot(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Embedding dimension " + b.length + " does not match expected " + a.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }
}
