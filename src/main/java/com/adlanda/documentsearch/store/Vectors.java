package com.adlanda.documentsearch.store;

/**
 * Vector arithmetic shared by scoring code.
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * Dot product over the common prefix of the two vectors.
     */
    public static double dot(float[] a, float[] b) {
        int length = Math.min(a.length, b.length);
        double sum = 0.0;
        for (int i = 0; i < length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /**
     * Euclidean norm.
     */
    public static double norm(float[] vector) {
        return Math.sqrt(dot(vector, vector));
    }

    /**
     * Renders a vector as a PostgreSQL array literal, e.g. {@code {0.1,0.2}}.
     */
    public static String toArrayLiteral(float[] vector) {
        StringBuilder literal = new StringBuilder(vector.length * 12 + 2).append('{');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                literal.append(',');
            }
            literal.append(vector[i]);
        }
        return literal.append('}').toString();
    }
}
