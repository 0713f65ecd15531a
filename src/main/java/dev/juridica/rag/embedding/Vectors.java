package dev.juridica.rag.embedding;

/**
 * Small vector helpers shared by the index implementations.
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * Normalizes the vector to unit length in place and returns it. A zero
     * vector is returned unchanged.
     */
    public static float[] normalize(float[] vector) {
        double norm = 0.0d;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    public static double dot(float[] a, float[] b) {
        requireSameDimension(a, b);
        double sum = 0.0d;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double squaredDistance(float[] a, float[] b) {
        requireSameDimension(a, b);
        double sum = 0.0d;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    public static void requireSameDimension(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimension mismatch: " + a.length + " vs " + b.length);
        }
    }
}
