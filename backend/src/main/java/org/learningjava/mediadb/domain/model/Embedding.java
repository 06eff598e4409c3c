package org.learningjava.mediadb.domain.model;

import org.learningjava.mediadb.domain.service.VectorMath;

import java.util.Objects;

/**
 * Position of an asset in the shared image/text embedding space.
 * <p>
 * {@link Computed} always holds a {@value #DIMENSION}-dim unit vector. {@link Unavailable} marks a
 * video whose frame could not be extracted or embedded; such assets are stored but never ranked.
 */
public sealed interface Embedding permits Embedding.Computed, Embedding.Unavailable {

    int DIMENSION = 512;

    /** Allowed deviation of the L2 norm from 1.0. */
    double NORM_TOLERANCE = 1e-3;

    boolean isAvailable();

    static Embedding computed(float[] vector) {
        return new Computed(vector);
    }

    static Embedding unavailable() {
        return Unavailable.INSTANCE;
    }

    record Computed(float[] vector) implements Embedding {
        public Computed {
            Objects.requireNonNull(vector, "vector");
            if (vector.length != DIMENSION) {
                throw new IllegalArgumentException("Embedding must have " + DIMENSION + " dims, got " + vector.length);
            }
            double norm = VectorMath.norm(vector);
            if (Math.abs(norm - 1.0) > NORM_TOLERANCE) {
                throw new IllegalArgumentException("Embedding is not unit-norm: |v|=" + norm);
            }
            vector = vector.clone();
        }

        @Override
        public float[] vector() {
            return vector.clone();
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }

    final class Unavailable implements Embedding {
        private static final Unavailable INSTANCE = new Unavailable();

        private Unavailable() {
        }

        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public String toString() {
            return "Embedding.Unavailable";
        }
    }
}
