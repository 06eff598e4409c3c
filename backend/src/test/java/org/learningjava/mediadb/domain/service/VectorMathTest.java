package org.learningjava.mediadb.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VectorMathTest {

    @Test
    void l2Distance_of_orthogonal_unit_vectors_is_sqrt2() {
        float[] a = {1f, 0f};
        float[] b = {0f, 1f};
        assertEquals(Math.sqrt(2), VectorMath.l2Distance(a, b), 1e-9);
        assertEquals(0.0, VectorMath.l2Distance(a, a), 1e-12);
    }

    @Test
    void l2Distance_rejects_dimension_mismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> VectorMath.l2Distance(new float[2], new float[3]));
    }

    @Test
    void normalize_returns_unit_vector() {
        float[] n = VectorMath.normalize(new float[]{3f, 4f});
        assertEquals(0.6f, n[0], 1e-6);
        assertEquals(0.8f, n[1], 1e-6);
        assertEquals(1.0, VectorMath.norm(n), 1e-6);
    }

    @Test
    void normalize_rejects_zero_vector() {
        assertThrows(IllegalArgumentException.class, () -> VectorMath.normalize(new float[4]));
    }
}
