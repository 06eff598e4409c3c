package org.learningjava.mediadb.testsupport;

import org.learningjava.mediadb.application.port.EmbeddingPort;
import org.learningjava.mediadb.domain.model.Embedding;
import org.learningjava.mediadb.domain.service.VectorMath;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic stand-in for the CLIP server: identical input always maps to the same unit vector,
 * different inputs map to (almost surely) distant ones.
 */
public class FakeEmbeddingPort implements EmbeddingPort {

    public final AtomicInteger imageCalls = new AtomicInteger();
    public final AtomicInteger textCalls = new AtomicInteger();

    @Override
    public float[] encodeImage(byte[] imageBytes) {
        imageCalls.incrementAndGet();
        return vectorFor(Arrays.hashCode(imageBytes));
    }

    @Override
    public float[] encodeText(String text) {
        textCalls.incrementAndGet();
        return vectorFor(Arrays.hashCode(text.getBytes(StandardCharsets.UTF_8)) * 31 + 7);
    }

    public static float[] vectorFor(long seed) {
        Random r = new Random(seed);
        float[] v = new float[Embedding.DIMENSION];
        for (int i = 0; i < v.length; i++) v[i] = (float) r.nextGaussian();
        return VectorMath.normalize(v);
    }

    /** Unit vector along one axis; handy for hand-computed distances. */
    public static float[] axis(int i) {
        float[] v = new float[Embedding.DIMENSION];
        v[i] = 1f;
        return v;
    }
}
