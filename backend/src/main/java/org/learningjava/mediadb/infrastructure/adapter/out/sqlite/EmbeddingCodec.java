package org.learningjava.mediadb.infrastructure.adapter.out.sqlite;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Little-endian float32 packing of embedding vectors into BLOB columns. */
final class EmbeddingCodec {

    private EmbeddingCodec() {
    }

    static byte[] encode(float[] v) {
        ByteBuffer buf = ByteBuffer.allocate(v.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float x : v) buf.putFloat(x);
        return buf.array();
    }

    static float[] decode(byte[] blob) {
        if (blob.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Embedding blob length " + blob.length + " is not a multiple of 4");
        }
        ByteBuffer buf = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        float[] v = new float[blob.length / Float.BYTES];
        for (int i = 0; i < v.length; i++) v[i] = buf.getFloat();
        return v;
    }
}
