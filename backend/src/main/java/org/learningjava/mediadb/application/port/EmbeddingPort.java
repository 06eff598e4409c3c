package org.learningjava.mediadb.application.port;

/**
 * Maps images and text into one shared 512-dim space. Implementations return unit-length vectors
 * and signal failure with {@link org.learningjava.mediadb.domain.exception.ExternalServiceException}.
 */
public interface EmbeddingPort {
    float[] encodeImage(byte[] imageBytes);

    float[] encodeText(String text);
}
