package org.learningjava.mediadb.application.port;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public interface FrameExtractorPort {
    /** Encoded image of the frame at {@code offset}, or empty when no frame could be produced. */
    Optional<byte[]> extractFrame(Path video, Duration offset);
}
