package org.learningjava.mediadb.infrastructure.adapter.out.ffmpeg;

import org.learningjava.mediadb.application.port.FrameExtractorPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Grabs a single JPEG frame with ffmpeg. Any failure yields an empty result and a WARN.
 */
public class FfmpegFrameExtractorAdapter implements FrameExtractorPort {

    private static final Logger log = LoggerFactory.getLogger(FfmpegFrameExtractorAdapter.class);

    private final String ffmpegPath;
    private final ProcessRunner runner;

    public FfmpegFrameExtractorAdapter(String ffmpegPath, Duration timeout) {
        this.ffmpegPath = ffmpegPath;
        this.runner = new ProcessRunner(timeout);
    }

    @Override
    public Optional<byte[]> extractFrame(Path video, Duration offset) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile("mediadb-frame-", ".jpg");
            runner.run(List.of(
                    ffmpegPath,
                    "-v", "error",
                    "-ss", String.format(Locale.ROOT, "%.3f", offset.toMillis() / 1000.0),
                    "-i", video.toString(),
                    "-frames:v", "1",
                    "-y", tmp.toString()
            ));
            byte[] frame = Files.readAllBytes(tmp);
            if (frame.length == 0) {
                log.warn("ffmpeg produced an empty frame for {}", video);
                return Optional.empty();
            }
            return Optional.of(frame);
        } catch (IOException e) {
            log.warn("Frame extraction failed for {}: {}", video, e.getMessage());
            return Optional.empty();
        } finally {
            deleteQuietly(tmp);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Could not delete temp frame {}: {}", p, e.getMessage());
        }
    }
}
