package org.learningjava.mediadb.infrastructure.adapter.out.ffmpeg;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.mediadb.application.port.MediaProbePort;
import org.learningjava.mediadb.domain.model.VideoProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public class FfprobeMediaProbeAdapter implements MediaProbePort {

    private static final Logger log = LoggerFactory.getLogger(FfprobeMediaProbeAdapter.class);

    private final String ffprobePath;
    private final ProcessRunner runner;
    private final ObjectMapper om = new ObjectMapper();

    public FfprobeMediaProbeAdapter(String ffprobePath, Duration timeout) {
        this.ffprobePath = ffprobePath;
        this.runner = new ProcessRunner(timeout);
    }

    @Override
    public VideoProbe probe(Path video) {
        String output;
        try {
            output = runner.run(List.of(
                    ffprobePath,
                    "-v", "error",
                    "-select_streams", "v:0",
                    "-show_entries", "format=duration:stream=width,height",
                    "-of", "json",
                    video.toString()
            ));
        } catch (IOException e) {
            log.warn("ffprobe failed for {}: {}", video, e.getMessage());
            return VideoProbe.unknown();
        }
        return parse(output);
    }

    /**
     * Reads ffprobe's JSON writer output: {@code {"streams":[{"width":..,"height":..}],"format":{"duration":"12.5"}}}.
     */
    VideoProbe parse(String json) {
        try {
            JsonNode root = om.readTree(json);
            Double duration = null;
            JsonNode d = root.path("format").path("duration");
            if (!d.isMissingNode() && !d.isNull()) {
                try {
                    duration = Double.parseDouble(d.asText());
                } catch (NumberFormatException ex) {
                    log.warn("Unparseable ffprobe duration: {}", d.asText());
                }
            }
            Integer width = null;
            Integer height = null;
            JsonNode streams = root.path("streams");
            if (streams.isArray() && streams.size() > 0) {
                JsonNode s = streams.get(0);
                if (s.hasNonNull("width")) width = s.get("width").asInt();
                if (s.hasNonNull("height")) height = s.get("height").asInt();
            }
            return new VideoProbe(duration, width, height);
        } catch (IOException e) {
            log.warn("Unparseable ffprobe output: {}", e.getMessage());
            return VideoProbe.unknown();
        }
    }
}
