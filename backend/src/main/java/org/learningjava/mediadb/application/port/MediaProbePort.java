package org.learningjava.mediadb.application.port;

import org.learningjava.mediadb.domain.model.VideoProbe;

import java.nio.file.Path;

public interface MediaProbePort {
    VideoProbe probe(Path video);
}
