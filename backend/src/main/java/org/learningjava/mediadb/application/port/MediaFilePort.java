package org.learningjava.mediadb.application.port;

import java.nio.file.Path;
import java.util.List;

public interface MediaFilePort {
    /** Regular files under {@code root} with a supported media extension, sorted by path. */
    List<Path> discover(Path root, boolean recursive);

    byte[] readAll(Path file);
}
