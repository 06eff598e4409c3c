package org.learningjava.mediadb.domain.service;

import org.learningjava.mediadb.domain.model.MediaType;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public final class MediaFormats {

    public static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp", "gif");
    public static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "mov", "webm", "avi");

    private MediaFormats() {
    }

    public static String extension(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return "";
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /** Lower-case extension with {@code jpg} folded into {@code jpeg}. */
    public static String normalizedFormat(String filename) {
        String ext = extension(filename);
        return "jpg".equals(ext) ? "jpeg" : ext;
    }

    public static Optional<MediaType> classify(Path path) {
        String ext = extension(path.getFileName().toString());
        if (IMAGE_EXTENSIONS.contains(ext)) return Optional.of(MediaType.IMAGE);
        if (VIDEO_EXTENSIONS.contains(ext)) return Optional.of(MediaType.VIDEO);
        return Optional.empty();
    }

    /** HTTP content type for a stored format, e.g. {@code image/jpeg} or {@code video/mp4}. */
    public static String mimeType(MediaType type, String format) {
        String fmt = format == null || format.isBlank() ? "octet-stream" : format;
        if ("mov".equals(fmt)) fmt = "quicktime";
        if ("avi".equals(fmt)) fmt = "x-msvideo";
        return type.wireName() + "/" + fmt;
    }
}
