package org.learningjava.mediadb.domain.service;

import org.junit.jupiter.api.Test;
import org.learningjava.mediadb.domain.model.MediaType;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MediaFormatsTest {

    @Test
    void normalizes_jpg_to_jpeg_and_lowercases() {
        assertThat(MediaFormats.normalizedFormat("Photo.JPG")).isEqualTo("jpeg");
        assertThat(MediaFormats.normalizedFormat("clip.MP4")).isEqualTo("mp4");
        assertThat(MediaFormats.normalizedFormat("noext")).isEmpty();
    }

    @Test
    void classifies_by_extension() {
        assertThat(MediaFormats.classify(Path.of("a/b.webp"))).contains(MediaType.IMAGE);
        assertThat(MediaFormats.classify(Path.of("a/b.mov"))).contains(MediaType.VIDEO);
        assertThat(MediaFormats.classify(Path.of("a/notes.txt"))).isEmpty();
        assertThat(MediaFormats.classify(Path.of("a/.hidden"))).isEmpty();
    }

    @Test
    void mime_types_for_http() {
        assertThat(MediaFormats.mimeType(MediaType.IMAGE, "jpeg")).isEqualTo("image/jpeg");
        assertThat(MediaFormats.mimeType(MediaType.VIDEO, "mov")).isEqualTo("video/quicktime");
        assertThat(MediaFormats.mimeType(MediaType.VIDEO, null)).isEqualTo("video/octet-stream");
    }
}
