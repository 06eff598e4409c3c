package org.learningjava.mediadb.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Binary payload of an asset. Exactly one variant exists per asset, so an image can never carry
 * video bytes and only a video can carry a thumbnail.
 */
public sealed interface Content permits Content.Image, Content.Video {

    byte[] bytes();

    MediaType mediaType();

    static Content image(byte[] bytes) {
        return new Image(bytes);
    }

    static Content video(byte[] bytes, byte[] thumbnail) {
        return new Video(bytes, thumbnail);
    }

    record Image(byte[] bytes) implements Content {
        public Image {
            Objects.requireNonNull(bytes, "image bytes");
        }

        @Override
        public MediaType mediaType() {
            return MediaType.IMAGE;
        }
    }

    record Video(byte[] bytes, byte[] thumbnail) implements Content {
        public Video {
            Objects.requireNonNull(bytes, "video bytes");
        }

        public Optional<byte[]> thumbnailBytes() {
            return Optional.ofNullable(thumbnail);
        }

        @Override
        public MediaType mediaType() {
            return MediaType.VIDEO;
        }
    }
}
