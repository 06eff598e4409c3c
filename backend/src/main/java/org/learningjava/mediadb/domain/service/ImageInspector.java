package org.learningjava.mediadb.domain.service;

import org.learningjava.mediadb.domain.exception.InvalidMediaException;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Reads image dimensions from the header without decoding pixels.
 */
public final class ImageInspector {

    public record Dimensions(int width, int height) {
    }

    private ImageInspector() {
    }

    public static Dimensions dimensions(byte[] bytes) {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (in == null) throw new InvalidMediaException("Unreadable image data");
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new InvalidMediaException("Unsupported or corrupt image (" + bytes.length + " bytes)");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return new Dimensions(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new InvalidMediaException("Cannot decode image header: " + e.getMessage(), e);
        }
    }
}
