package org.learningjava.mediadb.domain.model;

import java.util.Locale;

public enum MediaType {
    IMAGE("image"),
    VIDEO("video");

    private final String wireName;

    MediaType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses the lower-case wire value ("image" / "video"). Null or blank input yields null,
     * so optional request filters can pass straight through.
     */
    public static MediaType fromWire(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (MediaType t : values()) {
            if (t.wireName.equals(v)) return t;
        }
        throw new IllegalArgumentException("Unknown media type: " + value + " (expected 'image' or 'video')");
    }
}
