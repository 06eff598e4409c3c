package org.learningjava.mediadb.domain.model;

/** Result of probing a video container. Any field may be null when unknown. */
public record VideoProbe(Double durationSeconds, Integer width, Integer height) {
    public static VideoProbe unknown() {
        return new VideoProbe(null, null, null);
    }
}
