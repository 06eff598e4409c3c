package org.learningjava.mediadb.domain.model;

/** Lightweight projection of one asset row used for aggregation. */
public record AssetFacts(
        MediaType mediaType,
        String source,
        long fileSizeBytes,
        Integer qualityRating,
        boolean embedded
) {
}
