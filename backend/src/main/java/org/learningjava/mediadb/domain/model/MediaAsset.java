package org.learningjava.mediadb.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Metadata row of a stored image or video. Binary content is loaded separately, see
 * {@link Content}.
 */
public record MediaAsset(
        UUID id,
        String filename,
        MediaType mediaType,
        Embedding embedding,
        Provenance provenance,
        TechnicalSpecs specs,
        Classification classification,
        Integer qualityRating,
        String qualityNotes,
        Set<Integer> episodeAssignments,
        int useCount,
        Instant createdAt,
        Instant lastUsedAt,
        boolean hasThumbnail
) {
    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 10;
    public static final int MIN_EPISODE = 1;
    public static final int MAX_EPISODE = 8;

    public MediaAsset {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(mediaType, "mediaType");
        Objects.requireNonNull(embedding, "embedding");
        Objects.requireNonNull(createdAt, "createdAt");
        provenance = provenance != null ? provenance : Provenance.ofSource(null);
        classification = classification != null ? classification : Classification.empty();
        episodeAssignments = episodeAssignments == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(episodeAssignments));
        if (useCount < 0) throw new IllegalArgumentException("useCount must be >= 0");
    }

    public static void requireValidRating(int rating) {
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new IllegalArgumentException("Rating must be between " + MIN_RATING + " and " + MAX_RATING + ", got " + rating);
        }
    }

    public static void requireValidEpisode(int episode) {
        if (episode < MIN_EPISODE || episode > MAX_EPISODE) {
            throw new IllegalArgumentException("Episode must be between " + MIN_EPISODE + " and " + MAX_EPISODE + ", got " + episode);
        }
    }

    public boolean isRated() {
        return qualityRating != null;
    }
}
