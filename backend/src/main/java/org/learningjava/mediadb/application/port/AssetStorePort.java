package org.learningjava.mediadb.application.port;

import org.learningjava.mediadb.domain.model.AssetFacts;
import org.learningjava.mediadb.domain.model.AssetFilter;
import org.learningjava.mediadb.domain.model.AssetPage;
import org.learningjava.mediadb.domain.model.Content;
import org.learningjava.mediadb.domain.model.EpisodeUpdate;
import org.learningjava.mediadb.domain.model.MediaAsset;
import org.learningjava.mediadb.domain.model.MediaType;
import org.learningjava.mediadb.domain.model.ScoredAsset;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public interface AssetStorePort {
    void ensureSchema();

    /** Atomically appends one row. */
    void append(MediaAsset asset, Content content);

    Optional<MediaAsset> findById(UUID id);

    Optional<Content> loadContent(UUID id);

    /**
     * Exact nearest neighbours among assets with a computed embedding that match {@code filter},
     * by ascending L2 distance.
     */
    List<ScoredAsset> nearest(float[] query, AssetFilter filter, int limit);

    /** Assets matching {@code filter}, oldest first. */
    List<MediaAsset> find(AssetFilter filter);

    AssetPage list(MediaType mediaType, String source, int limit, int offset);

    List<AssetFacts> scanFacts();

    /** @return false when no asset has this id */
    boolean updateRating(UUID id, int rating, String notes);

    EpisodeUpdate addEpisode(UUID id, int episode);

    /** @return false when no asset has this id */
    boolean markUsed(UUID id, Instant usedAt);

    Set<String> existingFilenames();

    /** Flushes pending writes into the main database file. */
    void checkpoint();
}
