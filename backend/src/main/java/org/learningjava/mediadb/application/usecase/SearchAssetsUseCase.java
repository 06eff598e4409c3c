package org.learningjava.mediadb.application.usecase;

import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.application.port.EmbeddingPort;
import org.learningjava.mediadb.domain.model.AssetFilter;
import org.learningjava.mediadb.domain.model.AssetPage;
import org.learningjava.mediadb.domain.model.MediaAsset;
import org.learningjava.mediadb.domain.model.MediaType;
import org.learningjava.mediadb.domain.model.ScoredAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class SearchAssetsUseCase {

    private static final Logger log = LoggerFactory.getLogger(SearchAssetsUseCase.class);

    private final AssetStorePort store;
    private final EmbeddingPort embedding;

    public SearchAssetsUseCase(AssetStorePort store, EmbeddingPort embedding) {
        this.store = store;
        this.embedding = embedding;
    }

    /**
     * Visual neighbours of a reference image. The media type predicate is applied during the scan,
     * so up to {@code limit} matching assets are returned.
     */
    public List<ScoredAsset> findSimilar(byte[] referenceBytes, int limit, MediaType mediaType) {
        requireLimit(limit);
        if (referenceBytes == null || referenceBytes.length == 0) {
            throw new IllegalArgumentException("reference image is empty");
        }
        float[] q = embedding.encodeImage(referenceBytes);
        List<ScoredAsset> hits = store.nearest(q, AssetFilter.none().withMediaType(mediaType), limit);
        log.debug("findSimilar: {} hits (limit={}, type={})", hits.size(), limit, mediaType);
        return hits;
    }

    /** Cross-modal search: a text description ranks stored images and video thumbnails. */
    public List<ScoredAsset> findByTheme(String text, int limit, Integer minQuality, MediaType mediaType) {
        requireLimit(limit);
        if (text == null || text.isBlank()) throw new IllegalArgumentException("query text is required");
        if (minQuality != null && minQuality < 0) {
            throw new IllegalArgumentException("min_quality must be non-negative, got " + minQuality);
        }
        float[] q = embedding.encodeText(text);
        AssetFilter filter = AssetFilter.none().withMediaType(mediaType).withMinQuality(minQuality);
        List<ScoredAsset> hits = store.nearest(q, filter, limit);
        log.info("findByTheme '{}': {} hits", text, hits.size());
        return hits;
    }

    public List<MediaAsset> findBySubject(String subject, MediaType mediaType) {
        if (subject == null || subject.isBlank()) throw new IllegalArgumentException("subject is required");
        return store.find(AssetFilter.none().withSubject(subject.trim()).withMediaType(mediaType));
    }

    public List<MediaAsset> findForEpisode(int episode, boolean unassignedOnly) {
        MediaAsset.requireValidEpisode(episode);
        AssetFilter filter = unassignedOnly
                ? AssetFilter.none().withoutEpisode(episode)
                : AssetFilter.none().withEpisode(episode);
        return store.find(filter);
    }

    public Optional<MediaAsset> getAsset(UUID id) {
        return store.findById(id);
    }

    public AssetPage listAssets(MediaType mediaType, String source, int limit, int offset) {
        requireLimit(limit);
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        return store.list(mediaType, source, limit, offset);
    }

    private static void requireLimit(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1, got " + limit);
    }
}
