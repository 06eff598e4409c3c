package org.learningjava.mediadb.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.learningjava.mediadb.domain.model.MediaAsset;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Asset metadata as served over HTTP. Never carries binary content. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AssetView(
        UUID id,
        String filename,
        String mediaType,
        String source,
        String generationPrompt,
        String generationModel,
        Double generationTimeSeconds,
        Double generationCostUsd,
        Integer width,
        Integer height,
        Double durationSeconds,
        long fileSizeBytes,
        String format,
        String contentType,
        List<String> subjects,
        List<String> styleTags,
        Integer qualityRating,
        String qualityNotes,
        List<Integer> episodeAssignments,
        int useCount,
        Instant createdAt,
        Instant lastUsedAt,
        boolean hasEmbedding,
        boolean hasThumbnail
) {
    public static AssetView from(MediaAsset a) {
        var p = a.provenance();
        var s = a.specs();
        var c = a.classification();
        return new AssetView(
                a.id(),
                a.filename(),
                a.mediaType().wireName(),
                p.source(),
                p.generationPrompt(),
                p.generationModel(),
                p.generationTimeSeconds(),
                p.generationCostUsd(),
                s != null ? s.width() : null,
                s != null ? s.height() : null,
                s != null ? s.durationSeconds() : null,
                s != null ? s.fileSizeBytes() : 0L,
                s != null ? s.format() : null,
                c.contentType(),
                List.copyOf(c.subjects()),
                List.copyOf(c.styleTags()),
                a.qualityRating(),
                a.qualityNotes(),
                a.episodeAssignments().stream().sorted().toList(),
                a.useCount(),
                a.createdAt(),
                a.lastUsedAt(),
                a.embedding().isAvailable(),
                a.hasThumbnail()
        );
    }
}
