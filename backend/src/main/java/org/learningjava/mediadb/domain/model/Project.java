package org.learningjava.mediadb.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record Project(
        UUID id,
        String projectName,
        String theme,
        List<UUID> assetIds,
        Instant createdAt,
        Instant publishedAt,
        int engagementLikes,
        int engagementComments,
        int engagementShares
) {
    public Project {
        assetIds = assetIds == null ? List.of() : List.copyOf(assetIds);
    }
}
