package org.learningjava.mediadb.domain.model;

import java.util.Map;

public record CollectionStats(
        long totalAssets,
        long images,
        long videos,
        double totalSizeMb,
        Map<String, Long> sources,
        Double avgQuality,
        long ratedCount,
        long unratedCount,
        long unembeddedCount
) {
    public CollectionStats {
        sources = sources == null ? Map.of() : Map.copyOf(sources);
    }
}
